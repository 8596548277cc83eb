package com.gt.subjunctive.lexicon;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.subjunctive.exception.LexiconException;
import com.gt.subjunctive.exception.UnknownVerbException;
import com.gt.subjunctive.lexicon.model.LexiconEntry;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

@Component
public class VerbLexicon {

    private static final Logger log = LoggerFactory.getLogger(VerbLexicon.class);

    public static final String DEFAULT_RESOURCE = "verbs.json";
    public static final String AUXILIARY_VERB = "haber";

    private static final List<String> RA_SUFFIXES = List.of("ra", "ras", "ra", "ramos", "rais", "ran");

    private final Map<String, Verb> verbsByInfinitive;

    @Autowired
    public VerbLexicon(ObjectMapper objectMapper,
                       @Value("${subjunctive.lexicon.resource:verbs.json}") String resourceName) {
        this(buildVerbs(readEntries(objectMapper, resourceName)));

        log.info("Loaded {} verbs from {}", verbsByInfinitive.size(), resourceName);
    }

    public VerbLexicon(Collection<Verb> verbs) {
        Map<String, Verb> verbMap = new LinkedHashMap<>();
        for (Verb verb : verbs) {
            if (verbMap.put(verb.infinitive(), verb) != null) {
                throw lexiconError("Duplicate lexicon entry for " + verb.infinitive());
            }
        }
        if (!verbMap.containsKey(AUXILIARY_VERB)) {
            throw lexiconError("Lexicon must contain the auxiliary verb " + AUXILIARY_VERB);
        }

        this.verbsByInfinitive = Collections.unmodifiableMap(verbMap);
    }

    public static VerbLexicon loadDefault() {
        return new VerbLexicon(new ObjectMapper(), DEFAULT_RESOURCE);
    }

    public Optional<Verb> findVerb(String infinitive) {
        if (infinitive == null) {
            return Optional.empty();
        }

        return Optional.ofNullable(verbsByInfinitive.get(infinitive.trim().toLowerCase(Locale.ROOT)));
    }

    public Verb getVerb(String infinitive) {
        Optional<Verb> verb = findVerb(infinitive);
        if (verb.isEmpty()) {
            log.error("Verb not in lexicon: {}", infinitive);
            throw new UnknownVerbException(infinitive);
        }

        return verb.get();
    }

    public boolean contains(String infinitive) {
        return findVerb(infinitive).isPresent();
    }

    public List<Verb> getVerbs() {
        return List.copyOf(verbsByInfinitive.values());
    }

    public int size() {
        return verbsByInfinitive.size();
    }

    private static List<LexiconEntry> readEntries(ObjectMapper objectMapper, String resourceName) {
        try (InputStream inputStream = new ClassPathResource(resourceName).getInputStream()) {
            return objectMapper.readValue(inputStream, new TypeReference<List<LexiconEntry>>() { });
        } catch (IOException ex) {
            String errMsg = "Unable to read verb lexicon " + resourceName;

            log.error(errMsg, ex);
            throw new LexiconException(errMsg, ex);
        }
    }

    static List<Verb> buildVerbs(List<LexiconEntry> entries) {
        List<Verb> verbs = new ArrayList<>();
        for (LexiconEntry entry : entries) {
            verbs.add(toVerb(entry));
        }

        return verbs;
    }

    static Verb toVerb(LexiconEntry entry) {
        String infinitive = entry.infinitive();
        if (infinitive == null || infinitive.isBlank() || !infinitive.equals(infinitive.trim().toLowerCase(Locale.ROOT))) {
            throw lexiconError("Invalid infinitive '" + infinitive + "'");
        }

        ConjugationClass conjugationClass = ConjugationClass.fromInfinitive(infinitive);
        if (conjugationClass == null) {
            throw lexiconError(infinitive + " does not end in -ar, -er or -ir");
        }

        Regularity regularity = Regularity.fromCode(entry.regularity());
        if (regularity == null) {
            throw lexiconError(infinitive + " has unknown regularity '" + entry.regularity() + "'");
        }

        StemChange stemChange = StemChange.fromCode(entry.stemChange());
        if (stemChange == null) {
            throw lexiconError(infinitive + " has unknown stem change '" + entry.stemChange() + "'");
        }

        String vowel = stemChange == StemChange.Other ? entry.stemChangeVowel() : stemChange.getVowel();
        String replacement = stemChange == StemChange.Other ? entry.stemChangeReplacement() : stemChange.getReplacement();
        if (stemChange == StemChange.Other && (isBlank(vowel) || isBlank(replacement))) {
            throw lexiconError(infinitive + " has an 'other' stem change without its vowel pair");
        }

        Map<Tense, Map<Person, String>> overrides = parseOverrides(infinitive, entry.overrides());
        Map<Person, String> presentIndicative = parsePersonForms(infinitive, entry.presentIndicative());
        Map<Person, String> imperfectIndicative = parsePersonForms(infinitive, entry.imperfectIndicative());

        if (regularity.isRegular()) {
            if (regularity.getRegularClass() != conjugationClass) {
                throw lexiconError(infinitive + " is marked " + regularity.getCode() + " but ends in " + conjugationClass.getLabel());
            }
            if (stemChange != StemChange.None || entry.presentStem() != null || entry.imperfectBase() != null
                    || !overrides.isEmpty() || !presentIndicative.isEmpty() || !imperfectIndicative.isEmpty()) {
                throw lexiconError(infinitive + " is marked regular but carries irregular data");
            }
        }

        return new Verb(infinitive,
                entry.translation() == null ? "" : entry.translation(),
                regularity,
                stemChange,
                vowel,
                replacement,
                emptyToNull(entry.presentStem()),
                emptyToNull(entry.imperfectBase()),
                emptyToNull(entry.pastParticiple()),
                overrides,
                presentIndicative,
                imperfectIndicative,
                entry.common());
    }

    private static Map<Tense, Map<Person, String>> parseOverrides(String infinitive, Map<String, Map<String, String>> rawOverrides) {
        if (rawOverrides == null || rawOverrides.isEmpty()) {
            return Map.of();
        }

        Map<Tense, Map<Person, String>> overrides = new EnumMap<>(Tense.class);
        for (Map.Entry<String, Map<String, String>> tenseEntry : rawOverrides.entrySet()) {
            Tense tense = Tense.fromCode(tenseEntry.getKey());
            if (tense == null) {
                throw lexiconError(infinitive + " has an override for unknown tense '" + tenseEntry.getKey() + "'");
            }
            if (tense.isCompound()) {
                throw lexiconError(infinitive + " overrides compound tense " + tense.getCode() + "; override the participle instead");
            }

            Map<Person, String> forms = parsePersonForms(infinitive, tenseEntry.getValue());
            if (tense == Tense.ImperfectSubjunctive) {
                for (Map.Entry<Person, String> form : forms.entrySet()) {
                    if (!form.getValue().endsWith(RA_SUFFIXES.get(form.getKey().ordinal()))) {
                        throw lexiconError(infinitive + " imperfect override '" + form.getValue() + "' is not a -ra form");
                    }
                }
            }
            overrides.put(tense, forms);
        }

        return Collections.unmodifiableMap(overrides);
    }

    private static Map<Person, String> parsePersonForms(String infinitive, Map<String, String> rawForms) {
        if (rawForms == null || rawForms.isEmpty()) {
            return Map.of();
        }

        Map<Person, String> forms = new EnumMap<>(Person.class);
        for (Map.Entry<String, String> formEntry : rawForms.entrySet()) {
            Person person = Person.fromCode(formEntry.getKey());
            if (person == null) {
                throw lexiconError(infinitive + " has a form for unknown person '" + formEntry.getKey() + "'");
            }
            if (isBlank(formEntry.getValue())) {
                throw lexiconError(infinitive + " has a blank form for " + person.getCode());
            }
            forms.put(person, formEntry.getValue().trim());
        }

        return Collections.unmodifiableMap(forms);
    }

    private static LexiconException lexiconError(String errMsg) {
        log.error(errMsg);
        return new LexiconException(errMsg);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String emptyToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
