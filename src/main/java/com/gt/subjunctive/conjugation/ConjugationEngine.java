package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.exception.UnsupportedCombinationException;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule-based generator of subjunctive forms. Irregular verbs are handled through lexicon data
 * (stem overrides, preterite bases, full-form overrides and participles), never through code paths
 * specific to a verb.
 * <p>
 * Stateless apart from the immutable lexicon, so a single instance is shared across requests.
 */
@Component
public class ConjugationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConjugationEngine.class);

    private final VerbLexicon lexicon;

    @Autowired
    public ConjugationEngine(VerbLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public ConjugationResult conjugate(String infinitive, Tense tense, Person person) {
        verifyCombination(infinitive, tense, person);

        return conjugate(lexicon.getVerb(infinitive), tense, person);
    }

    public ConjugationResult conjugate(Verb verb, Tense tense, Person person) {
        verifyCombination(verb.infinitive(), tense, person);

        switch (tense) {
            case PresentSubjunctive:
                return conjugatePresent(verb, person);
            case ImperfectSubjunctive:
                return conjugateImperfect(verb, person);
            case PresentPerfectSubjunctive:
            case PluperfectSubjunctive:
                return conjugateCompound(verb, tense, person);
            default:
                throw unsupported(verb.infinitive(), tense, person);
        }
    }

    public List<ConjugationResult> conjugateAll(String infinitive, Tense tense) {
        Verb verb = lexicon.getVerb(infinitive);

        List<ConjugationResult> results = new ArrayList<>();
        for (Person person : Person.values()) {
            results.add(conjugate(verb, tense, person));
        }

        return results;
    }

    public boolean supports(String infinitive, Tense tense, Person person) {
        if (tense == null || person == null || !lexicon.contains(infinitive)) {
            return false;
        }

        return !tense.isCompound() || lexicon.contains(VerbLexicon.AUXILIARY_VERB);
    }

    public String pastParticiple(Verb verb) {
        if (verb.pastParticiple() != null) {
            return verb.pastParticiple();
        }

        String stem = StemRules.regularStem(verb);
        if (verb.conjugationClass() == ConjugationClass.Ar) {
            return stem + "ado";
        }

        return stem + (StemRules.endsInStrongVowel(stem) ? "ído" : "ido");
    }

    public VerbInfo describe(String infinitive) {
        Verb verb = lexicon.getVerb(infinitive);

        return new VerbInfo(verb.infinitive(),
                verb.translation(),
                verb.conjugationClass().getLabel(),
                verb.regularity().getCode(),
                verb.stemChange() == StemChange.Other
                        ? verb.stemChangeVowel() + "→" + verb.stemChangeReplacement()
                        : verb.stemChange().getCode(),
                SpellingRule.forInfinitive(verb.infinitive()).map(SpellingRule::getCode).orElse(null),
                pastParticiple(verb),
                verb.minimumDifficulty());
    }

    private ConjugationResult conjugatePresent(Verb verb, Person person) {
        String ending = EndingTable.presentSubjunctive(verb.conjugationClass(), person);

        Optional<String> override = verb.getOverride(Tense.PresentSubjunctive, person);
        if (override.isPresent()) {
            return overrideResult(verb, Tense.PresentSubjunctive, person, override.get(), List.of(), ending);
        }

        List<String> explanation = new ArrayList<>();
        String stem;
        boolean stemChanged = false;
        SpellingRule spellingRule = null;

        if (verb.presentStem() != null) {
            stem = verb.presentStem();
            explanation.add("'" + verb.infinitive() + "' builds the present subjunctive on the irregular stem '" + stem
                    + "-' taken from the yo form of the present indicative");
        } else {
            String regularStem = StemRules.regularStem(verb);
            stem = StemRules.presentSubjunctiveStem(verb, regularStem, person);
            stemChanged = !stem.equals(regularStem);
            if (stemChanged) {
                explanation.add(stemChangeExplanation(verb, person, regularStem, stem));
            } else if (verb.hasStemChange()) {
                explanation.add("the " + stemChangeCode(verb) + " stem change does not apply to "
                        + person.getPronouns().get(0) + " because the stress falls on the ending");
            }

            Optional<SpellingRule> rule = SpellingRule.find(verb.infinitive(), ending);
            if (rule.isPresent()) {
                spellingRule = rule.get();
                stem = spellingRule.apply(stem);
                explanation.add("spelling change " + spellingRule.getCode() + ": " + spellingRule.getDescription());
            }
        }

        explanation.add(0, classExplanation(verb, stem, ending, "present subjunctive"));

        return new ConjugationResult(verb.infinitive(), Tense.PresentSubjunctive, person,
                stem + ending,
                List.of(),
                stem,
                ending,
                verb.presentStem() != null,
                stemChanged,
                spellingRule == null ? null : spellingRule.getCode(),
                String.join("; ", explanation));
    }

    private ConjugationResult conjugateImperfect(Verb verb, Person person) {
        String raSuffix = EndingTable.imperfectRaSuffix(person);

        Optional<String> override = verb.getOverride(Tense.ImperfectSubjunctive, person);
        if (override.isPresent()) {
            String raForm = override.get();
            return overrideResult(verb, Tense.ImperfectSubjunctive, person, raForm,
                    List.of(EndingTable.raToSe(raForm, person)), raSuffix);
        }

        ImperfectBase base = imperfectBase(verb);
        String theme = person == Person.FirstPlural ? StemRules.accentLastVowel(base.theme()) : base.theme();
        String raForm = base.stem() + theme + raSuffix;
        String seForm = base.stem() + theme + EndingTable.imperfectSeSuffix(person);

        List<String> explanation = new ArrayList<>();
        if (base.irregular()) {
            explanation.add("'" + verb.infinitive() + "' builds the imperfect subjunctive on its irregular preterite base '"
                    + base.stem() + base.theme() + "-' (third person plural preterite minus -ron)");
        } else {
            explanation.add(verb.conjugationClass().getLabel() + " verb: preterite base '" + base.stem() + base.theme()
                    + "-' + -ra / -se endings");
        }
        if (base.stemChanged()) {
            explanation.add("-ir stem changers keep the raised vowel in the imperfect subjunctive");
        }
        if (base.spellingRule() != null) {
            explanation.add("spelling change " + base.spellingRule().getCode() + ": " + base.spellingRule().getDescription());
        }
        if (person == Person.FirstPlural) {
            explanation.add("the nosotros form carries a written accent on the vowel before -ramos");
        }
        explanation.add("the -ra form '" + raForm + "' and the -se form '" + seForm + "' are interchangeable");

        return new ConjugationResult(verb.infinitive(), Tense.ImperfectSubjunctive, person,
                raForm,
                List.of(seForm),
                base.stem(),
                theme + raSuffix,
                base.irregular(),
                base.stemChanged(),
                base.spellingRule() == null ? null : base.spellingRule().getCode(),
                String.join("; ", explanation));
    }

    private ConjugationResult conjugateCompound(Verb verb, Tense tense, Person person) {
        if (!lexicon.contains(VerbLexicon.AUXILIARY_VERB)) {
            throw unsupported(verb.infinitive(), tense, person);
        }

        ConjugationResult auxiliary = conjugate(lexicon.getVerb(VerbLexicon.AUXILIARY_VERB), tense.getAuxiliaryTense(), person);
        String participle = pastParticiple(verb);
        boolean irregularParticiple = verb.pastParticiple() != null;

        List<String> alternates = auxiliary.alternates().stream()
                .map(form -> form + " " + participle)
                .collect(Collectors.toList());

        String explanation = "haber in the " + tense.getAuxiliaryTense().getDisplayName() + " ('" + auxiliary.canonical()
                + "') + past participle '" + participle + "'"
                + (irregularParticiple ? "; '" + verb.infinitive() + "' has an irregular past participle" : "");

        return new ConjugationResult(verb.infinitive(), tense, person,
                auxiliary.canonical() + " " + participle,
                alternates,
                auxiliary.canonical() + " ",
                participle,
                irregularParticiple,
                false,
                null,
                explanation);
    }

    private ImperfectBase imperfectBase(Verb verb) {
        if (verb.imperfectBase() != null) {
            String base = verb.imperfectBase();
            String theme = themeOf(base);
            return new ImperfectBase(base.substring(0, base.length() - theme.length()), theme, true, false, null);
        }

        String stem = StemRules.regularStem(verb);
        if (verb.conjugationClass() == ConjugationClass.Ar) {
            return new ImperfectBase(stem, "a", false, false, null);
        }

        String raised = StemRules.imperfectStem(verb, stem);
        boolean stemChanged = !raised.equals(stem);
        if (StemRules.endsInPronouncedVowel(raised)) {
            return new ImperfectBase(raised, "ye", false, stemChanged, SpellingRule.IToY);
        }

        return new ImperfectBase(raised, "ie", false, stemChanged, null);
    }

    private static String themeOf(String base) {
        for (String theme : List.of("ie", "ye", "a", "e")) {
            if (base.endsWith(theme)) {
                return theme;
            }
        }

        return "";
    }

    private ConjugationResult overrideResult(Verb verb, Tense tense, Person person, String form, List<String> alternates, String regularEnding) {
        boolean split = form.endsWith(regularEnding) && form.length() > regularEnding.length();
        String stem = split ? form.substring(0, form.length() - regularEnding.length()) : form;
        String ending = split ? regularEnding : "";

        return new ConjugationResult(verb.infinitive(), tense, person,
                form,
                alternates,
                stem,
                ending,
                true,
                false,
                null,
                "'" + verb.infinitive() + "' is irregular in the " + tense.getDisplayName() + ": the "
                        + person.getPronouns().get(0) + " form '" + form + "' has to be memorized");
    }

    private static String classExplanation(Verb verb, String stem, String ending, String tenseName) {
        String prefix = verb.isIrregular() ? verb.conjugationClass().getLabel() + " verb" : "regular " + verb.conjugationClass().getLabel() + " verb";
        return prefix + ": stem '" + stem + "-' + " + tenseName + " ending '-" + ending + "'";
    }

    private static String stemChangeExplanation(Verb verb, Person person, String regularStem, String changedStem) {
        if (verb.stemChange() != StemChange.EToI && !person.isStemStressed()) {
            return "-ir stem changers raise the stem vowel in the nosotros and vosotros forms ('" + regularStem + "-' → '" + changedStem + "-')";
        }

        return "stem change " + stemChangeCode(verb) + " ('" + regularStem + "-' → '" + changedStem + "-')";
    }

    private static String stemChangeCode(Verb verb) {
        return verb.stemChangeVowel() + "→" + verb.stemChangeReplacement();
    }

    private void verifyCombination(String infinitive, Tense tense, Person person) {
        if (tense == null || person == null) {
            throw unsupported(infinitive, tense, person);
        }
    }

    private UnsupportedCombinationException unsupported(String infinitive, Tense tense, Person person) {
        String errMsg = "Cannot conjugate " + infinitive + " for tense " + (tense == null ? "null" : tense.getCode())
                + " and person " + (person == null ? "null" : person.getCode());

        log.error(errMsg);
        return new UnsupportedCombinationException(errMsg);
    }

    private record ImperfectBase(String stem, String theme, boolean irregular, boolean stemChanged, SpellingRule spellingRule) { }
}
