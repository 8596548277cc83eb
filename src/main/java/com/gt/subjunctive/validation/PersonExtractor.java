package com.gt.subjunctive.validation;

import com.gt.subjunctive.exception.AmbiguousPersonException;
import com.gt.subjunctive.model.Person;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

// Recovers the grammatical person from the prompt of an exercise stored without one
@Component
public class PersonExtractor {

    private static final Map<Person, Pattern> PRONOUN_PATTERNS = buildPatterns();

    public Person extractPerson(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new AmbiguousPersonException("Prompt is empty");
        }

        String text = Normalizer.normalize(prompt, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);

        Set<Person> found = EnumSet.noneOf(Person.class);
        for (Map.Entry<Person, Pattern> entry : PRONOUN_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                found.add(entry.getKey());
            }
        }

        if (found.size() != 1) {
            throw new AmbiguousPersonException("Expected one subject pronoun in prompt but found "
                    + (found.isEmpty() ? "none" : found.stream().map(Person::getCode).collect(Collectors.joining(", "))));
        }

        return found.iterator().next();
    }

    // Letter lookarounds instead of \b so that accented pronouns match whole words only (tú but not tu)
    private static Map<Person, Pattern> buildPatterns() {
        Map<Person, Pattern> patterns = new EnumMap<>(Person.class);
        for (Person person : Person.values()) {
            String alternatives = person.getPronouns().stream().map(Pattern::quote).collect(Collectors.joining("|"));
            patterns.put(person, Pattern.compile("(?<!\\p{L})(?:" + alternatives + ")(?!\\p{L})"));
        }

        return patterns;
    }
}
