package com.gt.subjunctive.conjugation;

import java.text.Normalizer;
import java.util.List;
import java.util.Optional;

// Orthographic adjustments that keep the stem's final consonant sound when the ending vowel changes
public enum SpellingRule {
    GuToGue("gu→gü", "before e, gu is written gü so the u is still pronounced", List.of("guar"), "gu", "gü", "e", false),
    CToQu("c→qu", "before e, c is written qu to keep the hard /k/ sound", List.of("car"), "c", "qu", "e", false),
    GToGu("g→gu", "before e, g is written gu to keep the hard /g/ sound", List.of("gar"), "g", "gu", "e", false),
    ZToC("z→c", "before e, z is written c", List.of("zar"), "z", "c", "e", false),
    GuToG("gu→g", "before a or o, the silent u after g is dropped", List.of("guir"), "gu", "g", "ao", false),
    GToJ("g→j", "before a or o, g is written j to keep the soft /x/ sound", List.of("ger", "gir"), "g", "j", "ao", false),
    CToZ("c→z", "after a consonant and before a or o, c is written z to keep its soft sound", List.of("cer", "cir"), "c", "z", "ao", true),
    IToY("i→y", "an unstressed i between vowels is written y", List.of(), "i", "y", "", false);

    private final String code;
    private final String description;
    private final List<String> infinitiveEndings;
    private final String from;
    private final String to;
    private final String triggerVowels;
    private final boolean consonantBefore;

    SpellingRule(String code, String description, List<String> infinitiveEndings, String from, String to, String triggerVowels, boolean consonantBefore) {
        this.code = code;
        this.description = description;
        this.infinitiveEndings = infinitiveEndings;
        this.from = from;
        this.to = to;
        this.triggerVowels = triggerVowels;
        this.consonantBefore = consonantBefore;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean appliesToInfinitive(String infinitive) {
        for (String ending : infinitiveEndings) {
            if (infinitive.endsWith(ending)) {
                if (!consonantBefore) {
                    return true;
                }

                int index = infinitive.length() - ending.length() - 1;
                return index >= 0 && !StemRules.isVowel(infinitive.charAt(index));
            }
        }

        return false;
    }

    public boolean triggeredBy(String ending) {
        if (ending == null || ending.isEmpty() || triggerVowels.isEmpty()) {
            return false;
        }

        String first = Normalizer.normalize(ending.substring(0, 1), Normalizer.Form.NFD).substring(0, 1);
        return triggerVowels.contains(first);
    }

    public String apply(String stem) {
        if (!stem.endsWith(from)) {
            return stem;
        }

        return stem.substring(0, stem.length() - from.length()) + to;
    }

    // The rule a verb's infinitive is subject to, whatever the ending
    public static Optional<SpellingRule> forInfinitive(String infinitive) {
        for (SpellingRule rule : values()) {
            if (rule.appliesToInfinitive(infinitive)) {
                return Optional.of(rule);
            }
        }

        return Optional.empty();
    }

    public static Optional<SpellingRule> find(String infinitive, String ending) {
        return forInfinitive(infinitive).filter(rule -> rule.triggeredBy(ending));
    }
}
