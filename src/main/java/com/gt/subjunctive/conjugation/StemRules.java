package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.model.ConjugationClass;
import com.gt.subjunctive.model.Person;
import com.gt.subjunctive.model.StemChange;
import com.gt.subjunctive.model.Verb;

public final class StemRules {

    private static final String VOWELS = "aeiouáéíóúü";
    private static final String STRONG_VOWELS = "aeo";

    private StemRules() { }

    public static String regularStem(Verb verb) {
        String infinitive = verb.infinitive();
        return infinitive.substring(0, infinitive.length() - 2);
    }

    // Present subjunctive: boot pattern on stressed persons, raised vowel on -ir nosotros/vosotros, e→i everywhere
    public static String presentSubjunctiveStem(Verb verb, String stem, Person person) {
        if (!verb.hasStemChange()) {
            return stem;
        }
        if (verb.stemChange() == StemChange.EToI || person.isStemStressed()) {
            return replaceLast(stem, verb.stemChangeVowel(), verb.stemChangeReplacement());
        }
        if (verb.conjugationClass() == ConjugationClass.Ir) {
            return raiseVowel(verb, stem);
        }

        return stem;
    }

    // Present indicative only changes the stressed persons
    public static String presentIndicativeStem(Verb verb, String stem, Person person) {
        if (!verb.hasStemChange() || !person.isStemStressed()) {
            return stem;
        }

        return replaceLast(stem, verb.stemChangeVowel(), verb.stemChangeReplacement());
    }

    // Preterite-based forms of -ir stem changers keep the raised vowel in every person
    public static String imperfectStem(Verb verb, String stem) {
        if (!verb.hasStemChange() || verb.conjugationClass() != ConjugationClass.Ir) {
            return stem;
        }

        return raiseVowel(verb, stem);
    }

    private static String raiseVowel(Verb verb, String stem) {
        switch (verb.stemChange()) {
            case EToIe:
            case EToI:
                return replaceLast(stem, "e", "i");
            case OToUe:
                return replaceLast(stem, "o", "u");
            default:
                return stem;
        }
    }

    public static String replaceLast(String stem, String vowel, String replacement) {
        if (vowel == null || replacement == null) {
            return stem;
        }

        int index = stem.lastIndexOf(vowel);
        if (index < 0) {
            return stem;
        }

        return stem.substring(0, index) + replacement + stem.substring(index + vowel.length());
    }

    public static String accentLastVowel(String text) {
        for (int index = text.length() - 1; index >= 0; index--) {
            int plain = "aeiou".indexOf(text.charAt(index));
            if (plain >= 0) {
                return text.substring(0, index) + "áéíóú".charAt(plain) + text.substring(index + 1);
            }
        }

        return text;
    }

    public static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    // The u of gu and qu is silent, so guie and quie keep their i
    public static boolean endsInPronouncedVowel(String stem) {
        if (stem.isEmpty() || !isVowel(stem.charAt(stem.length() - 1))) {
            return false;
        }

        return !stem.endsWith("gu") && !stem.endsWith("qu");
    }

    public static boolean endsInStrongVowel(String stem) {
        return !stem.isEmpty() && STRONG_VOWELS.indexOf(stem.charAt(stem.length() - 1)) >= 0;
    }
}
