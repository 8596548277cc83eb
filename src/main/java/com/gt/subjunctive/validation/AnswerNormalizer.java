package com.gt.subjunctive.validation;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class AnswerNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private AnswerNormalizer() { }

    // Lowercase, trim and collapse internal whitespace. Accents are kept
    public static String normalize(String answer) {
        if (answer == null) {
            return "";
        }

        String composed = Normalizer.normalize(answer, Normalizer.Form.NFC);
        return WHITESPACE.matcher(composed.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    // Strips diacritics except the tilde of ñ, which marks a different letter
    public static String fold(String text) {
        StringBuilder folded = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == 'ñ' || c == 'Ñ') {
                folded.append(c);
            } else {
                String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
                folded.append(COMBINING_MARKS.matcher(decomposed).replaceAll(""));
            }
        }

        return folded.toString();
    }

    public static String normalizeAndFold(String answer) {
        return fold(normalize(answer));
    }
}
