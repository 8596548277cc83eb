package com.gt.subjunctive.model;

public enum StemChange {
    None("none", null, null),
    EToIe("e→ie", "e", "ie"),
    OToUe("o→ue", "o", "ue"),
    EToI("e→i", "e", "i"),
    Other("other", null, null);

    private final String code;
    private final String vowel;
    private final String replacement;

    StemChange(String code, String vowel, String replacement) {
        this.code = code;
        this.vowel = vowel;
        this.replacement = replacement;
    }

    public String getCode() {
        return code;
    }

    // Null for None and Other. Other takes its vowel pair from the lexicon entry
    public String getVowel() {
        return vowel;
    }

    public String getReplacement() {
        return replacement;
    }

    public static StemChange fromCode(String code) {
        if (code == null || code.isBlank()) {
            return None;
        }

        String normalized = code.replace("->", "→");
        for (StemChange stemChange : values()) {
            if (stemChange.code.equals(normalized)) {
                return stemChange;
            }
        }

        return null;
    }
}
