package com.gt.subjunctive.model;

public enum ConjugationClass {
    Ar("ar"),
    Er("er"),
    Ir("ir");

    private final String suffix;

    ConjugationClass(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getLabel() {
        return "-" + suffix;
    }

    // reír and oír carry a written accent on the class vowel
    public static ConjugationClass fromInfinitive(String infinitive) {
        if (infinitive == null || infinitive.length() < 2) {
            return null;
        }

        String ending = infinitive.substring(infinitive.length() - 2).replace('í', 'i');
        for (ConjugationClass conjugationClass : values()) {
            if (conjugationClass.suffix.equals(ending)) {
                return conjugationClass;
            }
        }

        return null;
    }
}
