package com.gt.subjunctive.model;

public enum Regularity {
    RegularAr("regular-ar", ConjugationClass.Ar),
    RegularEr("regular-er", ConjugationClass.Er),
    RegularIr("regular-ir", ConjugationClass.Ir),
    Irregular("irregular", null);

    private final String code;
    private final ConjugationClass regularClass;

    Regularity(String code, ConjugationClass regularClass) {
        this.code = code;
        this.regularClass = regularClass;
    }

    public String getCode() {
        return code;
    }

    public ConjugationClass getRegularClass() {
        return regularClass;
    }

    public boolean isRegular() {
        return regularClass != null;
    }

    public static Regularity fromCode(String code) {
        for (Regularity regularity : values()) {
            if (regularity.code.equals(code)) {
                return regularity;
            }
        }

        return null;
    }
}
