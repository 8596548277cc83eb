package com.gt.subjunctive.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty {
    Beginner("beginner", 1),
    Intermediate("intermediate", 2),
    Advanced("advanced", 3);

    private final String code;
    private final int tier;

    Difficulty(String code, int tier) {
        this.code = code;
        this.tier = tier;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getTier() {
        return tier;
    }

    public boolean allows(Difficulty required) {
        return required.tier <= tier;
    }

    public Difficulty harder() {
        return this == Beginner ? Intermediate : Advanced;
    }

    public Difficulty easier() {
        return this == Advanced ? Intermediate : Beginner;
    }

    public static Difficulty fromCode(String code) {
        for (Difficulty difficulty : values()) {
            if (difficulty.code.equalsIgnoreCase(code)) {
                return difficulty;
            }
        }

        return null;
    }
}
