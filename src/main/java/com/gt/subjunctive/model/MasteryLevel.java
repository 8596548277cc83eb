package com.gt.subjunctive.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MasteryLevel {
    New("new"),
    Learning("learning"),
    Reviewing("reviewing"),
    Mastered("mastered");

    private final String code;

    MasteryLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
