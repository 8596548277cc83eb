package com.gt.subjunctive.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.subjunctive.serialization.ErrorKindSerializer;

@JsonSerialize(using = ErrorKindSerializer.class)
public enum ErrorKind {
    None("none"),
    AccentOnly("accent-only"),
    WrongStem("wrong-stem"),
    WrongEnding("wrong-ending"),
    WrongMoodOrTense("wrong-mood-or-tense"),
    WrongPerson("wrong-person"),
    Mismatch("mismatch");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ErrorKind fromCode(String code) {
        for (ErrorKind errorKind : values()) {
            if (errorKind.code.equals(code)) {
                return errorKind;
            }
        }

        return null;
    }
}
