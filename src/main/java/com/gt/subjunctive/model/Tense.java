package com.gt.subjunctive.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.subjunctive.serialization.TenseSerializer;

@JsonSerialize(using = TenseSerializer.class)
public enum Tense {
    PresentSubjunctive("present-subjunctive", "present subjunctive", false),
    ImperfectSubjunctive("imperfect-subjunctive", "imperfect subjunctive", false),
    PresentPerfectSubjunctive("present-perfect-subjunctive", "present perfect subjunctive", true),
    PluperfectSubjunctive("pluperfect-subjunctive", "pluperfect subjunctive", true);

    private final String code;
    private final String displayName;
    private final boolean compound;

    Tense(String code, String displayName, boolean compound) {
        this.code = code;
        this.displayName = displayName;
        this.compound = compound;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isCompound() {
        return compound;
    }

    // Simple tense that conjugates haber for this compound tense
    public Tense getAuxiliaryTense() {
        switch (this) {
            case PresentPerfectSubjunctive:
                return PresentSubjunctive;
            case PluperfectSubjunctive:
                return ImperfectSubjunctive;
            default:
                return null;
        }
    }

    // Present and present perfect are licensed by a present-tense main clause, the others by a past one
    public boolean isPastContext() {
        return this == ImperfectSubjunctive || this == PluperfectSubjunctive;
    }

    public static Tense fromCode(String code) {
        for (Tense tense : values()) {
            if (tense.code.equals(code)) {
                return tense;
            }
        }

        return null;
    }
}
