package com.gt.subjunctive.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.subjunctive.serialization.PersonSerializer;

import java.util.List;

@JsonSerialize(using = PersonSerializer.class)
public enum Person {
    FirstSingular("1st-singular", "1st person singular", List.of("yo")),
    SecondSingular("2nd-singular", "2nd person singular", List.of("tú")),
    ThirdSingular("3rd-singular", "3rd person singular", List.of("él", "ella", "usted")),
    FirstPlural("1st-plural", "1st person plural", List.of("nosotros", "nosotras")),
    SecondPlural("2nd-plural", "2nd person plural", List.of("vosotros", "vosotras")),
    ThirdPlural("3rd-plural", "3rd person plural", List.of("ellos", "ellas", "ustedes"));

    private final String code;
    private final String displayName;
    private final List<String> pronouns;

    Person(String code, String displayName, List<String> pronouns) {
        this.code = code;
        this.displayName = displayName;
        this.pronouns = pronouns;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getPronouns() {
        return pronouns;
    }

    public String getPronounLabel() {
        return String.join("/", pronouns);
    }

    // nosotros and vosotros forms keep the stressed ending, so boot-pattern stem changes skip them
    public boolean isStemStressed() {
        return this != FirstPlural && this != SecondPlural;
    }

    public static Person fromCode(String code) {
        for (Person person : values()) {
            if (person.code.equals(code)) {
                return person;
            }
        }

        return null;
    }
}
