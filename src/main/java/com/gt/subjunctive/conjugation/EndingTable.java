package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.model.ConjugationClass;
import com.gt.subjunctive.model.Person;

import java.util.List;

// Person-ordered endings, indexed by Person.ordinal()
public final class EndingTable {

    private static final List<String> PRESENT_SUBJUNCTIVE_AR = List.of("e", "es", "e", "emos", "éis", "en");
    private static final List<String> PRESENT_SUBJUNCTIVE_ER_IR = List.of("a", "as", "a", "amos", "áis", "an");

    private static final List<String> IMPERFECT_RA = List.of("ra", "ras", "ra", "ramos", "rais", "ran");
    private static final List<String> IMPERFECT_SE = List.of("se", "ses", "se", "semos", "seis", "sen");

    private static final List<String> PRESENT_INDICATIVE_AR = List.of("o", "as", "a", "amos", "áis", "an");
    private static final List<String> PRESENT_INDICATIVE_ER = List.of("o", "es", "e", "emos", "éis", "en");
    private static final List<String> PRESENT_INDICATIVE_IR = List.of("o", "es", "e", "imos", "ís", "en");

    private static final List<String> IMPERFECT_INDICATIVE_AR = List.of("aba", "abas", "aba", "ábamos", "abais", "aban");
    private static final List<String> IMPERFECT_INDICATIVE_ER_IR = List.of("ía", "ías", "ía", "íamos", "íais", "ían");

    private EndingTable() { }

    public static String presentSubjunctive(ConjugationClass conjugationClass, Person person) {
        return (conjugationClass == ConjugationClass.Ar ? PRESENT_SUBJUNCTIVE_AR : PRESENT_SUBJUNCTIVE_ER_IR).get(person.ordinal());
    }

    public static String imperfectRaSuffix(Person person) {
        return IMPERFECT_RA.get(person.ordinal());
    }

    public static String imperfectSeSuffix(Person person) {
        return IMPERFECT_SE.get(person.ordinal());
    }

    // Only valid for a form that ends in the person's -ra suffix; the lexicon rejects overrides that do not
    public static String raToSe(String raForm, Person person) {
        String raSuffix = imperfectRaSuffix(person);
        return raForm.substring(0, raForm.length() - raSuffix.length()) + imperfectSeSuffix(person);
    }

    public static String presentIndicative(ConjugationClass conjugationClass, Person person) {
        switch (conjugationClass) {
            case Ar:
                return PRESENT_INDICATIVE_AR.get(person.ordinal());
            case Er:
                return PRESENT_INDICATIVE_ER.get(person.ordinal());
            default:
                return PRESENT_INDICATIVE_IR.get(person.ordinal());
        }
    }

    public static String imperfectIndicative(ConjugationClass conjugationClass, Person person) {
        return (conjugationClass == ConjugationClass.Ar ? IMPERFECT_INDICATIVE_AR : IMPERFECT_INDICATIVE_ER_IR).get(person.ordinal());
    }
}
