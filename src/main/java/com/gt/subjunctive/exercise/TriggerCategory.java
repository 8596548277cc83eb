package com.gt.subjunctive.exercise;

import java.util.List;
import java.util.Random;

// WEIRDO trigger groups: wishes, emotions, impersonal expressions, recommendations, doubt/denial and ojalá
public enum TriggerCategory {
    Wishes("wishes",
            List.of("Mis padres quieren que", "Mi jefe espera que", "La profesora prefiere que", "Mi hermana desea que"),
            List.of("Mis padres querían que", "Mi jefe esperaba que", "La profesora prefería que", "Mi hermana deseaba que"),
            ContextGroup.Planning),
    Emotions("emotions",
            List.of("Me alegra que", "Nos sorprende que", "A mi abuela le molesta que", "Mis amigos temen que"),
            List.of("Me alegró que", "Nos sorprendió que", "A mi abuela le molestaba que", "Mis amigos temían que"),
            ContextGroup.Emotions),
    ImpersonalExpressions("impersonal-expressions",
            List.of("Es importante que", "Es necesario que", "Es posible que", "Es mejor que", "Es una lástima que"),
            List.of("Era importante que", "Era necesario que", "Era posible que", "Fue mejor que", "Fue una lástima que"),
            ContextGroup.Advice),
    Recommendations("recommendations",
            List.of("El médico recomienda que", "El profesor sugiere que", "Mi jefe exige que", "La guía aconseja que"),
            List.of("El médico recomendó que", "El profesor sugirió que", "Mi jefe exigía que", "La guía aconsejó que"),
            ContextGroup.Advice),
    DoubtDenial("doubt-denial",
            List.of("Dudo que", "No creo que", "No es verdad que", "No es cierto que"),
            List.of("Dudaba que", "No creía que", "No era verdad que", "No era cierto que"),
            ContextGroup.Social),
    Ojala("ojala",
            List.of("Ojalá que", "Ojalá"),
            List.of("Ojalá que", "Ojalá"),
            ContextGroup.Planning);

    private final String code;
    private final List<String> presentTriggers;
    private final List<String> pastTriggers;
    private final ContextGroup contextGroup;

    TriggerCategory(String code, List<String> presentTriggers, List<String> pastTriggers, ContextGroup contextGroup) {
        this.code = code;
        this.presentTriggers = presentTriggers;
        this.pastTriggers = pastTriggers;
        this.contextGroup = contextGroup;
    }

    public String getCode() {
        return code;
    }

    public List<String> getTriggers(boolean pastContext) {
        return pastContext ? pastTriggers : presentTriggers;
    }

    public String pickTrigger(boolean pastContext, Random random) {
        List<String> triggers = getTriggers(pastContext);
        return triggers.get(random.nextInt(triggers.size()));
    }

    public String pickContext(Random random) {
        List<String> contexts = contextGroup.contexts;
        return contexts.get(random.nextInt(contexts.size()));
    }

    public static TriggerCategory fromCode(String code) {
        for (TriggerCategory category : values()) {
            if (category.code.equals(code)) {
                return category;
            }
        }

        return null;
    }

    private enum ContextGroup {
        Social(List.of("En una conversación entre amigos...", "Durante una cena familiar...",
                "En una reunión de trabajo...", "Hablando con un compañero de clase...")),
        Planning(List.of("Planificando las vacaciones...", "Organizando una fiesta...",
                "Discutiendo el fin de semana...", "Preparando un viaje...")),
        Advice(List.of("Dando consejos a un amigo...", "Un médico habla con su paciente...",
                "Un profesor aconseja a su estudiante...", "Un padre habla con su hijo...")),
        Emotions(List.of("Expresando sentimientos...", "Reaccionando a una noticia...",
                "Compartiendo preocupaciones...", "Celebrando un logro..."));

        private final List<String> contexts;

        ContextGroup(List<String> contexts) {
            this.contexts = contexts;
        }
    }
}
