package com.gt.subjunctive.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.subjunctive.model.Tense;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class TenseSerializer extends JsonSerializer<Tense> {
    @Override
    public void serialize(Tense tense, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(tense.getCode());
    }
}
