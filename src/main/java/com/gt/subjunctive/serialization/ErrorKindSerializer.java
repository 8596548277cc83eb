package com.gt.subjunctive.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.subjunctive.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ErrorKindSerializer extends JsonSerializer<ErrorKind> {
    @Override
    public void serialize(ErrorKind errorKind, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(errorKind.getCode());
    }
}
