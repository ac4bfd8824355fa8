package com.gt.tsrs.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.tsrs.model.MasteryLevel;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class MasteryLevelSerializer extends JsonSerializer<MasteryLevel> {
    @Override
    public void serialize(MasteryLevel masteryLevel, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(masteryLevel.getLabel());
    }
}
