package com.gt.tsrs.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.tsrs.model.ReviewOutcome;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ReviewOutcomeSerializer extends JsonSerializer<ReviewOutcome> {
    @Override
    public void serialize(ReviewOutcome reviewOutcome, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(reviewOutcome.getValue());
    }
}
