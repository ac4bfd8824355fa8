package com.gt.tsrs.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.tsrs.model.ReviewOutcome;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ReviewOutcomeDeserializer extends JsonDeserializer<ReviewOutcome> {
    @Override
    public ReviewOutcome deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String value = jsonParser.getValueAsString();
        ReviewOutcome reviewOutcome = ReviewOutcome.fromValue(value);

        if (reviewOutcome == null) {
            return (ReviewOutcome) deserializationContext.handleWeirdStringValue(ReviewOutcome.class, value,
                    "Review outcome must be 'success' or 'failure'");
        }

        return reviewOutcome;
    }
}
