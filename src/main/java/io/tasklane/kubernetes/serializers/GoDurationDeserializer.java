package io.tasklane.kubernetes.serializers;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tasklane.kubernetes.utils.Durations;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Reads {@code 1h0m0s} style durations, ISO-8601 durations ({@code PT1H}) and plain numbers as
 * seconds.
 */
public class GoDurationDeserializer extends StdDeserializer<Duration> {
    public GoDurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return Duration.ofSeconds(parser.getLongValue());
        }

        if (parser.currentToken() == JsonToken.VALUE_NUMBER_FLOAT) {
            return Duration.ofMillis(Math.round(parser.getDoubleValue() * 1000));
        }

        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }

        try {
            if (text.startsWith("P") || text.startsWith("-P")) {
                return Duration.parse(text);
            }

            return Durations.parse(text);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return (Duration) context.handleWeirdStringValue(Duration.class, text, e.getMessage());
        }
    }
}
