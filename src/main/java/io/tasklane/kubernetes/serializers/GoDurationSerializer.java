package io.tasklane.kubernetes.serializers;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tasklane.kubernetes.utils.Durations;

import java.io.IOException;
import java.time.Duration;

public class GoDurationSerializer extends StdSerializer<Duration> {
    public GoDurationSerializer() {
        super(Duration.class);
    }

    @Override
    public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(Durations.format(value));
    }
}
