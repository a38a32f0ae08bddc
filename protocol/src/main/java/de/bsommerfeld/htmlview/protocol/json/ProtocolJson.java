package de.bsommerfeld.htmlview.protocol.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * JSON codec for every type that crosses the process boundary.
 *
 * <h3>Mapping rules</h3>
 * <ul>
 * <li>Property names are snake_case ({@code always_on_top}).</li>
 * <li>Unknown properties are ignored so that older launchers can read results
 * written by newer viewers.</li>
 * <li>{@link Path} values are written as plain path strings. Jackson's default
 * would emit a {@code file://} URI, which the viewer does not understand.</li>
 * </ul>
 *
 * <h3>Thread safety</h3>
 * The shared {@link ObjectMapper} is configured once in the static initializer
 * and never reconfigured afterwards, which makes it safe for concurrent use.
 */
public final class ProtocolJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ProtocolJson() {
    }

    /** The shared, fully configured mapper. Must not be reconfigured by callers. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /** Pretty-printed form, used for {@code config.json} so that it is readable when debugging. */
    public static String toPrettyJson(Object value) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    public static <T> T fromJson(String json, Class<T> type) throws JsonProcessingException {
        return MAPPER.readValue(json, type);
    }

    private static ObjectMapper createMapper() {
        SimpleModule paths = new SimpleModule("protocol-paths");
        paths.addSerializer(Path.class, new PathSerializer());
        paths.addDeserializer(Path.class, new PathDeserializer());

        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.registerModule(paths);
        return mapper;
    }

    // =====================================================================
    // Path codec
    // =====================================================================

    private static final class PathSerializer extends StdSerializer<Path> {

        PathSerializer() {
            super(Path.class);
        }

        @Override
        public void serialize(Path value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

    private static final class PathDeserializer extends FromStringDeserializer<Path> {

        PathDeserializer() {
            super(Path.class);
        }

        @Override
        protected Path _deserialize(String value, DeserializationContext ctxt) {
            return Path.of(value);
        }
    }
}
