package ai.segmap.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Shared Jackson mapper for manifests and request messages. */
public final class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // Utility class - no instantiation
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + obj.getClass().getSimpleName() + " to JSON", e);
        }
    }

    /** Single-line form, for line-delimited channels. */
    public static String toCompactJson(Object obj) {
        try {
            return MAPPER.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + obj.getClass().getSimpleName() + " to JSON", e);
        }
    }

    /**
     * Strict deserialization; callers that must tolerate half-written or foreign content catch the
     * {@link IOException}.
     */
    public static <T> T fromJson(String json, Class<T> type) throws IOException {
        return MAPPER.readValue(json, type);
    }

    public static JsonNode readTree(String json) throws IOException {
        return MAPPER.readTree(json);
    }
}
