package life.fede.finance.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON support shared by the SDK.
 *
 * <p>
 * The back end wraps results as {@code {"success": true, "data": {...}}}, though some routes answer with bare fields;
 * {@link #envelopeField(JsonNode, String)} reads either shape. Caller payloads may carry {@code java.time} values
 * (transaction dates, goal deadlines), which are written as ISO-8601 strings.
 * </p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return {@code data.<field>} when present and non-null, otherwise the top-level {@code <field>} (possibly a
     *     missing node).
     */
    public static JsonNode envelopeField(JsonNode root, String field) {
        JsonNode enveloped = root.path("data").path(field);
        if (!enveloped.isMissingNode() && !enveloped.isNull()) {
            return enveloped;
        }
        return root.path(field);
    }

    /**
     * @return the non-blank text of {@link #envelopeField(JsonNode, String)}, or {@code null}.
     */
    public static String envelopeText(JsonNode root, String field) {
        JsonNode value = envelopeField(root, field);
        if (!value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
