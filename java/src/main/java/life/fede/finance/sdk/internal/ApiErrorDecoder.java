package life.fede.finance.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import life.fede.finance.sdk.FinanceApiException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Decodes error payloads of the form {@code {"error": "...", "message": "..."}}. Older routes use
 * {@code code} instead of {@code error}; both are accepted.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static FinanceApiException decode(int statusCode, byte[] body) {
        if (body == null || body.length == 0) {
            return new FinanceApiException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(body);
            String code = null;
            if (node.hasNonNull("error")) {
                code = node.get("error").asText();
            } else if (node.hasNonNull("code")) {
                code = node.get("code").asText();
            }
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            return new FinanceApiException(statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8);
            return new FinanceApiException(statusCode, null, fallback);
        }
    }
}
