package life.fede.finance.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import life.fede.finance.sdk.internal.Json;

import java.io.IOException;
import java.util.Base64;

/**
 * Unverified JWT payload claims. Signature checking is the server's job; the SDK only reads the claims to
 * learn who the session belongs to and when it expires.
 *
 * @param decoded {@code false} when the token could not be parsed at all
 */
public record DecodedClaims(
    String userId,
    String username,
    String email,
    long issuedAtUnix,
    long expiresAtUnix,
    boolean decoded
) {

    public static DecodedClaims decode(String token) {
        if (token == null || token.isBlank()) {
            return empty();
        }
        try {
            String[] parts = token.split("\\.");
            if (parts.length < 2) {
                return empty();
            }

            byte[] payload = decodeBase64(parts[1]);
            JsonNode node = Json.mapper().readTree(payload);
            if (node == null || !node.isObject()) {
                return empty();
            }

            String id = text(node, "id");
            if (id == null) {
                id = text(node, "userId");
            }

            return new DecodedClaims(
                id,
                text(node, "username"),
                text(node, "email"),
                node.path("iat").isNumber() ? node.path("iat").asLong(0L) : 0L,
                node.path("exp").isNumber() ? node.path("exp").asLong(0L) : 0L,
                true
            );
        } catch (IOException | IllegalArgumentException ex) {
            return empty();
        }
    }

    public boolean hasExpiry() {
        return expiresAtUnix > 0;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            return Base64.getDecoder().decode(value);
        }
    }

    private static DecodedClaims empty() {
        return new DecodedClaims(null, null, null, 0L, 0L, false);
    }
}
