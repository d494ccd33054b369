package life.fede.finance.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds unsigned JWT-shaped tokens for tests.
 */
public final class Tokens {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Tokens() {
    }

    public static String jwt(String username, Instant expiresAt) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("id", "user-" + username);
        claims.put("username", username);
        claims.put("email", username + "@fedelife.test");
        claims.put("iat", Instant.now().getEpochSecond());
        if (expiresAt != null) {
            claims.put("exp", expiresAt.getEpochSecond());
        }
        return jwt(claims);
    }

    public static String jwt(Map<String, Object> claims) {
        try {
            String header = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"alg\":\"HS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
            String payload = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(MAPPER.writeValueAsBytes(claims));
            return header + "." + payload + ".sig";
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
