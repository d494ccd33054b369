package life.fede.finance.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bearer credential held by a {@link CredentialStore}.
 *
 * <p>
 * The expiry is decoded from the token's {@code exp} claim and is never trusted blindly: a token that cannot be
 * decoded, or that carries no expiry, reports {@link #isExpired(Instant, Duration)} as {@code true}. A server 401 is
 * always authoritative over this local view.
 * </p>
 */
public final class Credential {

    private final String value;
    private final Instant expiresAt;
    private final DecodedClaims claims;

    private Credential(String value, DecodedClaims claims) {
        this.value = value;
        this.claims = claims;
        this.expiresAt = claims.hasExpiry() ? Instant.ofEpochSecond(claims.expiresAtUnix()) : null;
    }

    /**
     * Wraps a raw bearer token, decoding its claims.
     *
     * @throws IllegalArgumentException when the value is blank.
     */
    public static Credential of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("credential value is required");
        }
        String trimmed = value.trim();
        return new Credential(trimmed, DecodedClaims.decode(trimmed));
    }

    public String getValue() {
        return value;
    }

    /**
     * @return decoded expiry, or {@code null} when unknown.
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getUserId() {
        return claims.userId();
    }

    public String getUsername() {
        return claims.username();
    }

    public String getEmail() {
        return claims.email();
    }

    public boolean isExpired(Instant now, Duration leeway) {
        if (expiresAt == null) {
            return true;
        }
        Duration margin = leeway == null || leeway.isNegative() ? Duration.ZERO : leeway;
        return !now.isBefore(expiresAt.minus(margin));
    }

    public boolean isExpired() {
        return isExpired(Instant.now(), Duration.ZERO);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Credential)) {
            return false;
        }
        return value.equals(((Credential) other).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        // never print the token itself
        return "Credential[user=" + claims.username() + ", expiresAt=" + expiresAt + "]";
    }
}
