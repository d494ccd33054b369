package life.fede.finance.sdk;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Account details returned by the login, registration and profile endpoints.
 */
public record UserProfile(
    @JsonAlias("_id") String id,
    String username,
    String email,
    String firstName,
    String lastName,
    String currency
) {
}
