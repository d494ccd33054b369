package life.fede.finance.sdk.auth;

import java.util.Optional;

/**
 * Holder of the current session credential.
 */
public interface CredentialStore {

    Optional<Credential> read();

    /**
     * Atomically replaces the stored credential. Every {@link #read()} that starts afterwards observes it.
     */
    void write(Credential credential);

    /**
     * Replaces the credential only while the store still holds {@code expected}.
     *
     * @param expected the credential instance previously read, or {@code null} for an empty store.
     * @param next     the replacement, or {@code null} to clear.
     * @return {@code true} if the store was updated.
     */
    boolean compareAndSet(Credential expected, Credential next);

    /**
     * Removes the credential.
     *
     * @return the credential that was removed, if any.
     */
    Optional<Credential> clear();
}
