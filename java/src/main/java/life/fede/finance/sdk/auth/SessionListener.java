package life.fede.finance.sdk.auth;

/**
 * Receives the single "log in again" event raised when a session cannot be renewed.
 */
@FunctionalInterface
public interface SessionListener {

    /**
     * @param cause the renewal failure that ended the session.
     */
    void onSessionExpired(RenewalException cause);
}
