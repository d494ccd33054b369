package life.fede.finance.sdk;

/**
 * Local view of the session lifecycle.
 */
public enum SessionState {
    AUTHENTICATED,
    /** A credential renewal is in flight. */
    RENEWING,
    /** No credential: never logged in, logged out, or torn down after a failed renewal. */
    UNAUTHENTICATED
}
