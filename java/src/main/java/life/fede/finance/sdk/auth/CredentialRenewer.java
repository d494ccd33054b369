package life.fede.finance.sdk.auth;

/**
 * Performs the renewal network call on behalf of {@link RefreshCoordinator}.
 */
@FunctionalInterface
public interface CredentialRenewer {

    /**
     * Exchanges the current, possibly expired, credential for a new one.
     *
     * @param current credential presented as proof of the prior session; never {@code null}.
     * @throws RenewalException when the endpoint rejects the session or cannot be reached.
     */
    Credential renew(Credential current) throws RenewalException;
}
