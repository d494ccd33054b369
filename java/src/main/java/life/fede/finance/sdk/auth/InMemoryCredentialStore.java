package life.fede.finance.sdk.auth;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local {@link CredentialStore}; last write wins. {@link #compareAndSet} compares by identity.
 */
public final class InMemoryCredentialStore implements CredentialStore {

    private final AtomicReference<Credential> current = new AtomicReference<>();

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(Credential initial) {
        current.set(initial);
    }

    @Override
    public Optional<Credential> read() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void write(Credential credential) {
        current.set(Objects.requireNonNull(credential, "credential"));
    }

    @Override
    public boolean compareAndSet(Credential expected, Credential next) {
        return current.compareAndSet(expected, next);
    }

    @Override
    public Optional<Credential> clear() {
        return Optional.ofNullable(current.getAndSet(null));
    }
}
