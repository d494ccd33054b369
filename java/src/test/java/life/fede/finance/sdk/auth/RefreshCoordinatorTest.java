package life.fede.finance.sdk.auth;

import life.fede.finance.sdk.Tokens;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class RefreshCoordinatorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void concurrentCallersShareOneRenewal() throws Exception {
        Credential expired = credential("fede", Instant.now().minusSeconds(60));
        Credential renewed = credential("fede-renewed", Instant.now().plusSeconds(3600));
        InMemoryCredentialStore store = new InMemoryCredentialStore(expired);

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            calls.incrementAndGet();
            entered.countDown();
            await(release);
            return renewed;
        });

        Future<CompletableFuture<Credential>> initiator = pool.submit(coordinator::renew);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isInFlight());

        List<Future<CompletableFuture<Credential>>> joiners = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            joiners.add(pool.submit(coordinator::renew));
        }
        List<CompletableFuture<Credential>> shared = new ArrayList<>();
        for (Future<CompletableFuture<Credential>> joiner : joiners) {
            shared.add(joiner.get(5, TimeUnit.SECONDS));
        }
        for (CompletableFuture<Credential> future : shared) {
            assertSame(shared.get(0), future);
            assertFalse(future.isDone());
        }

        release.countDown();
        CompletableFuture<Credential> initiatorFuture = initiator.get(5, TimeUnit.SECONDS);
        assertSame(shared.get(0), initiatorFuture);
        for (CompletableFuture<Credential> future : shared) {
            assertEquals(renewed, future.get(5, TimeUnit.SECONDS));
        }

        assertEquals(1, calls.get());
        assertEquals(renewed, store.read().orElseThrow());
        assertFalse(coordinator.isInFlight());
    }

    @Test
    void presentsCurrentCredentialToRenewer() throws Exception {
        Credential expired = credential("fede", Instant.now().minusSeconds(60));
        InMemoryCredentialStore store = new InMemoryCredentialStore(expired);
        List<Credential> presented = new ArrayList<>();
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            presented.add(current);
            return credential("fede", Instant.now().plusSeconds(60));
        });

        CompletableFuture<Credential> result = coordinator.renew();

        assertTrue(result.isDone());
        assertEquals(List.of(expired), presented);
    }

    @Test
    void failsWithoutNetworkCallWhenNoCredentialIsStored() {
        AtomicInteger calls = new AtomicInteger();
        RefreshCoordinator coordinator = new RefreshCoordinator(new InMemoryCredentialStore(), current -> {
            calls.incrementAndGet();
            return current;
        });

        RenewalException ex = failure(coordinator.renew());

        assertEquals(RenewalException.Reason.NO_CREDENTIAL, ex.getReason());
        assertEquals(0, calls.get());
        assertFalse(coordinator.isInFlight());
    }

    @Test
    void failureReachesEveryWaiterAndKeepsStoreIntact() throws Exception {
        Credential expired = credential("fede", Instant.now().minusSeconds(60));
        InMemoryCredentialStore store = new InMemoryCredentialStore(expired);

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            entered.countDown();
            await(release);
            throw new RenewalException(RenewalException.Reason.REJECTED, 401, "session too old", null);
        });

        Future<CompletableFuture<Credential>> initiator = pool.submit(coordinator::renew);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        CompletableFuture<Credential> joined = coordinator.renew();
        release.countDown();

        RenewalException first = failure(initiator.get(5, TimeUnit.SECONDS));
        RenewalException second = failure(joined);

        assertSame(first, second);
        assertSame(expired, first.getCredential());
        assertEquals(RenewalException.Reason.REJECTED, first.getReason());
        assertEquals(401, first.getStatusCode());
        assertEquals(expired, store.read().orElseThrow());
        assertFalse(coordinator.isInFlight());
    }

    @Test
    void renewsEvenWhenStoredCredentialLooksValid() {
        Credential valid = credential("fede", Instant.now().plusSeconds(3600));
        Credential renewed = credential("fede-2", Instant.now().plusSeconds(7200));
        AtomicInteger calls = new AtomicInteger();
        RefreshCoordinator coordinator = new RefreshCoordinator(new InMemoryCredentialStore(valid), current -> {
            calls.incrementAndGet();
            return renewed;
        });

        assertEquals(renewed, coordinator.renew().join());
        assertEquals(1, calls.get());
    }

    @Test
    void returnsToIdleSoLaterRenewalsMakeNewCalls() {
        AtomicInteger calls = new AtomicInteger();
        InMemoryCredentialStore store = new InMemoryCredentialStore(credential("fede", Instant.now()));
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            int n = calls.incrementAndGet();
            return credential("fede-" + n, Instant.now().plusSeconds(60));
        });

        Credential first = coordinator.renew().join();
        Credential second = coordinator.renew().join();

        assertEquals(2, calls.get());
        assertEquals("fede-1", first.getUsername());
        assertEquals("fede-2", second.getUsername());
        assertEquals(second, store.read().orElseThrow());
    }

    @Test
    void unexpectedRenewerErrorStillResolvesFuture() {
        RefreshCoordinator coordinator = new RefreshCoordinator(
            new InMemoryCredentialStore(credential("fede", Instant.now())),
            current -> {
                throw new IllegalStateException("boom");
            });

        RenewalException ex = failure(coordinator.renew());

        assertEquals(RenewalException.Reason.TRANSPORT, ex.getReason());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertFalse(coordinator.isInFlight());
    }

    @Test
    void logoutDuringRenewalDiscardsRenewedCredential() throws Exception {
        Credential expired = credential("fede", Instant.now().minusSeconds(60));
        InMemoryCredentialStore store = new InMemoryCredentialStore(expired);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            entered.countDown();
            await(release);
            return credential("fede", Instant.now().plusSeconds(3600));
        });

        Future<CompletableFuture<Credential>> initiator = pool.submit(coordinator::renew);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        store.clear();
        release.countDown();

        RenewalException ex = failure(initiator.get(5, TimeUnit.SECONDS));
        assertEquals(RenewalException.Reason.SUPERSEDED, ex.getReason());
        assertFalse(ex.getReason().isSessionFatal());
        assertSame(expired, ex.getCredential());
        assertTrue(store.read().isEmpty());
    }

    @Test
    void newLoginDuringRenewalKeepsLoginCredential() throws Exception {
        InMemoryCredentialStore store = new InMemoryCredentialStore(credential("fede", Instant.now().minusSeconds(60)));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            entered.countDown();
            await(release);
            return credential("fede-renewed", Instant.now().plusSeconds(3600));
        });

        Future<CompletableFuture<Credential>> initiator = pool.submit(coordinator::renew);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        Credential login = credential("ana", Instant.now().plusSeconds(3600));
        store.write(login);
        release.countDown();

        assertEquals(RenewalException.Reason.SUPERSEDED, failure(initiator.get(5, TimeUnit.SECONDS)).getReason());
        assertSame(login, store.read().orElseThrow());
    }

    @Test
    void interruptedInitiatorIsNotReportedAsEndpointFailure() throws Exception {
        Credential expired = credential("fede", Instant.now().minusSeconds(60));
        InMemoryCredentialStore store = new InMemoryCredentialStore(expired);
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            if (calls.incrementAndGet() > 1) {
                return credential("fede", Instant.now().plusSeconds(3600));
            }
            entered.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new RenewalException(RenewalException.Reason.INTERRUPTED, "refresh token interrupted", ex);
            }
            throw new IllegalStateException("unreachable");
        });

        Future<CompletableFuture<Credential>> initiator = pool.submit(coordinator::renew);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        CompletableFuture<Credential> joined = coordinator.renew();
        initiator.cancel(true);
        assertThrows(CancellationException.class, () -> initiator.get(5, TimeUnit.SECONDS));

        RenewalException ex = failure(joined);
        assertEquals(RenewalException.Reason.INTERRUPTED, ex.getReason());
        assertFalse(ex.getReason().isSessionFatal());
        assertSame(expired, store.read().orElseThrow());

        // a later round makes a fresh call
        Credential renewed = coordinator.renew().get(5, TimeUnit.SECONDS);
        assertEquals(2, calls.get());
        assertSame(renewed, store.read().orElseThrow());
    }

    @Test
    void releasedCountIsPerRound() throws Exception {
        InMemoryCredentialStore store = new InMemoryCredentialStore(credential("fede", Instant.now().minusSeconds(60)));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        RefreshCoordinator coordinator = new RefreshCoordinator(store, current -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                await(release);
            }
            return credential("fede", Instant.now().plusSeconds(3600));
        });

        List<String> messages = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(RefreshCoordinator.class.getName());
        logger.addHandler(capture);
        try {
            Future<CompletableFuture<Credential>> initiator = pool.submit(coordinator::renew);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            CompletableFuture<Credential> first = coordinator.renew();
            CompletableFuture<Credential> second = coordinator.renew();
            release.countDown();
            initiator.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS);
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);

            coordinator.renew().get(5, TimeUnit.SECONDS);
        } finally {
            logger.removeHandler(capture);
        }

        List<String> released = new ArrayList<>();
        for (String message : messages) {
            if (message.contains("waiting caller(s) released")) {
                released.add(message);
            }
        }
        assertEquals(2, released.size());
        assertTrue(released.get(0).endsWith("2 waiting caller(s) released"), released.get(0));
        assertTrue(released.get(1).endsWith("0 waiting caller(s) released"), released.get(1));
    }

    private static Credential credential(String username, Instant expiry) {
        return Credential.of(Tokens.jwt(username, expiry));
    }

    private static RenewalException failure(CompletableFuture<Credential> future) {
        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return assertInstanceOf(RenewalException.class, ex.getCause());
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
