package com.bastion.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.security.AccessLevel;
import com.bastion.security.Credential;
import com.bastion.security.CredentialKind;
import com.bastion.security.CredentialParser;
import com.bastion.security.Sha256Fingerprinter;
import com.bastion.security.ValidationContext;
import com.bastion.validation.cache.CacheSettings;
import com.bastion.validation.cache.ValidationCache;
import com.bastion.validation.store.CredentialRecord;
import com.bastion.validation.testing.InMemoryCredentialStore;
import com.bastion.validation.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("TokenExtensionService")
class TokenExtensionServiceTest {

    private static final Instant NOW = EngineFixture.NOW;
    private static final String RAW = "ovt_expiring_key_0001";

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryCredentialStore store = new InMemoryCredentialStore();
    private final CredentialParser parser = new CredentialParser(new Sha256Fingerprinter());
    private final ValidationCache cache = new ValidationCache(CacheSettings.DEFAULTS, clock);

    /** Registers a credential with a 100 hour lifetime and the given remaining hours. */
    private ValidationContext register(String tenantId, long remainingHours) {
        Instant issued = NOW.minus(Duration.ofHours(100 - remainingHours));
        Instant expires = NOW.plus(Duration.ofHours(remainingHours));
        store.addCredential(RAW, new CredentialRecord(tenantId, null, AccessLevel.WRITE, issued, expires, null));
        return new ValidationContext(tenantId, null, AccessLevel.WRITE, ValidationContext.NEUTRAL_RISK,
                CredentialKind.API_KEY, NOW, issued, expires);
    }

    private static ExtensionPolicy policy(double threshold) {
        return new ExtensionPolicy(true, threshold, Duration.ofDays(30), EnumSet.allOf(CredentialKind.class), Set.of());
    }

    @Nested
    @DisplayName("due")
    class Due {

        @ParameterizedTest(name = "{0}h remaining of 100h, threshold {1} -> {2}")
        @CsvSource({
                "10, 0.25, true",
                "10, 0.10, false",
                "9,  0.10, true",
                "50, 0.25, false",
                "24, 0.25, true",
                "10, 0.0,  false"
        })
        @DisplayName("compares remaining validity with the threshold fraction")
        void threshold(long remainingHours, double threshold, boolean expected) {
            var service = new TokenExtensionService(store, policy(threshold), cache, clock);

            assertThat(service.due(register("tenant-a", remainingHours), NOW)).isEqualTo(expected);
        }

        @Test
        @DisplayName("never for an expired context")
        void expired() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 1);

            assertThat(service.due(context, NOW.plus(Duration.ofHours(2)))).isFalse();
        }

        @Test
        @DisplayName("respects excluded tenants and credential kinds")
        void eligibility() {
            var excluded = new ExtensionPolicy(true, 0.5, Duration.ofDays(1), EnumSet.allOf(CredentialKind.class),
                    Set.of("tenant-frozen"));
            var sessionsOnly = new ExtensionPolicy(true, 0.5, Duration.ofDays(1),
                    EnumSet.of(CredentialKind.SESSION_TOKEN), Set.of());

            assertThat(new TokenExtensionService(store, excluded, cache, clock)
                    .due(register("tenant-frozen", 5), NOW)).isFalse();
            assertThat(new TokenExtensionService(store, sessionsOnly, cache, clock)
                    .due(register("tenant-a", 5), NOW)).isFalse();
            assertThat(new TokenExtensionService(store, ExtensionPolicy.disabled(), cache, clock)
                    .due(register("tenant-a", 5), NOW)).isFalse();
        }
    }

    @Nested
    @DisplayName("maybeExtend")
    class MaybeExtend {

        @Test
        @DisplayName("moves the expiry forward from the current expiry, keeping the credential value")
        void extendsFromCurrentExpiry() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 5);
            Credential credential = parser.parse(RAW);

            var decision = service.maybeExtend(credential, context);

            Instant expected = context.expiresAt().plus(Duration.ofDays(30));
            assertThat(decision.applied()).isTrue();
            assertThat(decision.context().expiresAt()).isEqualTo(expected);
            assertThat(store.expiryOf(RAW)).contains(expected);
            assertThat(service.stats().extended()).isEqualTo(1);
        }

        @Test
        @DisplayName("leaves a credential outside the window untouched")
        void notDue() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 80);

            var decision = service.maybeExtend(parser.parse(RAW), context);

            assertThat(decision.applied()).isFalse();
            assertThat(decision.context()).isSameAs(context);
            assertThat(service.stats().attempts()).isZero();
            assertThat(store.extensionWrites()).isZero();
        }

        @Test
        @DisplayName("evicts cached entries of the extended credential")
        void invalidatesCache() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 5);
            Credential credential = parser.parse(RAW);
            long epoch = cache.revocationEpoch();
            cache.put(credential.fingerprint(), "orders", context, Duration.ofMinutes(1), epoch);

            service.maybeExtend(credential, context);

            assertThat(cache.size()).isZero();
            // extension is not a revocation: the extending request may still cache its result
            assertThat(cache.revocationEpoch()).isEqualTo(epoch);
        }

        @Test
        @DisplayName("a stale expiry loses the conditional write without failing")
        void staleContextConflicts() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var stale = register("tenant-a", 5);
            service.maybeExtend(parser.parse(RAW), stale);

            var second = service.maybeExtend(parser.parse(RAW), stale);

            assertThat(second.applied()).isFalse();
            assertThat(second.context()).isSameAs(stale);
            assertThat(service.stats().conflicts()).isEqualTo(1);
            assertThat(service.stats().successPercent()).isEqualTo(100.0);
            assertThat(store.extensionWrites()).isEqualTo(1);
        }

        @Test
        @DisplayName("store outage skips the extension and keeps the request going")
        void storeOutage() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 5);
            store.setUnavailable(true);

            var decision = service.maybeExtend(parser.parse(RAW), context);

            assertThat(decision.applied()).isFalse();
            assertThat(service.stats().failed()).isEqualTo(1);
            assertThat(service.stats().successPercent()).isZero();
        }

        @Test
        @DisplayName("a removed credential counts as not found")
        void removedCredential() {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 5);
            store.removeCredential(RAW);

            assertThat(service.maybeExtend(parser.parse(RAW), context).applied()).isFalse();
            assertThat(service.stats().notFound()).isEqualTo(1);
        }

        @Test
        @DisplayName("concurrent requests extend the credential exactly once")
        void concurrentRequestsExtendOnce() throws Exception {
            var service = new TokenExtensionService(store, policy(0.25), cache, clock);
            var context = register("tenant-a", 5);
            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<TokenExtensionService.Decision>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return service.maybeExtend(parser.parse(RAW), context);
                    }));
                }
                start.countDown();

                int applied = 0;
                for (Future<TokenExtensionService.Decision> future : futures) {
                    if (future.get(5, TimeUnit.SECONDS).applied()) {
                        applied++;
                    }
                }

                assertThat(applied).isEqualTo(1);
                assertThat(store.extensionWrites()).isEqualTo(1);
                assertThat(store.expiryOf(RAW)).contains(context.expiresAt().plus(Duration.ofDays(30)));
                assertThat(service.stats().extended()).isEqualTo(1);
                assertThat(service.stats().conflicts()).isEqualTo(threads - 1);
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
