package com.eventwait.eventmanager;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for OneShotWaiter signalling, independent of EventManager.waitFor.
 */
class OneShotWaiterTest {

    private EventManager manager;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        manager = new EventManager();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws Exception {
        manager.close();
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should signal on a matching event and keep its arguments")
    void shouldSignalOnMatch() {
        OneShotWaiter waiter = manager.addWaiter("on_ready", null);

        assertThat(waiter.process("on_ready", EventArgs.of("payload"))).isTrue();

        assertThat(waiter.isSignalled()).isTrue();
        assertThat(waiter.getResult()).isEqualTo(EventArgs.of("payload"));
    }

    @Test
    @DisplayName("Should not signal for a different event name")
    void shouldNotSignalForDifferentName() {
        OneShotWaiter waiter = manager.addWaiter("on_ready", null);

        assertThat(waiter.process("on_message", EventArgs.of("payload"))).isFalse();

        assertThat(waiter.isSignalled()).isFalse();
        assertThat(waiter.getResult()).isNull();
    }

    @Test
    @DisplayName("Should not signal when the predicate rejects the event")
    void shouldNotSignalWhenPredicateRejects() {
        OneShotWaiter waiter = manager.addWaiter("on_message", args -> "wanted".equals(args.get(0)));

        waiter.process("on_message", EventArgs.of("other"));

        assertThat(waiter.isSignalled()).isFalse();
        assertThat(waiter.getResult()).isNull();
    }

    @Test
    @DisplayName("Should keep the first match when signalled again")
    void shouldKeepFirstMatch() {
        OneShotWaiter waiter = manager.addWaiter("on_message", null);

        assertThat(waiter.process("on_message", EventArgs.of("first"))).isTrue();
        assertThat(waiter.process("on_message", EventArgs.of("second"))).isFalse();

        assertThat(waiter.getResult()).isEqualTo(EventArgs.of("first"));
    }

    @Test
    @DisplayName("Should return false when the timeout elapses without a match")
    void shouldTimeOutWithoutMatch() throws InterruptedException {
        OneShotWaiter waiter = manager.addWaiter("on_ready", null);

        assertThat(waiter.await(Duration.ofMillis(20))).isFalse();
        assertThat(waiter.await(Duration.ZERO)).isFalse();
    }

    @Test
    @DisplayName("Should release a caller blocked without timeout")
    void shouldReleaseBlockedCaller() throws Exception {
        OneShotWaiter waiter = manager.addWaiter("on_ready", null);

        Future<Boolean> awaited = executor.submit(() -> waiter.await(null));
        manager.dispatch("on_ready", "payload");

        assertThat(awaited.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(waiter.await(Duration.ZERO)).isTrue();
    }

    @Test
    @DisplayName("Cancelling should release the caller without a result")
    void cancelShouldReleaseWithoutResult() throws InterruptedException {
        OneShotWaiter waiter = manager.addWaiter("on_ready", null);

        waiter.cancel();

        assertThat(waiter.await(Duration.ofSeconds(5))).isTrue();
        assertThat(waiter.getResult()).isNull();
    }

    @Test
    @DisplayName("Expiring should reject later matches but hand back one that got in first")
    void expireShouldCloseTheResultSlot() {
        OneShotWaiter expired = manager.addWaiter("on_ready", null);
        assertThat(expired.expire()).isNull();
        assertThat(expired.process("on_ready", EventArgs.of("late"))).isFalse();
        assertThat(expired.getResult()).isNull();
        assertThat(expired.isSignalled()).isFalse();

        OneShotWaiter matched = manager.addWaiter("on_ready", null);
        matched.process("on_ready", EventArgs.of("just in time"));
        assertThat(matched.expire()).isEqualTo(EventArgs.of("just in time"));
        assertThat(matched.getResult()).isEqualTo(EventArgs.of("just in time"));
    }

    @Test
    @DisplayName("Unsubscribed waiter should ignore events")
    void unsubscribedWaiterShouldIgnoreEvents() {
        OneShotWaiter waiter = manager.addWaiter("on_ready", null);

        waiter.unsubscribe();

        assertThat(waiter.isActive()).isFalse();
        assertThat(waiter.process("on_ready", EventArgs.of("late"))).isFalse();
        assertThat(waiter.isSignalled()).isFalse();
    }
}
