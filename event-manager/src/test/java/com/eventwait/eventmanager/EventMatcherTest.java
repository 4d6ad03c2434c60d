package com.eventwait.eventmanager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventMatcher Tests")
class EventMatcherTest {

    @Test
    @DisplayName("Should reject a different event name without running the predicate")
    void shouldRejectDifferentName() {
        AtomicInteger predicateCalls = new AtomicInteger();
        EventMatcher matcher = new EventMatcher("on_ready", args -> {
            predicateCalls.incrementAndGet();
            return true;
        });

        assertThat(matcher.matches("on_message", EventArgs.of("x"))).isFalse();
        assertThat(predicateCalls).hasValue(0);
        assertThat(matcher.getLastMatchArgs()).isNull();
    }

    @Test
    @DisplayName("Should compare event names case-sensitively")
    void shouldCompareNamesCaseSensitively() {
        EventMatcher matcher = new EventMatcher("on_ready", null);

        assertThat(matcher.matches("ON_READY", EventArgs.empty())).isFalse();
        assertThat(matcher.matches("on_ready", EventArgs.empty())).isTrue();
    }

    @Test
    @DisplayName("Should accept any arguments when no predicate is given")
    void shouldAcceptAnyArgumentsWithoutPredicate() {
        EventMatcher matcher = new EventMatcher("on_ready", null);
        EventArgs args = EventArgs.of(1, "two");

        assertThat(matcher.matches("on_ready", args)).isTrue();
        assertThat(matcher.getLastMatchArgs()).isEqualTo(args);
    }

    @Test
    @DisplayName("Should return the predicate result on a name match")
    void shouldApplyPredicate() {
        EventMatcher matcher = new EventMatcher("on_message", args -> args.get(0, Integer.class) > 5);

        assertThat(matcher.matches("on_message", EventArgs.of(3))).isFalse();
        assertThat(matcher.matches("on_message", EventArgs.of(7))).isTrue();
    }

    @Test
    @DisplayName("Should record arguments of a name match even when the predicate rejects them")
    void shouldRecordArgumentsOfRejectedEvent() {
        EventMatcher matcher = new EventMatcher("on_message", args -> false);
        EventArgs rejected = EventArgs.of("ignored");

        assertThat(matcher.matches("on_message", rejected)).isFalse();
        assertThat(matcher.getLastMatchArgs()).isSameAs(rejected);
    }

    @Test
    @DisplayName("Should require an event name")
    void shouldRequireEventName() {
        assertThatThrownBy(() -> new EventMatcher(null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("eventName");
    }
}
