package com.eventwait.eventmanager;

import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The single name-and-predicate matching rule used by every subscription kind.
 *
 * <p>A name match records the arguments as {@link #getLastMatchArgs() last match arguments}
 * before the predicate runs, so a rejected event also leaves its arguments behind. Only read
 * them right after {@link #matches} returned {@code true}.
 */
final class EventMatcher {

    private final String eventName;
    private final Predicate<EventArgs> predicate;
    private volatile EventArgs lastMatchArgs;

    EventMatcher(@Nonnull String eventName, @Nullable Predicate<EventArgs> predicate) {
        this.eventName = Objects.requireNonNull(eventName, "eventName");
        this.predicate = predicate; // can be null
    }

    /**
     * @param eventName the dispatched event name, compared case-sensitively
     * @param args the dispatched arguments
     * @return true if the names are equal and the predicate (when present) accepts {@code args}
     */
    boolean matches(String eventName, EventArgs args) {
        if (!this.eventName.equals(eventName)) {
            return false;
        }

        // Recorded even when the predicate rejects the event.
        lastMatchArgs = args;

        if (predicate != null) {
            return predicate.test(args);
        }
        return true;
    }

    String getEventName() {
        return eventName;
    }

    @Nullable
    EventArgs getLastMatchArgs() {
        return lastMatchArgs;
    }
}
