package com.eventwait.eventmanager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Immutable, ordered tuple of the arguments delivered with one dispatched event.
 *
 * <p>The values are opaque to the manager: they are captured as given by the event source and
 * handed unchanged to predicates and to waiting callers. Individual values may be {@code null}.
 */
public final class EventArgs {

    private static final EventArgs EMPTY = new EventArgs(Collections.emptyList());

    private final List<Object> values;

    private EventArgs(List<Object> values) {
        this.values = values;
    }

    /**
     * Creates a tuple holding the given values in order.
     *
     * @param values the argument values, individual elements may be null
     * @return the tuple
     * @throws NullPointerException if the array itself is null
     */
    public static EventArgs of(@Nonnull Object... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            return EMPTY;
        }
        return new EventArgs(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))));
    }

    /**
     * Creates a tuple from a list, copying it.
     *
     * @param values the argument values, individual elements may be null
     * @return the tuple
     */
    public static EventArgs copyOf(@Nonnull List<?> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new EventArgs(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static EventArgs empty() {
        return EMPTY;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns the value at the given position.
     *
     * @param index zero-based position
     * @return the value, possibly null
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Returns the value at the given position cast to the expected type.
     *
     * @param index zero-based position
     * @param type the expected type
     * @param <T> the expected type
     * @return the value, possibly null
     * @throws ClassCastException if the value is not an instance of {@code type}
     */
    public <T> T get(int index, @Nonnull Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object value = values.get(index);
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException(String.format(
                "Argument %d is a %s, not a %s", index, value.getClass().getName(), type.getName()));
        }
        return type.cast(value);
    }

    /**
     * @return an unmodifiable view of the values
     */
    public List<Object> asList() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventArgs)) return false;
        return values.equals(((EventArgs) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "EventArgs" + values;
    }
}
