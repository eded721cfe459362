package tagsettings;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public final class PatchField<T> {

    private enum State {
        ABSENT, SET, CLEAR
    }

    private static final PatchField<?> ABSENT = new PatchField<>(State.ABSENT, null);
    private static final PatchField<?> CLEAR = new PatchField<>(State.CLEAR, null);

    private final State state;
    private final T value;

    private PatchField(State state, T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> PatchField<T> absent() {
        return (PatchField<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> PatchField<T> clear() {
        return (PatchField<T>) CLEAR;
    }

    /**
     * A {@code null} value clears the field.
     */
    public static <T> PatchField<T> set(T value) {
        return value == null ? clear() : new PatchField<>(State.SET, value);
    }

    public boolean isPresent() {
        return state != State.ABSENT;
    }

    public boolean isCleared() {
        return state == State.CLEAR;
    }

    public T getValue() {
        if (state != State.SET) {
            throw new IllegalStateException("Patch field has no value: " + state);
        }
        return value;
    }
}
