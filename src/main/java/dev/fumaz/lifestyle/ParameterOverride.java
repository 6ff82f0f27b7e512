package dev.fumaz.lifestyle;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A constructor argument supplied at registration time instead of being resolved from the container.
 */
public final class ParameterOverride {

    private final int index;
    private final @Nullable Object value;

    private ParameterOverride(int index, @Nullable Object value) {
        this.index = index;
        this.value = value;
    }

    public static ParameterOverride of(int index, @Nullable Object value) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }

        return new ParameterOverride(index, value);
    }

    public int getIndex() {
        return index;
    }

    public @Nullable Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ParameterOverride)) {
            return false;
        }

        ParameterOverride that = (ParameterOverride) o;
        return index == that.index && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value);
    }

    @Override
    public String toString() {
        return "ParameterOverride{" + index + "=" + value + "}";
    }
}
