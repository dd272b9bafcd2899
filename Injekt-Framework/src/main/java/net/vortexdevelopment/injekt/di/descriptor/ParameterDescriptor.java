package net.vortexdevelopment.injekt.di.descriptor;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single constructor parameter: its position, its name and its declared type.
 */
@Getter
public class ParameterDescriptor {

    private final int index;
    private final String name;
    @Nullable
    private final Class<?> type;

    public ParameterDescriptor(int index, @NotNull String name, @Nullable Class<?> type) {
        this.index = index;
        this.name = name;
        this.type = type;
    }

    /**
     * Whether the container can produce a value for this parameter.
     * Parameters without a declared type, primitives and arrays can only be supplied by the caller.
     */
    public boolean isInjectable() {
        return type != null && !type.isPrimitive() && !type.isArray();
    }

    @Override
    public String toString() {
        return (type != null ? type.getSimpleName() : "?") + " " + name;
    }
}
