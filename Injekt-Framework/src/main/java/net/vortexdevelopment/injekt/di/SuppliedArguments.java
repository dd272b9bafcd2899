package net.vortexdevelopment.injekt.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Constructor arguments given explicitly by the caller, by position and by parameter name.
 *
 * <p>Supplied values are used verbatim for their parameter and are never placed in the registry.
 * Null values are allowed for reference-typed parameters.
 *
 * <pre>
 * {@code
 * SuppliedArguments arguments = SuppliedArguments.builder()
 *         .named("database", new InMemoryDatabase())
 *         .build();
 * UserService service = Injekt.construct(UserService.class, arguments);
 * }
 * </pre>
 */
public final class SuppliedArguments {

    private static final SuppliedArguments NONE = new SuppliedArguments(new Builder());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private SuppliedArguments(Builder builder) {
        this.positional = Collections.unmodifiableList(new ArrayList<>(builder.positional));
        this.named = Collections.unmodifiableMap(new LinkedHashMap<>(builder.named));
    }

    public static SuppliedArguments none() {
        return NONE;
    }

    public static SuppliedArguments positional(Object... values) {
        return builder().positional(values).build();
    }

    public static SuppliedArguments named(@NotNull String name, @Nullable Object value) {
        return builder().named(name, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }

    public int getPositionalCount() {
        return positional.size();
    }

    public boolean hasPositional(int index) {
        return index < positional.size();
    }

    @Nullable
    public Object getPositional(int index) {
        return positional.get(index);
    }

    public boolean hasNamed(@NotNull String name) {
        return named.containsKey(name);
    }

    @Nullable
    public Object getNamed(@NotNull String name) {
        return named.get(name);
    }

    @NotNull
    public Set<String> getNames() {
        return named.keySet();
    }

    @Override
    public String toString() {
        return "SuppliedArguments{positional=" + positional.size() + ", named=" + named.keySet() + "}";
    }

    public static class Builder {
        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> named = new LinkedHashMap<>();

        /**
         * Append positional values, filling parameters from the first one onwards.
         */
        public Builder positional(Object... values) {
            positional.addAll(Arrays.asList(values));
            return this;
        }

        /**
         * Supply a value for the constructor parameter with the given name.
         */
        public Builder named(@NotNull String name, @Nullable Object value) {
            named.put(name, value);
            return this;
        }

        public SuppliedArguments build() {
            return new SuppliedArguments(this);
        }
    }
}
