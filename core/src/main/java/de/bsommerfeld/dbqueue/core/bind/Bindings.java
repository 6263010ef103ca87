package de.bsommerfeld.dbqueue.core.bind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.dbqueue.core.value.Value;
import de.bsommerfeld.dbqueue.core.value.Values;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable arguments for one statement execution.
 *
 * <p>
 * Bindings are either <em>positional</em>, an ordered sequence matched to the
 * statement's parameter slots by index, or <em>named</em>, a map matched to
 * {@code :name}, {@code @name} and {@code $name} placeholders by exact name.
 * Every argument is converted to a {@link Value} when the bindings are
 * created, so a malformed argument fails before any statement is touched.
 *
 * <pre>{@code
 * Bindings.of("Arthur", 36)
 * Bindings.named(Map.of("name", "Arthur", "age", 36))
 * Bindings.builder().put("name", "Arthur").put("age", 36).build()
 * }</pre>
 */
public final class Bindings {

    /** No arguments. Matches statements without placeholders. */
    public static final Bindings NONE = new Bindings(ImmutableList.of(), null);

    private final ImmutableList<Value> positional;
    private final ImmutableMap<String, Value> named;

    private Bindings(ImmutableList<Value> positional, ImmutableMap<String, Value> named) {
        this.positional = positional;
        this.named = named;
    }

    public static Bindings of(Object... arguments) {
        if (arguments == null)
            return new Bindings(ImmutableList.of(Value.NULL), null);
        return of(Arrays.asList(arguments));
    }

    public static Bindings of(List<?> arguments) {
        Objects.requireNonNull(arguments, "arguments");
        ImmutableList.Builder<Value> values = ImmutableList.builderWithExpectedSize(arguments.size());
        for (Object argument : arguments)
            values.add(Values.of(argument));
        return new Bindings(values.build(), null);
    }

    /**
     * Named bindings. Keys are placeholder names without their prefix; a
     * leading {@code :}, {@code @} or {@code $} is stripped.
     */
    public static Bindings named(Map<String, ?> arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Builder builder = builder();
        arguments.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isNamed() {
        return named != null;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int size() {
        return named != null ? named.size() : positional.size();
    }

    /**
     * Positional values in slot order. Empty for named bindings.
     */
    public List<Value> values() {
        return named != null ? ImmutableList.of() : positional;
    }

    /**
     * The value for a 1-based positional slot.
     *
     * @throws IndexOutOfBoundsException if the slot has no value
     */
    public Value value(int slot) {
        if (named != null || slot < 1 || slot > positional.size())
            throw new IndexOutOfBoundsException("No positional argument for slot " + slot);
        return positional.get(slot - 1);
    }

    /** The value for a named placeholder, empty if absent or if these bindings are positional. */
    public Optional<Value> value(String name) {
        if (named == null)
            return Optional.empty();
        return Optional.ofNullable(named.get(stripPrefix(name)));
    }

    /** Named values in insertion order. Empty for positional bindings. */
    public Map<String, Value> namedValues() {
        return named != null ? named : ImmutableMap.of();
    }

    static String stripPrefix(String name) {
        Objects.requireNonNull(name, "name");
        if (!name.isEmpty() && (name.charAt(0) == ':' || name.charAt(0) == '@' || name.charAt(0) == '$'))
            return name.substring(1);
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Bindings other))
            return false;
        return Objects.equals(positional, other.positional) && Objects.equals(named, other.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return named != null ? named.toString() : positional.toString();
    }

    /** Accumulates named arguments. Later puts for the same name win. */
    public static final class Builder {

        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, Object argument) {
            values.put(stripPrefix(name), Values.of(argument));
            return this;
        }

        public Bindings build() {
            return new Bindings(ImmutableList.of(), ImmutableMap.copyOf(values));
        }
    }
}
