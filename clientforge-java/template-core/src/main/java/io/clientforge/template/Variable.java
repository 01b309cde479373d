package io.clientforge.template;

import java.util.Objects;
import java.util.function.Function;

/**
 * A named placeholder of a {@link Template} together with the rules used to turn a
 * supplied value into text.
 *
 * <p>The {@link #getType() type} is the semantic type a supplied value must be an instance
 * of. Conditional placeholders are always {@link Boolean}.
 *
 * @param <T> the accepted value type
 */
public final class Variable<T> {

    private final String name;
    private final VariableKind kind;
    private final Class<T> type;
    private final Function<? super T, String> formatter;
    private final boolean optional;
    private final boolean nullable;

    Variable(String name, VariableKind kind, Class<T> type, Function<? super T, String> formatter,
             boolean optional, boolean nullable) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.type = Objects.requireNonNull(type, "type");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.optional = optional;
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public VariableKind getKind() {
        return kind;
    }

    public Class<T> getType() {
        return type;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * Checks that {@code value} is acceptable for this variable and casts it.
     *
     * @throws TypeMismatchException if the value is null and the variable is not nullable,
     *                               or if the value is not an instance of {@link #getType()}
     */
    T accept(Object value) {
        if (value == null) {
            if (!nullable) {
                throw TypeMismatchException.nullValue(name, type);
            }
            return null;
        }
        if (!type.isInstance(value)) {
            throw TypeMismatchException.wrongType(name, value, type);
        }
        return type.cast(value);
    }

    /**
     * Formats an accepted value. A {@code null} value formats to empty text.
     */
    String format(Object value) {
        T accepted = accept(value);
        return accepted == null ? "" : formatter.apply(accepted);
    }

    @Override
    public String toString() {
        return "Variable{" + name + ", " + kind + ", " + type.getSimpleName() + "}";
    }
}
