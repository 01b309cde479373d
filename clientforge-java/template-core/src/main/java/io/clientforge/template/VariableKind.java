package io.clientforge.template;

/**
 * How a placeholder behaves when it is built.
 */
public enum VariableKind {
    /** Required value, substituted in place. */
    PLAIN,
    /** May be left out of the arguments; formats to empty text when absent. */
    OPTIONAL,
    /** May be absent or explicitly {@code null}; {@code null} formats to empty text. */
    NULLABLE,
    /** {@code %~cond -> "text"~%}: a false condition drops the whole output line. */
    WHOLE_LINE,
    /** {@code %cond -> "text"%}: a false condition substitutes empty text. */
    CONDITIONAL;

    public boolean isConditional() {
        return this == WHOLE_LINE || this == CONDITIONAL;
    }
}
