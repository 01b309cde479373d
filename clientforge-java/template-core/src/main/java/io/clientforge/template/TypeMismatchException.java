package io.clientforge.template;

/**
 * Thrown when a supplied value does not fit the placeholder it is bound to: a value of the
 * wrong type, a {@code null} for a placeholder that is not nullable, or one name used for
 * two different kinds of placeholder.
 */
public class TypeMismatchException extends TemplateException {

    private final String variableName;

    public TypeMismatchException(String variableName, String message) {
        super(message);
        this.variableName = variableName;
    }

    static TypeMismatchException wrongType(String variableName, Object value, Class<?> expected) {
        return new TypeMismatchException(variableName,
            "Value supplied for '" + variableName + "' (" + value + ") is not the correct type! "
                + "It is of type '" + value.getClass().getSimpleName()
                + "' but needs to be of type '" + expected.getSimpleName() + "'");
    }

    static TypeMismatchException nullValue(String variableName, Class<?> expected) {
        return new TypeMismatchException(variableName,
            "Value supplied for '" + variableName + "' is null but the variable is not nullable "
                + "(expected type '" + expected.getSimpleName() + "')");
    }

    static TypeMismatchException kindConflict(String variableName, VariableKind first, VariableKind second) {
        return new TypeMismatchException(variableName,
            "Placeholder '" + variableName + "' is used as " + first + " and as " + second);
    }

    public String getVariableName() {
        return variableName;
    }
}
