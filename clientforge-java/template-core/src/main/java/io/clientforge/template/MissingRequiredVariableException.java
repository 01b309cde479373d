package io.clientforge.template;

/**
 * Thrown when a template is built without a value for a placeholder that is
 * neither optional nor nullable.
 */
public class MissingRequiredVariableException extends TemplateException {

    private final String variableName;

    public MissingRequiredVariableException(String variableName) {
        super("Required variable '" + variableName + "' not supplied");
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
