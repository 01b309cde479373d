package io.clientforge.template;

/**
 * Thrown when template text does not follow the placeholder grammar.
 */
public class TemplateSyntaxException extends TemplateException {

    private final int line;
    private final int column;

    public TemplateSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
