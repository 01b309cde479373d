package io.clientforge.template;

/**
 * Base class for every failure raised while parsing or building a {@link Template}.
 */
public class TemplateException extends RuntimeException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
