package io.clientforge.spec;

/**
 * The document is missing something generation cannot do without.
 */
public class InvalidSpecException extends SpecException {

  public InvalidSpecException(String message) {
    super(message);
  }
}
