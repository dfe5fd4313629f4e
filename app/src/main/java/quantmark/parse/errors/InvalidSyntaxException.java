package quantmark.parse.errors;

/** The text does not match the circuit grammar from the header onward. */
public final class InvalidSyntaxException extends CircuitFormatException {
  private static final long serialVersionUID = 1L;

  public InvalidSyntaxException(String message) {
    super(message);
  }
}
