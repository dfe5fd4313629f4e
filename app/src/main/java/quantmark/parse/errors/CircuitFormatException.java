package quantmark.parse.errors;

/** Base type for every failure raised while turning circuit text into a circuit. */
public abstract class CircuitFormatException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  protected CircuitFormatException(String message) {
    super(message);
  }

  protected CircuitFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
