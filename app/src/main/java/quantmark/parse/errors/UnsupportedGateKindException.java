package quantmark.parse.errors;

/** Gate name outside the supported set; the grammar and the gate dispatch disagree. */
public final class UnsupportedGateKindException extends CircuitFormatException {
  private static final long serialVersionUID = 1L;

  private final String gateName;

  public UnsupportedGateKindException(String gateName) {
    super("Unsupported gate kind: " + gateName);
    this.gateName = gateName;
  }

  public String gateName() {
    return gateName;
  }
}
