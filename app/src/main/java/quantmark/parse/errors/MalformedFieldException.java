package quantmark.parse.errors;

/** A gate field is missing or holds a token that is not a valid qubit index. */
public final class MalformedFieldException extends CircuitFormatException {
  private static final long serialVersionUID = 1L;

  private final String field;
  private final String token;

  public MalformedFieldException(String field, String token, String gateText) {
    super("Malformed " + field + " field '" + token + "' in gate: " + gateText);
    this.field = field;
    this.token = token;
  }

  public String field() {
    return field;
  }

  public String token() {
    return token;
  }
}
