package eqlib.engine.expr;

/** Hard failure of an expression operation. Expected outcomes (no match) are never thrown. */
public class ExprException extends RuntimeException {
  public enum Kind {
    BINDING_CONFLICT,
    MALFORMED_PATTERN,
    INFERENCE_FAILURE,
    ADDRESS_NOT_FOUND,
    NO_MATCH,
    NOT_REARRANGEABLE,
    MALFORMED_FORMAT
  }

  private final Kind kind;

  public ExprException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
