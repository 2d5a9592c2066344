package io.pemdas.calc;

import java.util.Objects;

/**
 * Thrown when an expression cannot be evaluated.
 *
 * <p>Carries the {@link ErrorKind} and, where known, the zero-based character offset in the input
 * at which the problem was detected.
 */
public final class ExpressionParseException extends RuntimeException {
  /** Position value used when no offset applies. */
  public static final int NO_POSITION = -1;

  private final ErrorKind kind;
  private final int position;

  public ExpressionParseException(ErrorKind kind, int position) {
    this(kind, position, null);
  }

  public ExpressionParseException(ErrorKind kind, int position, String detail) {
    super(formatMessage(Objects.requireNonNull(kind, "kind"), position, detail));
    this.kind = kind;
    this.position = position;
  }

  private static String formatMessage(ErrorKind kind, int position, String detail) {
    StringBuilder sb = new StringBuilder(kind.description());
    if (position != NO_POSITION) {
      sb.append(" at pos ").append(position);
    }
    if (detail != null && !detail.isEmpty()) {
      sb.append(": ").append(detail);
    }
    return sb.toString();
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * @return zero-based offset of the offending character, or {@link #NO_POSITION}
   */
  public int position() {
    return position;
  }
}
