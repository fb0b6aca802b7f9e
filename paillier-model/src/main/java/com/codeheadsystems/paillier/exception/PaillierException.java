package com.codeheadsystems.paillier.exception;

/**
 * Raised when a Paillier operation rejects its input. The {@link ErrorKind} tells callers which contract was broken.
 */
public class PaillierException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new Paillier exception.
   *
   * @param kind    the kind of failure
   * @param message the message
   */
  public PaillierException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Paillier exception.
   *
   * @param kind    the kind of failure
   * @param message the message
   * @param cause   the cause
   */
  public PaillierException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Invalid argument exception.
   *
   * @param message the message
   * @return the paillier exception
   */
  public static PaillierException invalidArgument(final String message) {
    return new PaillierException(ErrorKind.INVALID_ARGUMENT, message);
  }

  /**
   * Type mismatch exception.
   *
   * @param message the message
   * @return the paillier exception
   */
  public static PaillierException typeMismatch(final String message) {
    return new PaillierException(ErrorKind.TYPE_MISMATCH, message);
  }

  /**
   * The kind of failure.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }
}
