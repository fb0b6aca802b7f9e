package com.codeheadsystems.paillier.exception;

/**
 * The kinds of failure a Paillier operation can report.
 */
public enum ErrorKind {

  /**
   * An argument has the right type but a value the operation cannot accept, such as a negative number handed to the
   * primality test.
   */
  INVALID_ARGUMENT,

  /**
   * An argument does not carry the role the operation requires, such as a secret key passed where a public key is
   * expected or a non-ciphertext passed where a ciphertext is expected.
   */
  TYPE_MISMATCH

}
