package com.codeheadsystems.paillier.model;

import java.math.BigInteger;

/**
 * A plaintext. The modulus it lives under comes from whichever public key it is used with.
 *
 * @param value the value
 */
public record Plaintext(BigInteger value) implements PaillierValue {

  /**
   * Instantiates a new Plaintext.
   *
   * @param value the value
   */
  public Plaintext {
    RoleGuard.requireNonNull(value, "plaintext requires a value");
  }

  /**
   * Plaintext from a long.
   *
   * @param value the value
   * @return the plaintext
   */
  public static Plaintext of(final long value) {
    return new Plaintext(BigInteger.valueOf(value));
  }

  @Override
  public Role role() {
    return Role.PLAINTEXT;
  }
}
