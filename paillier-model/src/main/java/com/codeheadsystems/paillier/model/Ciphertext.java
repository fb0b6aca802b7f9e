package com.codeheadsystems.paillier.model;

import java.math.BigInteger;

/**
 * A ciphertext in [0, n^2). Only meaningful together with the public key that produced it.
 *
 * @param value the value
 */
public record Ciphertext(BigInteger value) implements PaillierValue {

  /**
   * Instantiates a new Ciphertext.
   *
   * @param value the value
   */
  public Ciphertext {
    RoleGuard.requireNonNull(value, "ciphertext requires a value");
  }

  @Override
  public Role role() {
    return Role.CIPHERTEXT;
  }
}
