package com.codeheadsystems.paillier.model;

import java.math.BigInteger;

/**
 * Secret half of a key pair: { lambda, mu }.
 *
 * @param lambda lcm(p - 1, q - 1)
 * @param mu     the inverse, modulo n, of L(g^lambda mod n^2)
 */
public record SecretKey(BigInteger lambda, BigInteger mu) implements PaillierValue {

  /**
   * Instantiates a new Secret key.
   *
   * @param lambda the lambda
   * @param mu     the mu
   */
  public SecretKey {
    RoleGuard.requireNonNull(lambda, "secret key requires lambda");
    RoleGuard.requireNonNull(mu, "secret key requires mu");
  }

  @Override
  public Role role() {
    return Role.SECRET_KEY;
  }

  @Override
  public String toString() {
    return "SecretKey[redacted]";
  }
}
