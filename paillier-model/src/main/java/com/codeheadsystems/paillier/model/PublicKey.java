package com.codeheadsystems.paillier.model;

import java.math.BigInteger;

/**
 * Public half of a key pair: { n, g }.
 *
 * @param n the modulus p * q
 * @param g the generator, an integer modulo n^2
 */
public record PublicKey(BigInteger n, BigInteger g) implements PaillierValue {

  /**
   * Instantiates a new Public key.
   *
   * @param n the n
   * @param g the g
   */
  public PublicKey {
    RoleGuard.requireNonNull(n, "public key requires a modulus");
    RoleGuard.requireNonNull(g, "public key requires a generator");
  }

  /**
   * The ciphertext modulus.
   *
   * @return n^2
   */
  public BigInteger nSquared() {
    return n.multiply(n);
  }

  @Override
  public Role role() {
    return Role.PUBLIC_KEY;
  }
}
