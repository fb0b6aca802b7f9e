package com.codeheadsystems.paillier.model;

/**
 * A secret key and the public key generated with it. The two must be used together when decrypting.
 *
 * @param secretKey the secret key
 * @param publicKey the public key
 */
public record KeyPair(SecretKey secretKey, PublicKey publicKey) {

  /**
   * Instantiates a new Key pair.
   *
   * @param secretKey the secret key
   * @param publicKey the public key
   */
  public KeyPair {
    RoleGuard.require(secretKey, SecretKey.class, "key pair requires a secret key");
    RoleGuard.require(publicKey, PublicKey.class, "key pair requires a public key");
  }
}
