package com.codeheadsystems.paillier.model;

/**
 * The nominal role a value plays in the cryptosystem.
 */
public enum Role {

  SECRET_KEY,
  PUBLIC_KEY,
  PLAINTEXT,
  CIPHERTEXT

}
