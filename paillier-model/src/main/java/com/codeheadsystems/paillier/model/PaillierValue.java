package com.codeheadsystems.paillier.model;

/**
 * Common view over the four value types of the cryptosystem. Keys and texts are all plain integers underneath; the
 * role keeps one from being mistaken for another.
 */
public interface PaillierValue {

  /**
   * The role this value plays.
   *
   * @return the role
   */
  Role role();

}
