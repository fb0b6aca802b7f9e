package com.codeheadsystems.paillier;

import com.codeheadsystems.paillier.cipher.PaillierCryptosystem;
import com.codeheadsystems.paillier.model.Ciphertext;
import com.codeheadsystems.paillier.model.Plaintext;
import com.codeheadsystems.paillier.model.PublicKey;
import com.codeheadsystems.paillier.model.RoleGuard;
import com.codeheadsystems.paillier.model.SecretKey;
import java.math.BigInteger;

/**
 * Entry point for callers that hold keys and texts as {@link Object}, for example values pulled out of a generic map
 * or handed over by a scripting bridge. Each argument is checked for its role, failing with
 * {@link com.codeheadsystems.paillier.exception.ErrorKind#TYPE_MISMATCH}, before the call is handed to {@link Paillier}.
 */
public class DynamicPaillier {

  static final String INTEGER_PLAINTEXT_MESSAGE = "can only encrypt an integer plaintext";

  private final Paillier paillier;

  /**
   * Instantiates a new Dynamic paillier.
   *
   * @param paillier the typed facade to delegate to
   */
  public DynamicPaillier(final Paillier paillier) {
    this.paillier = paillier;
  }

  /**
   * Encrypts a {@link Plaintext} or an integral number.
   *
   * @param publicKey the public key
   * @param plaintext the plaintext
   * @return the ciphertext
   */
  public Ciphertext encrypt(final Object publicKey, final Object plaintext) {
    final PublicKey key = RoleGuard.require(publicKey, PublicKey.class, PaillierCryptosystem.ENCRYPT_KEY_MESSAGE);
    if (plaintext instanceof Plaintext typed) {
      return paillier.encrypt(key, typed);
    }
    final BigInteger value = RoleGuard.requireInteger(plaintext, INTEGER_PLAINTEXT_MESSAGE);
    return paillier.encrypt(key, value);
  }

  /**
   * Decrypts a ciphertext.
   *
   * @param secretKey  the secret key
   * @param publicKey  the public key
   * @param ciphertext the ciphertext
   * @return the plaintext
   */
  public Plaintext decrypt(final Object secretKey, final Object publicKey, final Object ciphertext) {
    final SecretKey sk = RoleGuard.require(secretKey, SecretKey.class, PaillierCryptosystem.DECRYPT_KEY_MESSAGE);
    final PublicKey pk = RoleGuard.require(publicKey, PublicKey.class, PaillierCryptosystem.DECRYPT_KEY_MESSAGE);
    final Ciphertext c = RoleGuard.require(ciphertext, Ciphertext.class,
        PaillierCryptosystem.DECRYPT_CIPHERTEXT_MESSAGE);
    return paillier.decrypt(sk, pk, c);
  }

  /**
   * Adds two ciphertexts.
   *
   * @param publicKey the public key
   * @param c         the c
   * @param d         the d
   * @return the encrypted sum
   */
  public Ciphertext add(final Object publicKey, final Object c, final Object d) {
    final PublicKey pk = RoleGuard.require(publicKey, PublicKey.class, PaillierCryptosystem.OPERATION_KEY_MESSAGE);
    final Ciphertext first = RoleGuard.require(c, Ciphertext.class, PaillierCryptosystem.ADD_MESSAGE);
    final Ciphertext second = RoleGuard.require(d, Ciphertext.class, PaillierCryptosystem.ADD_MESSAGE);
    return paillier.add(pk, first, second);
  }

  /**
   * Multiplies a ciphertext by an integral scalar.
   *
   * @param publicKey the public key
   * @param c         the c
   * @param scalar    the scalar
   * @return the encrypted product
   */
  public Ciphertext mul(final Object publicKey, final Object c, final Object scalar) {
    final PublicKey pk = RoleGuard.require(publicKey, PublicKey.class, PaillierCryptosystem.OPERATION_KEY_MESSAGE);
    final Ciphertext ciphertext = RoleGuard.require(c, Ciphertext.class,
        PaillierCryptosystem.MULTIPLY_CIPHERTEXT_MESSAGE);
    final BigInteger s = RoleGuard.requireInteger(scalar, PaillierCryptosystem.MULTIPLY_SCALAR_MESSAGE);
    return paillier.mul(pk, ciphertext, s);
  }
}
