package com.codeheadsystems.paillier.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.paillier.exception.ErrorKind;
import com.codeheadsystems.paillier.exception.PaillierException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void defaultConstructor_createsSecureRandom() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.random()).isNotNull();
  }

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    RandomProvider rp = new RandomProvider(custom);
    assertThat(rp.random()).isSameAs(custom);
  }

  @Test
  void randomBelow_staysInRange() {
    RandomProvider rp = new RandomProvider();
    BigInteger bound = BigInteger.valueOf(10);
    Set<BigInteger> seen = new HashSet<>();
    for (int i = 0; i < 500; i++) {
      BigInteger value = rp.randomBelow(bound);
      assertThat(value).isBetween(BigInteger.ZERO, BigInteger.valueOf(9));
      seen.add(value);
    }
    // 500 draws over 10 values; every value should appear
    assertThat(seen).hasSize(10);
  }

  @Test
  void randomBelow_boundOfOne_returnsZero() {
    assertThat(new RandomProvider().randomBelow(BigInteger.ONE)).isEqualTo(BigInteger.ZERO);
  }

  @Test
  void randomBelow_nonPositiveBound_isInvalidArgument() {
    RandomProvider rp = new RandomProvider();
    assertThatThrownBy(() -> rp.randomBelow(BigInteger.ZERO))
        .isInstanceOf(PaillierException.class)
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_ARGUMENT);
    assertThatThrownBy(() -> rp.randomBelow(BigInteger.valueOf(-5)))
        .isInstanceOf(PaillierException.class);
  }

  @Test
  void randomBits_fitsInBitCount() {
    RandomProvider rp = new RandomProvider();
    for (int i = 0; i < 100; i++) {
      assertThat(rp.randomBits(12).bitLength()).isLessThanOrEqualTo(12);
      assertThat(rp.randomBits(12).signum()).isGreaterThanOrEqualTo(0);
    }
  }

  @Test
  void randomBits_zeroBits_isInvalidArgument() {
    assertThatThrownBy(() -> new RandomProvider().randomBits(0))
        .isInstanceOf(PaillierException.class)
        .hasMessageContaining("bit count");
  }

  @Test
  void randomUnit_isNonZeroAndCoprime() {
    RandomProvider rp = new RandomProvider();
    BigInteger modulus = BigInteger.valueOf(36);
    for (int i = 0; i < 200; i++) {
      BigInteger unit = rp.randomUnit(modulus);
      assertThat(unit.signum()).isEqualTo(1);
      assertThat(unit).isLessThan(modulus);
      assertThat(unit.gcd(modulus)).isEqualTo(BigInteger.ONE);
    }
  }

  @Test
  void randomUnit_modulusOfOne_isInvalidArgument() {
    assertThatThrownBy(() -> new RandomProvider().randomUnit(BigInteger.ONE))
        .isInstanceOf(PaillierException.class)
        .hasMessageContaining("modulus");
  }

  @Test
  void seeded_sameSeed_sameStream() {
    RandomProvider a = RandomProvider.seeded(1234L);
    RandomProvider b = RandomProvider.seeded(1234L);
    BigInteger bound = BigInteger.ONE.shiftLeft(256);
    for (int i = 0; i < 10; i++) {
      assertThat(a.randomBelow(bound)).isEqualTo(b.randomBelow(bound));
    }
  }

  @Test
  void seeded_differentSeed_differentStream() {
    BigInteger bound = BigInteger.ONE.shiftLeft(256);
    assertThat(RandomProvider.seeded(1L).randomBelow(bound))
        .isNotEqualTo(RandomProvider.seeded(2L).randomBelow(bound));
  }
}
