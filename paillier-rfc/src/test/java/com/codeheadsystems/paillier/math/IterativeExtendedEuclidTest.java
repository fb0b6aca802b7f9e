package com.codeheadsystems.paillier.math;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IterativeExtendedEuclidTest {

  private final ExtendedEuclid euclid = new IterativeExtendedEuclid();

  @ParameterizedTest(name = "egcd({0}, {1}) = {2}")
  @CsvSource({
      "3, 7, 1",
      "51, 77, 1",
      "240, 46, 2",
      "12, 18, 6",
      "17, 17, 17",
      "0, 77, 77",
      "77, 0, 77"
  })
  void egcd_satisfiesBezoutIdentity(long a, long b, long gcd) {
    BigInteger bigA = BigInteger.valueOf(a);
    BigInteger bigB = BigInteger.valueOf(b);

    EuclidResult result = euclid.egcd(bigA, bigB);

    assertThat(result.gcd()).isEqualTo(BigInteger.valueOf(gcd));
    assertThat(bigA.multiply(result.x()).add(bigB.multiply(result.y()))).isEqualTo(result.gcd());
  }

  @Test
  void egcd_coefficientIsModularInverse() {
    EuclidResult result = euclid.egcd(BigInteger.valueOf(51), BigInteger.valueOf(77));
    assertThat(result.x().mod(BigInteger.valueOf(77))).isEqualTo(BigInteger.valueOf(74));
  }

  @Test
  void egcd_largeOperands_matchesBigInteger() {
    Random random = new Random(42);
    for (int i = 0; i < 50; i++) {
      BigInteger a = new BigInteger(512, random);
      BigInteger b = new BigInteger(512, random);

      EuclidResult result = euclid.egcd(a, b);

      assertThat(result.gcd()).isEqualTo(a.gcd(b));
      assertThat(a.multiply(result.x()).add(b.multiply(result.y()))).isEqualTo(result.gcd());
      if (result.gcd().equals(BigInteger.ONE)) {
        assertThat(result.x().mod(b)).isEqualTo(a.modInverse(b));
      }
    }
  }
}
