package com.codeheadsystems.paillier.math;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class PaillierMathTest {

  @Test
  void lTransform_isIntegerDivision() {
    BigInteger n = BigInteger.valueOf(77);
    // 5652^30 mod 5929 = 3928 = 51 * 77 + 1
    assertThat(PaillierMath.lTransform(BigInteger.valueOf(3928), n)).isEqualTo(BigInteger.valueOf(51));
    assertThat(PaillierMath.lTransform(BigInteger.ONE, n)).isEqualTo(BigInteger.ZERO);
    assertThat(PaillierMath.lTransform(BigInteger.valueOf(80), n)).isEqualTo(BigInteger.ONE);
  }

  @Test
  void lcm_ofPrimeMinusOnes() {
    assertThat(PaillierMath.lcm(BigInteger.valueOf(6), BigInteger.valueOf(10))).isEqualTo(BigInteger.valueOf(30));
    assertThat(PaillierMath.lcm(BigInteger.valueOf(4), BigInteger.valueOf(6))).isEqualTo(BigInteger.valueOf(12));
    assertThat(PaillierMath.lcm(BigInteger.valueOf(7), BigInteger.valueOf(7))).isEqualTo(BigInteger.valueOf(7));
  }
}
