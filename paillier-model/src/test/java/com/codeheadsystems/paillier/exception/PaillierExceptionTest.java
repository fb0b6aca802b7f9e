package com.codeheadsystems.paillier.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PaillierExceptionTest {

  @Test
  void invalidArgument_carriesKindAndMessage() {
    PaillierException e = PaillierException.invalidArgument("input must be a nonnegative integer");
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    assertThat(e).hasMessage("input must be a nonnegative integer").hasNoCause();
  }

  @Test
  void typeMismatch_carriesKindAndMessage() {
    PaillierException e = PaillierException.typeMismatch("can only decrypt a ciphertext");
    assertThat(e.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
    assertThat(e).hasMessage("can only decrypt a ciphertext");
  }

  @Test
  void cause_isPreserved() {
    ArithmeticException cause = new ArithmeticException("not invertible");
    PaillierException e = new PaillierException(ErrorKind.INVALID_ARGUMENT, "cannot multiply", cause);
    assertThat(e).hasCause(cause);
    assertThat(e).isInstanceOf(RuntimeException.class);
  }
}
