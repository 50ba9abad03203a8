package com.codeheadsystems.fido2.api.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class AuthenticatorExceptionTest {

  @Test
  void statusCodes_matchCtapValues() {
    assertThat(CtapStatusCode.INVALID_PARAMETER.code()).isEqualTo((byte) 0x02);
    assertThat(CtapStatusCode.INVALID_LENGTH.code()).isEqualTo((byte) 0x03);
    assertThat(CtapStatusCode.MISSING_PARAMETER.code()).isEqualTo((byte) 0x14);
    assertThat(CtapStatusCode.UNSUPPORTED_ALGORITHM.code()).isEqualTo((byte) 0x26);
    assertThat(CtapStatusCode.OPERATION_DENIED.code()).isEqualTo((byte) 0x27);
    assertThat(CtapStatusCode.UNSUPPORTED_OPTION.code()).isEqualTo((byte) 0x2B);
    assertThat(CtapStatusCode.INVALID_OPTION.code()).isEqualTo((byte) 0x2C);
    assertThat(CtapStatusCode.NO_CREDENTIALS.code()).isEqualTo((byte) 0x2E);
    assertThat(CtapStatusCode.OTHER.code()).isEqualTo((byte) 0x7F);
  }

  @Test
  void dependencyFailures_carryTheirStatus() {
    IOException cause = new IOException("boom");

    assertThat(new CredentialStorageException("s", cause).statusCode()).isEqualTo(CtapStatusCode.OTHER);
    assertThat(new CredentialStorageException("s", cause)).hasCause(cause);
    assertThat(new CredentialNotFoundException("n").statusCode()).isEqualTo(CtapStatusCode.NO_CREDENTIALS);
    assertThat(new CryptoOperationException("c", cause).statusCode()).isEqualTo(CtapStatusCode.OTHER);
    assertThat(new UserPresenceException("u").statusCode()).isEqualTo(CtapStatusCode.OTHER);
  }

  @Test
  void statusOnly_usesStatusNameAsMessage() {
    assertThat(new AuthenticatorException(CtapStatusCode.OPERATION_DENIED)).hasMessage("OPERATION_DENIED");
  }
}
