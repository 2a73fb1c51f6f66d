package com.codeheadsystems.hivemind.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class Base58Test {

  @ParameterizedTest
  @CsvSource({
      "'', ''",
      "61, 2g",
      "626262, a3gV",
      "636363, aPEr",
      "00000000000000000000, 1111111111",
      "00eb15231dfceb60925886b67d065299925915aeb172c06647, 1NS17iag9jJgTHD1VXjvLCEnZuQ3rJDE9L",
      "516b6fcd0f, ABnLTmg",
      "ecac89cad93923c02321, EJDM8drfXA6uyA"
  })
  void encodeAndDecode_knownVectors(String hex, String base58) {
    byte[] bytes = HexFormat.of().parseHex(hex);

    assertThat(Base58.encode(bytes)).isEqualTo(base58);
    assertThat(Base58.decode(base58)).isEqualTo(bytes);
  }

  @Test
  void encode_text() {
    assertThat(Base58.encode("Hello World!".getBytes(StandardCharsets.UTF_8)))
        .isEqualTo("2NEpo7TZRRrLZSi2U");
  }

  @Test
  void decode_invalidCharacter_throws() {
    assertThatThrownBy(() -> Base58.decode("abc0def"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Base58.decode("Il"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void decode_null_throws() {
    assertThatThrownBy(() -> Base58.decode(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void thirtyTwoByteKey_survivesLeadingZeros() {
    byte[] key = new byte[32];
    key[31] = 7;

    String encoded = Base58.encode(key);

    assertThat(encoded).startsWith("1111");
    assertThat(Base58.decode(encoded)).hasSize(32).isEqualTo(key);
  }
}
