package org.pragmatica.exprjson.syntax;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiteralTextTest {

    @Test
    void decodeString_escapes_decoded() {
        assertThat(LiteralText.decodeString("\"a\\nb\\t\\\\\\\"\"")).isEqualTo("a\nb\t\\\"");
        assertThat(LiteralText.decodeString("\"\\x41\\0\"")).isEqualTo("A\0");
        assertThat(LiteralText.decodeString("\"\\u{1F600}\"")).isEqualTo("\uD83D\uDE00");
    }

    @Test
    void decodeString_lineContinuation_skipsLeadingWhitespace() {
        assertThat(LiteralText.decodeString("\"a\\\n     b\"")).isEqualTo("ab");
    }

    @Test
    void decodeString_raw_keepsBackslashes() {
        assertThat(LiteralText.decodeString("r#\"a\\n\"b\"#")).isEqualTo("a\\n\"b");
    }

    @Test
    void decodeString_invalidEscapes_rejected() {
        assertThatThrownBy(() -> LiteralText.decodeString("\"\\x80\""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LiteralText.decodeString("\"\\u{D800}\""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LiteralText.decodeString("\"\\u{1234567}\""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decodeChar_singleCharacter() {
        assertThat(LiteralText.decodeChar("'\\''")).isEqualTo("'");
        assertThat(LiteralText.decodeChar("'\u00e9'")).isEqualTo("\u00e9");
        assertThatThrownBy(() -> LiteralText.decodeChar("'ab'"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("exactly one character");
    }

    @Test
    void decodeByteString_highBytesAllowedThroughEscapes() {
        assertThat(LiteralText.decodeByteString("b\"a\\xff\"")).containsExactly('a', 0xff);
        assertThat(LiteralText.decodeByteString("br\"a\\n\"")).containsExactly('a', '\\', 'n');
    }

    @Test
    void decodeByteString_nonAscii_rejected() {
        assertThatThrownBy(() -> LiteralText.decodeByteString("b\"\u00e9\""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LiteralText.decodeByteString("b\"\\u{41}\""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decodeByte_returnsUnsignedValue() {
        assertThat(LiteralText.decodeByte("b'a'")).isEqualTo(97);
        assertThat(LiteralText.decodeByte("b'\\x80'")).isEqualTo(128);
    }

    @Test
    void decodeCString_utf8WithoutTerminator() {
        assertThat(LiteralText.decodeCString("c\"\\u{e9}\"")).containsExactly(0xc3, 0xa9);
        assertThatThrownBy(() -> LiteralText.decodeCString("c\"a\\0\""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nul");
    }

    @Test
    void integerDigits_allRadixes_inBaseTen() {
        assertThat(LiteralText.integerDigits("1_000")).isEqualTo("1000");
        assertThat(LiteralText.integerDigits("0xff")).isEqualTo("255");
        assertThat(LiteralText.integerDigits("0o17")).isEqualTo("15");
        assertThat(LiteralText.integerDigits("0b1010")).isEqualTo("10");
    }

    @Test
    void integerDigits_beyondLongRange_exact() {
        assertThat(LiteralText.integerDigits("0xffffffffffffffffffffffffffffffff"))
            .isEqualTo("340282366920938463463374607431768211455");
        assertThat(LiteralText.integerDigits("123456789012345678901234567890"))
            .isEqualTo("123456789012345678901234567890");
    }

    @Test
    void integerDigits_missingOrBadDigits_rejected() {
        assertThatThrownBy(() -> LiteralText.integerDigits("0x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no digits");
        assertThatThrownBy(() -> LiteralText.integerDigits("0b12"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void floatDigits_keepsTextMinusUnderscores() {
        assertThat(LiteralText.floatDigits("3.14")).isEqualTo("3.14");
        assertThat(LiteralText.floatDigits("1_000.000_1e1_0")).isEqualTo("1000.0001e10");
    }
}
