package com.ethindexer.common;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HexUtilsTest {

    @Test
    void toBigInteger_parsesQuantities() {
        assertThat(HexUtils.toBigInteger("0x0")).isEqualTo(BigInteger.ZERO);
        assertThat(HexUtils.toBigInteger("0x")).isEqualTo(BigInteger.ZERO);
        assertThat(HexUtils.toBigInteger("0xde0b6b3a7640000")).isEqualTo(new BigInteger("1000000000000000000"));
        assertThat(HexUtils.toBigInteger("0XFF")).isEqualTo(BigInteger.valueOf(255));
    }

    @Test
    void toBigInteger_withoutPrefix_throws() {
        assertThatThrownBy(() -> HexUtils.toBigInteger("ff")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> HexUtils.toBigInteger(null)).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void toHex_isMinimalLowercase() {
        assertThat(HexUtils.toHex(100)).isEqualTo("0x64");
        assertThat(HexUtils.toHex(0)).isEqualTo("0x0");
    }

    @Test
    void strip0x_keepsUnprefixedInput() {
        assertThat(HexUtils.strip0x("0xa9059cbb")).isEqualTo("a9059cbb");
        assertThat(HexUtils.strip0x("a9059cbb")).isEqualTo("a9059cbb");
    }

    @Test
    void isAllZeros() {
        assertThat(HexUtils.isAllZeros("000000")).isTrue();
        assertThat(HexUtils.isAllZeros("")).isTrue();
        assertThat(HexUtils.isAllZeros("000100")).isFalse();
    }
}
