package com.williamcallahan.boxhunt.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerceptualHashTest {

    @Test
    void hexFormIsSixteenLowercaseDigits() {
        PerceptualHash hash = new PerceptualHash(0xABL);

        assertThat(hash.toHex()).isEqualTo("00000000000000ab");
        assertThat(PerceptualHash.fromHex("00000000000000AB")).isEqualTo(hash);
    }

    @Test
    void parsesHashesWithHighBitSet() {
        PerceptualHash hash = PerceptualHash.fromHex("ffff0000ffff0000");

        assertThat(hash.bits()).isEqualTo(0xFFFF0000FFFF0000L);
    }

    @Test
    void distanceCountsDifferingBits() {
        PerceptualHash a = new PerceptualHash(0b1011L);
        PerceptualHash b = new PerceptualHash(0b0001L);

        assertThat(a.distanceTo(b)).isEqualTo(2);
        assertThat(a.isNearDuplicateOf(b, 2)).isTrue();
        assertThat(a.isNearDuplicateOf(b, 1)).isFalse();
    }

    @Test
    void rejectsMalformedHex() {
        assertThatThrownBy(() -> PerceptualHash.fromHex("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PerceptualHash.fromHex("xyz")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PerceptualHash.fromHex("0123456789abcdef0")).isInstanceOf(IllegalArgumentException.class);
    }
}
