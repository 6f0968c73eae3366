package com.wavestone.melonpicker.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawImageTest {

    @Test
    void samplesAreUnsigned() {
        RawImage image = new RawImage(1, 1, 3, new byte[]{(byte) 255, (byte) 200, 0});

        assertThat(image.sample(0)).isEqualTo(255);
        assertThat(image.sample(1)).isEqualTo(200);
        assertThat(image.pixelCount()).isEqualTo(1);
    }

    @Test
    void bufferLengthMustMatchDimensions() {
        assertThatThrownBy(() -> new RawImage(2, 2, 3, new byte[11]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyRgbAndRgbaAreAccepted() {
        assertThatThrownBy(() -> new RawImage(1, 1, 1, new byte[1]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 channels");
    }
}
