package org.calista.neuro.ai.learn.nn;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelCodecTest {

    private static ValueNetwork net(int seed, int... sizes) {
        return new ValueNetwork(sizes, 0.001, new Random(seed));
    }

    @Test
    void decodeInto_shouldRestoreEncodedWeights() throws Exception {
        ValueNetwork src = net(1, 3, 8, 9);
        ValueNetwork dst = net(2, 3, 8, 9);

        ModelCodec.decodeInto(ModelCodec.encode(src), dst);

        assertThat(dst.sameWeights(src)).isTrue();
    }

    @Test
    void decodeInto_shouldRejectBadMagicAndKeepWeights() {
        ValueNetwork src = net(1, 3, 8, 9);
        ValueNetwork dst = net(2, 3, 8, 9);
        ValueNetwork before = net(3, 3, 8, 9);
        before.copyFrom(dst);

        byte[] bytes = ModelCodec.encode(src);
        bytes[0] ^= 0x7F;

        assertThatThrownBy(() -> ModelCodec.decodeInto(bytes, dst))
                .isInstanceOf(ModelFormatException.class)
                .hasMessageContaining("magic");
        assertThat(dst.sameWeights(before)).isTrue();
    }

    @Test
    void decodeInto_shouldRejectShapeMismatch() {
        byte[] bytes = ModelCodec.encode(net(1, 3, 4, 9));

        assertThatThrownBy(() -> ModelCodec.decodeInto(bytes, net(2, 3, 8, 9)))
                .isInstanceOf(ModelFormatException.class)
                .hasMessageContaining("shape");
    }

    @Test
    void decodeInto_shouldRejectTruncatedAndTrailingBytes() {
        ValueNetwork src = net(1, 3, 4, 9);
        byte[] bytes = ModelCodec.encode(src);

        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 5);
        byte[] trailing = Arrays.copyOf(bytes, bytes.length + 1);

        assertThatThrownBy(() -> ModelCodec.decodeInto(truncated, net(2, 3, 4, 9)))
                .isInstanceOf(ModelFormatException.class);
        assertThatThrownBy(() -> ModelCodec.decodeInto(trailing, net(2, 3, 4, 9)))
                .isInstanceOf(ModelFormatException.class);
    }

    @Test
    void encode_shouldStartWithMagicAndVersion() {
        byte[] bytes = ModelCodec.encode(net(1, 3, 9));

        int magic = ((bytes[0] & 0xFF) << 24) | ((bytes[1] & 0xFF) << 16) | ((bytes[2] & 0xFF) << 8) | (bytes[3] & 0xFF);
        assertThat(magic).isEqualTo(ModelCodec.MAGIC);
        assertThat(bytes[7]).isEqualTo((byte) ModelCodec.VERSION);
    }
}
