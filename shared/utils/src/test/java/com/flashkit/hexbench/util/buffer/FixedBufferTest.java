package com.flashkit.hexbench.util.buffer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FixedBufferTest {

    @Test
    void shouldWrapWithoutCopying() {
        byte[] source = new byte[8];
        FixedBuffer buf = FixedBuffer.wrap(source);

        source[3] = 0x42;

        assertThat(buf.size()).isEqualTo(8);
        assertThat(buf.get(3)).isEqualTo((byte) 0x42);
    }

    @Test
    void shouldSetAndReturnPreviousValue() {
        FixedBuffer buf = FixedBuffer.wrap(new byte[4]);

        byte old = buf.set(2, (byte) 0x7F);

        assertThat(old).isEqualTo((byte) 0);
        assertThat(buf.get(2)).isEqualTo((byte) 0x7F);
        assertThat(buf.getUnsigned(2)).isEqualTo(0x7F);
    }

    @Test
    void shouldReadHighBytesAsUnsigned() {
        FixedBuffer buf = FixedBuffer.wrap(new byte[]{(byte) 0xFE});

        assertThat(buf.get(0)).isEqualTo((byte) -2);
        assertThat(buf.getUnsigned(0)).isEqualTo(0xFE);
    }

    @Test
    void shouldRejectOutOfRangeAccess() {
        FixedBuffer buf = FixedBuffer.wrap(new byte[4]);

        assertThatThrownBy(() -> buf.get(4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> buf.set(-1, (byte) 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> buf.copy(-1, 2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void shouldClipCopiesAtEnd() {
        FixedBuffer buf = FixedBuffer.wrap(new byte[]{1, 2, 3, 4, 5});

        assertThat(buf.copy(3, 10)).containsExactly(4, 5);
        assertThat(buf.copy(5, 3)).isEmpty();
    }

    @Test
    void shouldCheckRangeContainment() {
        FixedBuffer buf = FixedBuffer.wrap(new byte[10]);

        assertThat(buf.contains(0, 10)).isTrue();
        assertThat(buf.contains(8, 3)).isFalse();
        assertThat(buf.contains(-1, 1)).isFalse();
        assertThat(buf.contains(10, 0)).isTrue();
    }

    @Test
    void shouldMatchPatternAtOffset() {
        FixedBuffer buf = FixedBuffer.wrap("xxPKyy".getBytes());

        assertThat(buf.matchesAt(2, "PK".getBytes())).isTrue();
        assertThat(buf.matchesAt(3, "PK".getBytes())).isFalse();
        assertThat(buf.matchesAt(5, "PK".getBytes())).isFalse();
    }

    @Test
    void shouldSnapshotIndependentCopy() {
        FixedBuffer buf = FixedBuffer.wrap(new byte[]{1, 2, 3});

        byte[] snapshot = buf.snapshot();
        buf.set(0, (byte) 9);

        assertThat(snapshot).containsExactly(1, 2, 3);
    }
}
