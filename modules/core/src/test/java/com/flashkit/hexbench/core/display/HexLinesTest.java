package com.flashkit.hexbench.core.display;

import com.flashkit.hexbench.core.edit.EditBuffer;
import com.flashkit.hexbench.core.edit.EditEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HexLinesTest {

    @Test
    void shouldSplitIntoRowsWithShortLastRow() {
        EditBuffer buffer = EditBuffer.of(new byte[40]);
        HexLines layout = new HexLines(16);

        List<HexLine> lines = layout.lines(buffer, 0, 10);

        assertThat(layout.lineCount(40)).isEqualTo(3);
        assertThat(lines).extracting(HexLine::offset).containsExactly(0L, 16L, 32L);
        assertThat(lines.get(2).length()).isEqualTo(8);
    }

    @Test
    void shouldFlagModifiedColumns() {
        EditBuffer buffer = EditBuffer.of(new byte[32]);
        new EditEngine(buffer, 10).writeBytes(17, new byte[]{'H', 'i'});

        HexLine line = new HexLines(16).line(buffer, 1);

        assertThat(line.isModified(0)).isFalse();
        assertThat(line.isModified(1)).isTrue();
        assertThat(line.isModified(2)).isTrue();
        assertThat(line.asciiText()).isEqualTo(".Hi.............");
        assertThat(line.offsetText()).isEqualTo("00000010");
    }

    @Test
    void shouldPadHexColumn() {
        HexLine line = new HexLine(0, new byte[]{(byte) 0xAB}, null);

        assertThat(line.hexText(4)).isEqualTo("AB          ");
    }

    @Test
    void shouldReturnWindowFromMiddle() {
        EditBuffer buffer = EditBuffer.of(new byte[100]);

        assertThat(new HexLines(10).lines(buffer, 8, 5)).extracting(HexLine::offset).containsExactly(80L, 90L);
    }
}
