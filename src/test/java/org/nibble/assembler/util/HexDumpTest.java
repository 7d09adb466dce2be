package org.nibble.assembler.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class HexDumpTest {

    @Test
    void formatsOffsetAndBytesPerLine() {
        byte[] data = {0x11, 0x20, (byte) 0xF0, 0x0A, 0x00};

        assertThat(HexDump.format(data, 4)).isEqualTo("0000: 11 20 f0 0a\n0004: 00\n");
    }

    @Test
    void defaultsToSixteenBytesPerLine() {
        String dump = HexDump.format(new byte[64]);

        assertThat(dump.split("\n")).hasSize(4);
        assertThat(dump).startsWith("0000: 00 00").contains("\n0030: 00");
    }

    @Test
    void hexStringHasTwoDigitsPerByte() {
        assertThat(HexDump.toHexString(new byte[]{0x01, (byte) 0xAB})).isEqualTo("01ab");
        assertThat(HexDump.format(new byte[0])).isEmpty();
    }
}
