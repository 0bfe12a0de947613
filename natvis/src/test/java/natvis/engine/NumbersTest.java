package natvis.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import static org.junit.jupiter.api.Assertions.*;

class NumbersTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "0x602010                      | 6299664",
        "0x602010 <global_list>        | 6299664",
        "  0X10                        | 16",
        "4096                          | 4096",
        "0x0                           | 0",
        "{...}                         | 0",
        "<error reading variable>      | 0",
    })
    void parsesTheLeadingAddress(String text, long expected) {
        assertEquals(expected, Numbers.parseAddr(text));
    }

    @Test
    void addressOfNothingIsZero() {
        assertEquals(0, Numbers.parseAddr(null));
        assertEquals(0, Numbers.parseAddr("   "));
    }

    @ParameterizedTest
    @CsvSource({
        "0, 0",
        "42, 42",
        "0x2a, 42",
        "' 7 ', 7",
        "4294967295, 4294967295",
    })
    void strictUnsignedParse(String text, long expected) {
        assertEquals(expected, Numbers.parseUintOrThrow(text));
    }

    @ParameterizedTest
    @ValueSource(strings = { "-1", "4294967296", "ten", "", "3 items" })
    void strictUnsignedParseRejects(String text) {
        assertThrows(SizeParseException.class, () -> Numbers.parseUintOrThrow(text));
        assertEquals(0, Numbers.parseUint(text), "the lenient parse turns the same input into 0");
    }

    @Test
    void clampsToMaxExpand() {
        assertEquals(3, Numbers.clampToMaxExpand(3));
        assertEquals(natvis.NatvisConfig.MAX_EXPAND, Numbers.clampToMaxExpand(0xFFFFFFFFL));
    }
}
