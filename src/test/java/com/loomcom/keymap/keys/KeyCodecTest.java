package com.loomcom.keymap.keys;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for key name / key code conversion.
 */
public class KeyCodecTest {

    private KeyCodec codec;

    @BeforeEach
    public void setUp() {
        codec = new KeyCodec();
    }

    @Test
    public void testShortFormsReplaceTerminalNames() {
        assertEquals("TAB", codec.codeToName(KeyCodes.TAB));
        assertEquals("RET", codec.codeToName(KeyCodes.RETURN));
        assertEquals("ESC", codec.codeToName(KeyCodes.ESCAPE));
        assertEquals("SPC", codec.codeToName(KeyCodes.SPACE));
        assertEquals("UP", codec.codeToName(KeyCodes.KEY_UP));
        assertEquals("DWN", codec.codeToName(KeyCodes.KEY_DOWN));
        assertEquals("LFT", codec.codeToName(KeyCodes.KEY_LEFT));
        assertEquals("RGT", codec.codeToName(KeyCodes.KEY_RIGHT));
        assertEquals("HOM", codec.codeToName(KeyCodes.KEY_HOME));
        assertEquals("END", codec.codeToName(KeyCodes.KEY_END));
        assertEquals("PgD", codec.codeToName(KeyCodes.KEY_NPAGE));
        assertEquals("PgU", codec.codeToName(KeyCodes.KEY_PPAGE));
        assertEquals("INS", codec.codeToName(KeyCodes.KEY_IC));
        assertEquals("DEL", codec.codeToName(KeyCodes.KEY_DC));
        assertEquals("F1", codec.codeToName(KeyCodes.keyF(1)));
        assertEquals("F12", codec.codeToName(KeyCodes.keyF(12)));
    }

    @Test
    public void testTerminalNames() {
        assertEquals("^A", codec.codeToName(0x01));
        assertEquals("^S", codec.codeToName(0x13));
        assertEquals("^M", codec.codeToName(0x0D));
        assertEquals("^?", codec.codeToName(0x7F));
        assertEquals("a", codec.codeToName('a'));
        assertEquals("$", codec.codeToName('$'));
        assertEquals("KEY_BTAB", codec.codeToName(KeyCodes.KEY_BTAB));
        assertEquals("KEY_F(13)", codec.codeToName(KeyCodes.keyF(13)));
        assertEquals("KEY_RESIZE", codec.codeToName(KeyCodes.KEY_RESIZE));
    }

    @Test
    public void testCodesWithoutName() {
        assertNull(codec.codeToName(KeyCodes.NONE));
        assertNull(codec.codeToName(-42));
        assertNull(codec.codeToName(0), "NUL has no name");
        // Offset ASCII never comes out of the reader
        assertNull(codec.codeToName(KeyCodes.UNICODE_OFFSET + 'a'));
        // Surrogates are not characters
        assertNull(codec.codeToName(KeyCodes.UNICODE_OFFSET + 0xD800));
    }

    @Test
    public void testNameToCode() {
        assertEquals(KeyCodes.TAB, codec.nameToCode("TAB"));
        assertEquals(0x01, codec.nameToCode("^A"));
        assertEquals('q', codec.nameToCode("q"));
        assertEquals(KeyCodes.KEY_BTAB, codec.nameToCode("KEY_BTAB"));
        assertEquals(KeyCodes.keyF(5), codec.nameToCode("F5"));
    }

    @Test
    public void testLegacyAliases() {
        assertEquals(KeyCodes.RETURN, codec.nameToCode("^J"));
        assertEquals(KeyCodes.KEY_HOME, codec.nameToCode("KEY_HOME"));
        assertEquals(KeyCodes.KEY_END, codec.nameToCode("KEY_END"));
        // The canonical name is the short form
        assertEquals("RET", codec.codeToName(codec.nameToCode("^J")));
    }

    @Test
    public void testUnknownNames() {
        assertEquals(KeyCodes.NONE, codec.nameToCode(null));
        assertEquals(KeyCodes.NONE, codec.nameToCode(""));
        assertEquals(KeyCodes.NONE, codec.nameToCode("KEY_FOO"));
        assertEquals(KeyCodes.NONE, codec.nameToCode("éé"), "two characters name no key");
    }

    @Test
    public void testMultibyteCharacterNames() {
        int eAcute = codec.nameToCode("é");
        assertEquals(KeyCodes.UNICODE_OFFSET + 0xE9, eAcute);
        assertEquals("é", codec.codeToName(eAcute));

        String clef = new String(Character.toChars(0x1D11E));
        int clefCode = codec.nameToCode(clef);
        assertEquals(KeyCodes.UNICODE_OFFSET + 0x1D11E, clefCode);
        assertEquals(clef, codec.codeToName(clefCode));
    }

    @Test
    public void testEveryNamedDenseCodeRoundTrips() {
        for (int code = 0; code < KeyCodes.UNICODE_OFFSET; code++) {
            String name = codec.codeToName(code);
            if (name != null) {
                assertEquals(code, codec.nameToCode(name), "round trip of " + name);
            }
        }
    }

    @Test
    public void testUtf8Length() {
        assertEquals(1, KeyCodec.utf8Length('a'));
        assertEquals(1, KeyCodec.utf8Length(0x80), "stray continuation byte");
        assertEquals(2, KeyCodec.utf8Length(0xC3));
        assertEquals(3, KeyCodec.utf8Length(0xE2));
        assertEquals(4, KeyCodec.utf8Length(0xF0));
        assertEquals(1, KeyCodec.utf8Length(0xFF));
    }

    @Test
    public void testShortSequenceDecodesWithoutFailure() {
        // Lead byte of a three byte sequence, one continuation byte missing
        byte[] truncated = { (byte) 0xE2, (byte) 0x82 };
        assertEquals(0x2080, KeyCodec.utf8Decode(truncated, 0));
    }

    @Test
    public void testDisplayWidthAndChop() {
        assertEquals(8, KeyCodec.displayWidth("KEY_BTAB"));
        assertEquals("KEY", KeyCodec.chop("KEY_BTAB", 3));
        assertEquals("ab", KeyCodec.chop("ab", 3));
        // Wide characters take two columns
        assertEquals(2, KeyCodec.displayWidth("漢"));
        assertEquals("漢", KeyCodec.chop("漢字", 3));
    }

    @Test
    public void testEmojiAreWide() {
        String rocket = new String(Character.toChars(0x1F680));
        String pie = new String(Character.toChars(0x1FAD3));
        String grin = new String(Character.toChars(0x1F600));

        assertEquals(2, KeyCodec.displayWidth(rocket));
        assertEquals(2, KeyCodec.displayWidth(pie));
        assertEquals(2, KeyCodec.displayWidth(grin));
        assertEquals(rocket, KeyCodec.chop(rocket + pie, 3));
        assertEquals("", KeyCodec.chop(rocket, 1));
    }
}
