/*
 * Copyright (c) 2025 Waffle2e Computer Project
 * Based on Symon - A 6502 System Simulator
 * Copyright (c) 2008-2025 Seth J. Morabito <web@loomcom.com>
 *
 * Permission is hereby granted, free of charge, to any person obtaining
 * a copy of this software and associated documentation files (the
 * "Software"), to deal in the Software without restriction, including
 * without limitation the rights to use, copy, modify, merge, publish,
 * distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to
 * the following conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
 * MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE
 * LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION
 * OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION
 * WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package com.loomcom.keymap.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion between physical key codes and key names.
 *
 * Key names are what the bindings file and the interface show: the terminal
 * name of a key ("^A", "KEY_BTAB", "x"), replaced by a short form for the
 * most common keys ("TAB", "RET", "UP", "F1" ...). A multibyte character is
 * named by the character itself.
 *
 * The name table for the dense range is built once, at construction.
 */
public class KeyCodec {

    private final static Logger logger = LoggerFactory.getLogger(KeyCodec.class.getName());

    private static final String EMPTY = "";

    private final String[] keyNames = new String[KeyCodes.UNICODE_OFFSET];

    public KeyCodec() {
        for (int i = 0; i < keyNames.length; i++) {
            keyNames[i] = EMPTY;
        }

        // Terminal names of the ASCII range ...
        for (int i = 1; i <= KeyCodes.ASCII_MAX; i++) {
            keyNames[i] = asciiName(i);
        }
        // ... and of the extended events.
        for (int i = KeyCodes.EXTENDED_MIN; i <= KeyCodes.EXTENDED_MAX; i++) {
            keyNames[i] = KeyCodes.extendedName(i);
        }

        // Short forms
        keyNames[KeyCodes.TAB] = "TAB";
        keyNames[KeyCodes.RETURN] = "RET";
        keyNames[KeyCodes.ESCAPE] = "ESC";
        keyNames[KeyCodes.SPACE] = "SPC";
        keyNames[KeyCodes.KEY_UP] = "UP";
        keyNames[KeyCodes.KEY_DOWN] = "DWN";
        keyNames[KeyCodes.KEY_LEFT] = "LFT";
        keyNames[KeyCodes.KEY_RIGHT] = "RGT";
        keyNames[KeyCodes.KEY_HOME] = "HOM";
        keyNames[KeyCodes.KEY_END] = "END";
        keyNames[KeyCodes.KEY_NPAGE] = "PgD";
        keyNames[KeyCodes.KEY_PPAGE] = "PgU";
        keyNames[KeyCodes.KEY_IC] = "INS";
        keyNames[KeyCodes.KEY_DC] = "DEL";
        for (int n = 1; n <= 12; n++) {
            keyNames[KeyCodes.keyF(n)] = "F" + n;
        }

        logger.debug("Key name table built for codes 0x00-0x{}", String.format("%02X", KeyCodes.EXTENDED_MAX));
    }

    /**
     * Code of the key with the given name.
     *
     * @return the key code, or {@link KeyCodes#NONE} if the name is empty or names no key
     */
    public int nameToCode(String name) {
        if (name == null || name.isEmpty()) {
            return KeyCodes.NONE;
        }

        // Names written by older versions
        switch (name) {
            case "^J":
                return KeyCodes.RETURN;
            case "KEY_HOME":
                return KeyCodes.KEY_HOME;
            case "KEY_END":
                return KeyCodes.KEY_END;
            default:
                break;
        }

        for (int i = 1; i <= KeyCodes.ASCII_MAX; i++) {
            if (name.equals(keyNames[i])) {
                return i;
            }
        }
        for (int i = KeyCodes.EXTENDED_MIN; i <= KeyCodes.EXTENDED_MAX; i++) {
            if (name.equals(keyNames[i])) {
                return i;
            }
        }

        // A single multibyte character
        int codePoint = name.codePointAt(0);
        if (codePoint > KeyCodes.ASCII_MAX && Character.charCount(codePoint) == name.length()) {
            return KeyCodes.UNICODE_OFFSET + codePoint;
        }
        return KeyCodes.NONE;
    }

    /**
     * Name of the key with the given code.
     *
     * @return the key name, or null for {@link KeyCodes#NONE} and for codes without a name
     */
    public String codeToName(int code) {
        if (code < 0) {
            return null;
        }
        if (KeyCodes.isDense(code)) {
            String name = keyNames[code];
            return name.isEmpty() ? null : name;
        }
        int codePoint = code - KeyCodes.UNICODE_OFFSET;
        // Code points below 0x80 are never offset
        if (codePoint <= KeyCodes.ASCII_MAX || !isScalarValue(codePoint)) {
            return null;
        }
        return new String(Character.toChars(codePoint));
    }

    /**
     * Length of a UTF-8 sequence, derived from its leading byte. Stray
     * continuation bytes and bytes that never lead a sequence count as one.
     */
    public static int utf8Length(int leadByte) {
        int b = leadByte & 0xFF;
        if (b < 0xC0) {
            return 1;
        } else if (b < 0xE0) {
            return 2;
        } else if (b < 0xF0) {
            return 3;
        } else if (b < 0xF8) {
            return 4;
        }
        return 1;
    }

    /**
     * Decode the UTF-8 sequence starting at bytes[offset]. The sequence
     * length comes from the leading byte alone; continuation bytes are not
     * validated and missing ones count as zero bits.
     */
    public static int utf8Decode(byte[] bytes, int offset) {
        int lead = bytes[offset] & 0xFF;
        int length = utf8Length(lead);
        int codePoint;
        switch (length) {
            case 2:
                codePoint = lead & 0x1F;
                break;
            case 3:
                codePoint = lead & 0x0F;
                break;
            case 4:
                codePoint = lead & 0x07;
                break;
            default:
                return lead;
        }
        for (int i = 1; i < length; i++) {
            int index = offset + i;
            int cont = index < bytes.length ? bytes[index] & 0x3F : 0;
            codePoint = (codePoint << 6) | cont;
        }
        return codePoint;
    }

    /**
     * UTF-8 encoding of a Unicode scalar value.
     */
    public static byte[] utf8Encode(int codePoint) {
        if (!isScalarValue(codePoint)) {
            throw new IllegalArgumentException("Not a Unicode scalar value: " + Integer.toHexString(codePoint));
        }
        if (codePoint < 0x80) {
            return new byte[] { (byte) codePoint };
        } else if (codePoint < 0x800) {
            return new byte[] {
                    (byte) (0xC0 | (codePoint >> 6)),
                    (byte) (0x80 | (codePoint & 0x3F)) };
        } else if (codePoint < 0x10000) {
            return new byte[] {
                    (byte) (0xE0 | (codePoint >> 12)),
                    (byte) (0x80 | ((codePoint >> 6) & 0x3F)),
                    (byte) (0x80 | (codePoint & 0x3F)) };
        }
        return new byte[] {
                (byte) (0xF0 | (codePoint >> 18)),
                (byte) (0x80 | ((codePoint >> 12) & 0x3F)),
                (byte) (0x80 | ((codePoint >> 6) & 0x3F)),
                (byte) (0x80 | (codePoint & 0x3F)) };
    }

    public static boolean isScalarValue(int codePoint) {
        return codePoint >= 0 && codePoint <= Character.MAX_CODE_POINT
                && (codePoint < Character.MIN_SURROGATE || codePoint > Character.MAX_SURROGATE);
    }

    /**
     * Number of terminal columns needed to display s.
     */
    public static int displayWidth(String s) {
        int width = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            width += columns(cp);
            i += Character.charCount(cp);
        }
        return width;
    }

    /**
     * Longest prefix of s that fits in the given number of columns.
     */
    public static String chop(String s, int width) {
        int used = 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            int w = columns(cp);
            if (used + w > width) {
                break;
            }
            used += w;
            i += Character.charCount(cp);
        }
        return s.substring(0, i);
    }

    private static int columns(int cp) {
        int type = Character.getType(cp);
        if (type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK) {
            return 0;
        }
        if ((cp >= 0x1100 && cp <= 0x115F)
                || (cp >= 0x2E80 && cp <= 0xA4CF && cp != 0x303F)
                || (cp >= 0xAC00 && cp <= 0xD7A3)
                || (cp >= 0xF900 && cp <= 0xFAFF)
                || (cp >= 0xFE30 && cp <= 0xFE4F)
                || (cp >= 0xFF00 && cp <= 0xFF60)
                || (cp >= 0xFFE0 && cp <= 0xFFE6)
                || (cp >= 0x1F300 && cp <= 0x1F64F)
                || (cp >= 0x1F680 && cp <= 0x1F6FF)
                || (cp >= 0x1F900 && cp <= 0x1F9FF)
                || (cp >= 0x1FA70 && cp <= 0x1FAFF)
                || (cp >= 0x20000 && cp <= 0x3FFFD)) {
            return 2;
        }
        return 1;
    }

    /*
     * Terminal style name of an ASCII code: ^@-^_ for control characters,
     * ^? for DEL, the character itself otherwise.
     */
    private static String asciiName(int code) {
        if (code < KeyCodes.SPACE) {
            return "^" + (char) (code + '@');
        }
        if (code == KeyCodes.DELETE) {
            return "^?";
        }
        return String.valueOf((char) code);
    }
}
