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

/**
 * Integer identities of physical keys.
 *
 * Codes fall into three disjoint ranges:
 * - 0x00-0x7F: single byte (ASCII) characters
 * - 0x80-EXTENDED_MAX: non-character terminal events (arrows, function keys, resize ...)
 * - UNICODE_OFFSET and up: multibyte characters, UNICODE_OFFSET + code point
 *
 * Ranges 1 and 2 together form the dense range, indexed directly by the registry.
 */
public final class KeyCodes {

    /** The "no key" value. */
    public static final int NONE = -1;

    public static final int ASCII_MIN = 0x00;
    public static final int ASCII_MAX = 0x7F;

    // Named characters
    public static final int TAB    = 0x09;
    public static final int RETURN = 0x0A;
    public static final int ESCAPE = 0x1B;
    public static final int SPACE  = 0x20;
    public static final int DELETE = 0x7F;

    // Extended events
    public static final int EXTENDED_MIN  = 0x80;
    public static final int KEY_BREAK     = 0x80;
    public static final int KEY_DOWN      = 0x81;
    public static final int KEY_UP        = 0x82;
    public static final int KEY_LEFT      = 0x83;
    public static final int KEY_RIGHT     = 0x84;
    public static final int KEY_HOME      = 0x85;
    public static final int KEY_BACKSPACE = 0x86;
    public static final int KEY_F0        = 0x87;   // KEY_F0 + n for F1-F63
    public static final int KEY_DL        = 0xC7;
    public static final int KEY_IL        = 0xC8;
    public static final int KEY_DC        = 0xC9;   // Delete character
    public static final int KEY_IC        = 0xCA;   // Insert character
    public static final int KEY_CLEAR     = 0xCB;
    public static final int KEY_NPAGE     = 0xCC;   // Page down
    public static final int KEY_PPAGE     = 0xCD;   // Page up
    public static final int KEY_ENTER     = 0xCE;   // Keypad enter
    public static final int KEY_PRINT     = 0xCF;
    public static final int KEY_BTAB      = 0xD0;   // Shift-Tab
    public static final int KEY_BEG       = 0xD1;
    public static final int KEY_END       = 0xD2;
    public static final int KEY_SHOME     = 0xD3;
    public static final int KEY_SEND      = 0xD4;
    public static final int KEY_SLEFT     = 0xD5;
    public static final int KEY_SRIGHT    = 0xD6;
    public static final int KEY_SDC       = 0xD7;
    public static final int KEY_SIC       = 0xD8;
    public static final int KEY_MOUSE     = 0xD9;
    public static final int KEY_RESIZE    = 0xDA;
    public static final int EXTENDED_MAX  = 0xDA;

    public static final int FUNCTION_KEYS = 63;

    /** Added to a code point to move it above the dense range. */
    public static final int UNICODE_OFFSET = EXTENDED_MAX + 1;

    private static final String[] EXTENDED_NAMES = new String[EXTENDED_MAX - EXTENDED_MIN + 1];

    static {
        EXTENDED_NAMES[KEY_BREAK - EXTENDED_MIN] = "KEY_BREAK";
        EXTENDED_NAMES[KEY_DOWN - EXTENDED_MIN] = "KEY_DOWN";
        EXTENDED_NAMES[KEY_UP - EXTENDED_MIN] = "KEY_UP";
        EXTENDED_NAMES[KEY_LEFT - EXTENDED_MIN] = "KEY_LEFT";
        EXTENDED_NAMES[KEY_RIGHT - EXTENDED_MIN] = "KEY_RIGHT";
        EXTENDED_NAMES[KEY_HOME - EXTENDED_MIN] = "KEY_HOME";
        EXTENDED_NAMES[KEY_BACKSPACE - EXTENDED_MIN] = "KEY_BACKSPACE";
        for (int n = 0; n <= FUNCTION_KEYS; n++) {
            EXTENDED_NAMES[KEY_F0 + n - EXTENDED_MIN] = "KEY_F(" + n + ")";
        }
        EXTENDED_NAMES[KEY_DL - EXTENDED_MIN] = "KEY_DL";
        EXTENDED_NAMES[KEY_IL - EXTENDED_MIN] = "KEY_IL";
        EXTENDED_NAMES[KEY_DC - EXTENDED_MIN] = "KEY_DC";
        EXTENDED_NAMES[KEY_IC - EXTENDED_MIN] = "KEY_IC";
        EXTENDED_NAMES[KEY_CLEAR - EXTENDED_MIN] = "KEY_CLEAR";
        EXTENDED_NAMES[KEY_NPAGE - EXTENDED_MIN] = "KEY_NPAGE";
        EXTENDED_NAMES[KEY_PPAGE - EXTENDED_MIN] = "KEY_PPAGE";
        EXTENDED_NAMES[KEY_ENTER - EXTENDED_MIN] = "KEY_ENTER";
        EXTENDED_NAMES[KEY_PRINT - EXTENDED_MIN] = "KEY_PRINT";
        EXTENDED_NAMES[KEY_BTAB - EXTENDED_MIN] = "KEY_BTAB";
        EXTENDED_NAMES[KEY_BEG - EXTENDED_MIN] = "KEY_BEG";
        EXTENDED_NAMES[KEY_END - EXTENDED_MIN] = "KEY_END";
        EXTENDED_NAMES[KEY_SHOME - EXTENDED_MIN] = "KEY_SHOME";
        EXTENDED_NAMES[KEY_SEND - EXTENDED_MIN] = "KEY_SEND";
        EXTENDED_NAMES[KEY_SLEFT - EXTENDED_MIN] = "KEY_SLEFT";
        EXTENDED_NAMES[KEY_SRIGHT - EXTENDED_MIN] = "KEY_SRIGHT";
        EXTENDED_NAMES[KEY_SDC - EXTENDED_MIN] = "KEY_SDC";
        EXTENDED_NAMES[KEY_SIC - EXTENDED_MIN] = "KEY_SIC";
        EXTENDED_NAMES[KEY_MOUSE - EXTENDED_MIN] = "KEY_MOUSE";
        EXTENDED_NAMES[KEY_RESIZE - EXTENDED_MIN] = "KEY_RESIZE";
    }

    private KeyCodes() {
    }

    /**
     * Code of function key Fn.
     */
    public static int keyF(int n) {
        if (n < 0 || n > FUNCTION_KEYS) {
            throw new IllegalArgumentException("No such function key: F" + n);
        }
        return KEY_F0 + n;
    }

    public static boolean isAscii(int code) {
        return code >= ASCII_MIN && code <= ASCII_MAX;
    }

    public static boolean isExtended(int code) {
        return code >= EXTENDED_MIN && code <= EXTENDED_MAX;
    }

    /**
     * True for codes held in the registry's direct-indexed table (ranges 1 and 2).
     */
    public static boolean isDense(int code) {
        return code >= ASCII_MIN && code < UNICODE_OFFSET;
    }

    public static boolean isUnicode(int code) {
        return code >= UNICODE_OFFSET;
    }

    /**
     * Terminal library name of an extended event, as reported before any short
     * form substitution, or null for codes outside the extended range.
     */
    static String extendedName(int code) {
        if (!isExtended(code)) {
            return null;
        }
        return EXTENDED_NAMES[code - EXTENDED_MIN];
    }
}
