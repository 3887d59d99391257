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

package com.loomcom.keymap.input;

import com.loomcom.keymap.keys.KeyCodes;

/**
 * One unit read from an {@link InputSource}: either a byte of (UTF-8
 * encoded) character input or a non-character terminal event.
 */
public final class InputUnit {

    private static final InputUnit[] BYTES = new InputUnit[256];

    static {
        for (int i = 0; i < BYTES.length; i++) {
            BYTES[i] = new InputUnit(i, false);
        }
    }

    private final int value;
    private final boolean event;

    private InputUnit(int value, boolean event) {
        this.value = value;
        this.event = event;
    }

    public static InputUnit ofByte(int b) {
        return BYTES[b & 0xFF];
    }

    /**
     * @param code an extended event code, see {@link KeyCodes}
     */
    public static InputUnit ofEvent(int code) {
        if (!KeyCodes.isExtended(code)) {
            throw new IllegalArgumentException("Not an extended key code: " + code);
        }
        return new InputUnit(code, true);
    }

    public boolean isEvent() {
        return event;
    }

    /**
     * @return the byte value (0-255) or the event code
     */
    public int getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InputUnit)) {
            return false;
        }
        InputUnit other = (InputUnit) o;
        return value == other.value && event == other.event;
    }

    @Override
    public int hashCode() {
        return event ? -value - 1 : value;
    }

    @Override
    public String toString() {
        return String.format(event ? "InputUnit [event %02X]" : "InputUnit [byte %02X]", value);
    }
}
