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
import com.loomcom.keymap.keys.VirtualKey;

/**
 * A command read from the keyboard: the virtual key with its repeat count
 * and register prefix.
 */
public final class KeyCommand {

    private final VirtualKey action;
    private final int key;
    private final int count;
    private final int register;

    public KeyCommand(VirtualKey action, int key, int count, int register) {
        this.action = action;
        this.key = key;
        this.count = count;
        this.register = register;
    }

    /**
     * A terminal resize, reported in place of a command.
     */
    public static KeyCommand resize(int count, int register) {
        return new KeyCommand(null, KeyCodes.KEY_RESIZE, count, register);
    }

    public boolean isResize() {
        return key == KeyCodes.KEY_RESIZE;
    }

    /**
     * @return the virtual key, or null if the key is not bound or this is a resize
     */
    public VirtualKey getAction() {
        return action;
    }

    /**
     * @return the code of the key that selected the command
     */
    public int getKey() {
        return key;
    }

    /**
     * @return the repeat count, 1 when none was typed
     */
    public int getCount() {
        return count;
    }

    /**
     * @return the register, 0 for none, 1-9 for "1-"9 and 10-35 for "a-"z
     */
    public int getRegister() {
        return register;
    }

    @Override
    public String toString() {
        return String.format("KeyCommand [action=%s, key=%d, count=%d, register=%d]",
                isResize() ? "RESIZE" : action, key, count, register);
    }
}
