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

import com.loomcom.keymap.keys.KeyCodec;
import com.loomcom.keymap.keys.KeyCodes;
import com.loomcom.keymap.keys.KeyRegistry;
import com.loomcom.keymap.keys.VirtualKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Reads keys and commands from an {@link InputSource}.
 *
 * Character input arrives as UTF-8 bytes. Single byte characters and
 * non-character events are returned as they are; a multibyte sequence is
 * collected and decoded, and its code point is moved above the dense range
 * by {@link KeyCodes#UNICODE_OFFSET}.
 *
 * Reads block until the source delivers.
 */
public class InputReader {

    private final static Logger logger = LoggerFactory.getLogger(InputReader.class.getName());

    private static final int MAX_COUNT = Integer.MAX_VALUE / 10 - 9;

    private final InputSource source;
    private final KeyRegistry registry;

    public InputReader(InputSource source, KeyRegistry registry) {
        this.source = source;
        this.registry = registry;
    }

    public InputSource getSource() {
        return source;
    }

    /**
     * Read one key.
     *
     * @return the key code
     */
    public int readKey() throws IOException {
        InputUnit unit = source.read();
        if (unit.isEvent()) {
            return unit.getValue();
        }

        int lead = unit.getValue();
        if (lead <= KeyCodes.ASCII_MAX) {
            return lead;
        }

        int length = KeyCodec.utf8Length(lead);
        byte[] buf = new byte[length];
        buf[0] = (byte) lead;
        for (int i = 1; i < length; i++) {
            InputUnit next = source.read();
            // An event inside a sequence cannot be a continuation byte
            buf[i] = next.isEvent() ? 0 : (byte) next.getValue();
        }

        int key = KeyCodec.utf8Decode(buf, 0) + KeyCodes.UNICODE_OFFSET;
        logger.debug("Multibyte key read: {} byte(s), code {}", length, key);
        return key;
    }

    /**
     * Read one command, with an optional repeat count and register prefix:
     * [count]["register]key
     *
     * A count is a run of decimal digits not starting with 0, since 0 is a
     * key of its own. A register is a double quote followed by 1-9 or a-z;
     * any other character after the quote drops the register.
     */
    public KeyCommand readCommand() throws IOException {
        int count = 0;
        int register = 0;

        int ch = readKey();
        while ((ch == '0' && count > 0) || (ch >= '1' && ch <= '9')) {
            if (count < MAX_COUNT) {
                count = count * 10 + ch - '0';
            }
            ch = readKey();
        }
        if (count == 0) {
            count = 1;
        }

        if (ch == '"') {
            ch = readKey();
            if (ch >= '1' && ch <= '9') {
                register = ch - '1' + 1;
            } else if (ch >= 'a' && ch <= 'z') {
                register = ch - 'a' + 10;
            }
            ch = readKey();
        }

        return resolve(ch, count, register);
    }

    /**
     * Read one command without count or register prefix.
     */
    public KeyCommand readPlainCommand() throws IOException {
        return resolve(readKey(), 1, 0);
    }

    /**
     * Block until a key is read, and discard it.
     */
    public void waitForAnyKey() throws IOException {
        readKey();
    }

    private KeyCommand resolve(int key, int count, int register) {
        if (key == KeyCodes.KEY_RESIZE) {
            logger.debug("Terminal resized");
            return KeyCommand.resize(count, register);
        }
        VirtualKey action = registry.lookup(key);
        logger.debug("Key {} -> {} (count {}, register {})", key, action, count, register);
        return new KeyCommand(action, key, count, register);
    }
}
