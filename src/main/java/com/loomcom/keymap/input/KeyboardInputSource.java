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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.event.KeyListener;
import java.io.InterruptedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Input source fed by AWT key events, for hosting the interface in a window.
 *
 * Typed characters are queued as their UTF-8 bytes; navigation, editing and
 * function keys are queued as extended events. The listener side runs on the
 * event dispatch thread, {@link #read()} blocks the reader until the queue
 * has something.
 */
public class KeyboardInputSource implements InputSource, KeyListener {

    private static final Logger logger = LoggerFactory.getLogger(KeyboardInputSource.class.getName());

    // AWT virtual key codes of keys that produce no character
    private static final Map<Integer, Integer> EVENT_CODE_MAP = new HashMap<>();

    static {
        EVENT_CODE_MAP.put(KeyEvent.VK_UP, KeyCodes.KEY_UP);
        EVENT_CODE_MAP.put(KeyEvent.VK_DOWN, KeyCodes.KEY_DOWN);
        EVENT_CODE_MAP.put(KeyEvent.VK_LEFT, KeyCodes.KEY_LEFT);
        EVENT_CODE_MAP.put(KeyEvent.VK_RIGHT, KeyCodes.KEY_RIGHT);
        EVENT_CODE_MAP.put(KeyEvent.VK_KP_UP, KeyCodes.KEY_UP);
        EVENT_CODE_MAP.put(KeyEvent.VK_KP_DOWN, KeyCodes.KEY_DOWN);
        EVENT_CODE_MAP.put(KeyEvent.VK_KP_LEFT, KeyCodes.KEY_LEFT);
        EVENT_CODE_MAP.put(KeyEvent.VK_KP_RIGHT, KeyCodes.KEY_RIGHT);
        EVENT_CODE_MAP.put(KeyEvent.VK_HOME, KeyCodes.KEY_HOME);
        EVENT_CODE_MAP.put(KeyEvent.VK_END, KeyCodes.KEY_END);
        EVENT_CODE_MAP.put(KeyEvent.VK_PAGE_UP, KeyCodes.KEY_PPAGE);
        EVENT_CODE_MAP.put(KeyEvent.VK_PAGE_DOWN, KeyCodes.KEY_NPAGE);
        EVENT_CODE_MAP.put(KeyEvent.VK_INSERT, KeyCodes.KEY_IC);
        EVENT_CODE_MAP.put(KeyEvent.VK_DELETE, KeyCodes.KEY_DC);
        EVENT_CODE_MAP.put(KeyEvent.VK_CLEAR, KeyCodes.KEY_CLEAR);
        EVENT_CODE_MAP.put(KeyEvent.VK_PRINTSCREEN, KeyCodes.KEY_PRINT);
        EVENT_CODE_MAP.put(KeyEvent.VK_CANCEL, KeyCodes.KEY_BREAK);

        EVENT_CODE_MAP.put(KeyEvent.VK_F1, KeyCodes.keyF(1));
        EVENT_CODE_MAP.put(KeyEvent.VK_F2, KeyCodes.keyF(2));
        EVENT_CODE_MAP.put(KeyEvent.VK_F3, KeyCodes.keyF(3));
        EVENT_CODE_MAP.put(KeyEvent.VK_F4, KeyCodes.keyF(4));
        EVENT_CODE_MAP.put(KeyEvent.VK_F5, KeyCodes.keyF(5));
        EVENT_CODE_MAP.put(KeyEvent.VK_F6, KeyCodes.keyF(6));
        EVENT_CODE_MAP.put(KeyEvent.VK_F7, KeyCodes.keyF(7));
        EVENT_CODE_MAP.put(KeyEvent.VK_F8, KeyCodes.keyF(8));
        EVENT_CODE_MAP.put(KeyEvent.VK_F9, KeyCodes.keyF(9));
        EVENT_CODE_MAP.put(KeyEvent.VK_F10, KeyCodes.keyF(10));
        EVENT_CODE_MAP.put(KeyEvent.VK_F11, KeyCodes.keyF(11));
        EVENT_CODE_MAP.put(KeyEvent.VK_F12, KeyCodes.keyF(12));
    }

    private final BlockingQueue<InputUnit> keyQueue = new LinkedBlockingQueue<>();

    // Shift-Tab is queued on key press; its typed TAB must not follow it
    private boolean swallowTypedTab = false;
    private char pendingHighSurrogate = 0;

    @Override
    public InputUnit read() throws InterruptedIOException {
        try {
            return keyQueue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for a key");
        }
    }

    // KeyListener interface implementation
    @Override
    public void keyPressed(KeyEvent e) {
        int keyCode = e.getKeyCode();

        if (keyCode == KeyEvent.VK_TAB && (e.getModifiersEx() & InputEvent.SHIFT_DOWN_MASK) != 0) {
            swallowTypedTab = true;
            queueEvent(KeyCodes.KEY_BTAB);
            e.consume();
            return;
        }

        Integer code = EVENT_CODE_MAP.get(keyCode);
        if (code != null) {
            queueEvent(code);
            e.consume();
            logger.debug("Key pressed: {} queued as event {}", KeyEvent.getKeyText(keyCode),
                    String.format("%02X", code));
        }
    }

    @Override
    public void keyReleased(KeyEvent e) {
        // Releases carry no input
    }

    @Override
    public void keyTyped(KeyEvent e) {
        char ch = e.getKeyChar();
        if (ch == KeyEvent.CHAR_UNDEFINED) {
            return;
        }
        if (ch == '\t' && swallowTypedTab) {
            swallowTypedTab = false;
            return;
        }
        // Delete is reported on key press
        if (ch == KeyCodes.DELETE) {
            return;
        }
        if (ch == '\r') {
            ch = '\n';
        }

        if (Character.isHighSurrogate(ch)) {
            pendingHighSurrogate = ch;
            return;
        }
        int codePoint = ch;
        if (Character.isLowSurrogate(ch)) {
            if (pendingHighSurrogate == 0) {
                logger.warn("Dropping unpaired low surrogate {}", String.format("%04X", (int) ch));
                return;
            }
            codePoint = Character.toCodePoint(pendingHighSurrogate, ch);
        }
        pendingHighSurrogate = 0;

        typeCodePoint(codePoint);
        e.consume();
    }

    /**
     * Queue a character as if it had been typed.
     */
    public void typeCodePoint(int codePoint) {
        for (byte b : KeyCodec.utf8Encode(codePoint)) {
            keyQueue.offer(InputUnit.ofByte(b));
        }
        logger.debug("Character {} queued", String.format("%04X", codePoint));
    }

    /**
     * Queue every character of a string as if it had been typed.
     */
    public void typeText(String text) {
        text.codePoints().forEach(this::typeCodePoint);
    }

    /**
     * Queue a non-character event.
     */
    public void queueEvent(int code) {
        keyQueue.offer(InputUnit.ofEvent(code));
    }

    /**
     * Report a change of the window size to the reader.
     */
    public void resize() {
        queueEvent(KeyCodes.KEY_RESIZE);
        logger.debug("Resize event queued");
    }

    public boolean hasData() {
        return !keyQueue.isEmpty();
    }

    public int getQueueSize() {
        return keyQueue.size();
    }

    @Override
    public String toString() {
        return String.format("KeyboardInputSource [Queue: %d]", keyQueue.size());
    }
}
