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

package com.loomcom.keymap.ui;

import com.loomcom.keymap.input.InputReader;
import com.loomcom.keymap.keys.VirtualKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Popup describing what a virtual key does, shown from the key
 * configuration menu. It stays open until a key is pressed.
 */
public class KeyInfoPopup {

    private final static Logger logger = LoggerFactory.getLogger(KeyInfoPopup.class.getName());

    private static final int SIDE_MARGIN = 4;

    private final Screen screen;
    private final InputReader reader;
    private final Translator translator;
    private final int rows;

    public KeyInfoPopup(Screen screen, InputReader reader, Translator translator, int rows) {
        this.screen = screen;
        this.reader = reader;
        this.translator = translator;
        this.rows = rows;
    }

    /**
     * Show the popup for the action at a catalog index. Indices outside the
     * catalog show nothing.
     */
    public void show(int index) throws IOException {
        if (index < 0 || index >= VirtualKey.count()) {
            logger.debug("No key information for index {}", index);
            return;
        }
        show(VirtualKey.fromIndex(index));
    }

    public void show(VirtualKey action) throws IOException {
        if (action == null) {
            return;
        }

        int cols = screen.getColumns() - SIDE_MARGIN;
        int y = (screen.getRows() - rows) / 2;
        int x = (screen.getColumns() - cols) / 2;

        Surface popup = screen.openPopup(rows, cols, y, x, action.getLabel(),
                translator.translate(action.getDescription()));
        try {
            reader.waitForAnyKey();
        } finally {
            screen.closePopup(popup);
        }
    }
}
