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

import com.loomcom.keymap.keys.KeyCodec;
import com.loomcom.keymap.keys.KeyRegistry;
import com.loomcom.keymap.keys.VirtualKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The key hints of the status bar: pairs of key and label laid out on two
 * rows, one page at a time.
 *
 * Entries are catalog indices of virtual keys, or {@link ConfigMenuKey}
 * entry numbers. When more entries follow the page, its last slot shows the
 * key for "other commands" instead.
 */
public class HintBar {

    private final static Logger logger = LoggerFactory.getLogger(HintBar.class.getName());

    private final KeyRegistry registry;
    private final Translator translator;
    private final int keyLength;
    private final int labelLength;

    public HintBar(KeyRegistry registry, Translator translator, int keyLength, int labelLength) {
        this.registry = registry;
        this.translator = translator;
        this.keyLength = keyLength;
        this.labelLength = labelLength;
    }

    /**
     * Draw one page of hints.
     *
     * @param bar       the status bar, at least two rows high
     * @param entries   all entries of the status bar
     * @param pageBase  index in entries of the first entry of the page
     * @param pageSize  number of slots on a page
     */
    public void render(Surface bar, int[] entries, int pageBase, int pageSize) {
        int count = entries.length;
        pageSize = Math.min(pageSize, count - pageBase);

        bar.erase();
        if (pageSize <= 0) {
            bar.refresh();
            return;
        }

        // Padding between two hints
        int padding = (bar.getColumns() * 2) / pageSize - (keyLength + labelLength + 1);
        // Width of a hint, padding included
        int hintLength = keyLength + labelLength + 1 + padding;

        for (int i = 0; i < pageSize && pageBase + i < count; i++) {
            int keyX = (i / 2) * hintLength;
            int row = i % 2;
            int labelX = keyX + keyLength + 1;

            int entry;
            if (i < pageSize - 1 || pageBase + i == count - 1) {
                entry = entries[pageBase + i];
            } else {
                entry = VirtualKey.GENERIC_OTHER_CMD.index();
            }

            String key;
            String label;
            if (entry >= 0 && entry < VirtualKey.count()) {
                VirtualKey action = VirtualKey.fromIndex(entry);
                key = registry.first(action);
                label = translator.translate(action.getStatusBarLabel());
            } else {
                ConfigMenuKey menuKey = ConfigMenuKey.fromEntry(entry);
                if (menuKey != null) {
                    key = menuKey.getKey();
                    label = translator.translate(menuKey.getLabel());
                } else {
                    logger.debug("Unknown status bar entry {}", entry);
                    key = "?";
                    label = translator.translate("Unknown");
                }
            }

            String shownKey = KeyCodec.chop(key, keyLength);
            int shiftX = keyLength - KeyCodec.displayWidth(shownKey);
            bar.print(row, keyX + shiftX, shownKey, true);
            bar.print(row, labelX, label, false);
        }
        bar.refresh();
    }

    /**
     * First entry of the page after the one starting at pageBase; back to 0
     * after the last page. A full page shows pageSize - 1 entries plus the
     * "other commands" hint.
     */
    public static int nextPageBase(int count, int pageBase, int pageSize) {
        if (pageSize <= 1 || pageBase + pageSize >= count) {
            return 0;
        }
        return pageBase + pageSize - 1;
    }
}
