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

import com.loomcom.keymap.keys.VirtualKey;

/**
 * Entries of the configuration menu status bar. They are not virtual keys:
 * their keys are fixed. In a status bar entry list, entry N + ordinal (N being
 * the catalog size) stands for the constant with that ordinal.
 */
public enum ConfigMenuKey {
    GENERAL("g", "General"),
    LAYOUT("l", "Layout"),
    SIDEBAR("s", "Sidebar"),
    COLOR("c", "Color"),
    NOTIFY("n", "Notify"),
    KEYS("k", "Keys");

    private final String key;
    private final String label;

    ConfigMenuKey(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the status bar entry number of this menu key
     */
    public int entry() {
        return VirtualKey.count() + ordinal();
    }

    /**
     * @return the menu key for a status bar entry number, or null if there is none
     */
    public static ConfigMenuKey fromEntry(int entry) {
        int i = entry - VirtualKey.count();
        ConfigMenuKey[] all = values();
        if (i < 0 || i >= all.length) {
            return null;
        }
        return all[i];
    }
}
