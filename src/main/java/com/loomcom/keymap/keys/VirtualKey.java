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

import com.loomcom.keymap.exceptions.UnknownActionException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The catalog of virtual keys (actions) of the interactive interface.
 *
 * Each entry carries the label used in the bindings file, its default
 * bindings as space separated key names, the short label shown in the
 * status bar and a one line description for the key information popup.
 * Status bar labels and descriptions are message ids, translated at
 * render time.
 *
 * The declaration order is the catalog order: it is the order of the
 * bindings file and the index reported by a failing default fill.
 */
public enum VirtualKey {
    GENERIC_CANCEL("generic-cancel", "ESC", "Cancel",
            "Cancel the ongoing action."),
    GENERIC_SELECT("generic-select", "SPC", "Select",
            "Select the highlighted item."),
    GENERIC_CREDITS("generic-credits", "@", "Credits",
            "Print general information about calcurse's authors, license, etc."),
    GENERIC_HELP("generic-help", "?", "Help",
            "Display hints whenever some help screens are available."),
    GENERIC_QUIT("generic-quit", "q Q", "Quit",
            "Exit from the current menu, or quit calcurse."),
    GENERIC_SAVE("generic-save", "s S ^S", "Save",
            "Save calcurse data."),
    GENERIC_RELOAD("generic-reload", "R", "Reload",
            "Reload appointments and todo items."),
    GENERIC_COPY("generic-copy", "c", "Copy",
            "Copy the item that is currently selected."),
    GENERIC_PASTE("generic-paste", "p ^V", "Paste",
            "Paste an item at the current position."),
    GENERIC_CHANGE_VIEW("generic-change-view", "TAB", "Chg Win",
            "Select next panel in calcurse main screen."),
    GENERIC_PREV_VIEW("generic-prev-view", "KEY_BTAB", "Prev Win",
            "Select previous panel in calcurse main screen."),
    GENERIC_IMPORT("generic-import", "i I", "Import",
            "Import data from an external file."),
    GENERIC_EXPORT("generic-export", "x X", "Export",
            "Export data to a new file format."),
    GENERIC_GOTO("generic-goto", "g G", "Go to",
            "Select the day to go to."),
    GENERIC_OTHER_CMD("generic-other-cmd", "o O", "OtherCmd",
            "Show next possible actions inside status bar."),
    GENERIC_CONFIG_MENU("generic-config-menu", "C", "Config",
            "Enter the configuration menu."),
    GENERIC_REDRAW("generic-redraw", "^R", "Redraw",
            "Redraw calcurse's screen."),
    GENERIC_ADD_APPT("generic-add-appt", "^A", "Add Appt",
            "Add an appointment, whichever panel is currently selected."),
    GENERIC_ADD_TODO("generic-add-todo", "^T", "Add Todo",
            "Add a todo item, whichever panel is currently selected."),
    GENERIC_PREV_DAY("generic-prev-day", "T ^H", "-1 Day",
            "Move to previous day in calendar, whichever panel is currently selected."),
    GENERIC_NEXT_DAY("generic-next-day", "t ^L", "+1 Day",
            "Move to next day in calendar, whichever panel is currently selected."),
    GENERIC_PREV_WEEK("generic-prev-week", "W ^K", "-1 Week",
            "Move to previous week in calendar, whichever panel is currently selected"),
    GENERIC_NEXT_WEEK("generic-next-week", "w", "+1 Week",
            "Move to next week in calendar, whichever panel is currently selected."),
    GENERIC_PREV_MONTH("generic-prev-month", "M", "-1 Month",
            "Move to previous month in calendar, whichever panel is currently selected"),
    GENERIC_NEXT_MONTH("generic-next-month", "m", "+1 Month",
            "Move to next month in calendar, whichever panel is currently selected."),
    GENERIC_PREV_YEAR("generic-prev-year", "Y", "-1 Year",
            "Move to previous year in calendar, whichever panel is currently selected"),
    GENERIC_NEXT_YEAR("generic-next-year", "y", "+1 Year",
            "Move to next year in calendar, whichever panel is currently selected."),
    GENERIC_SCROLL_DOWN("generic-scroll-down", "^N", "Nxt View",
            "Scroll window down (e.g. when displaying text inside a popup window)."),
    GENERIC_SCROLL_UP("generic-scroll-up", "^P", "Prv View",
            "Scroll window up (e.g. when displaying text inside a popup window)."),
    GENERIC_GOTO_TODAY("generic-goto-today", "^G", "Today",
            "Go to today, whichever panel is selected."),
    GENERIC_CMD("generic-command", ":", "Command",
            "Enter command mode."),

    MOVE_RIGHT("move-right", "l L RGT", "Right",
            "Move to the right."),
    MOVE_LEFT("move-left", "h H LFT", "Left",
            "Move to the left."),
    MOVE_DOWN("move-down", "j J DWN", "Down",
            "Move down."),
    MOVE_UP("move-up", "k K UP", "Up",
            "Move up."),
    START_OF_WEEK("start-of-week", "0", "beg Week",
            "Select the first day of the current week when inside the calendar panel."),
    END_OF_WEEK("end-of-week", "$", "end Week",
            "Select the last day of the current week when inside the calendar panel."),
    ADD_ITEM("add-item", "a A", "Add Item",
            "Add an item to the currently selected panel."),
    DEL_ITEM("del-item", "d D", "Del Item",
            "Delete the currently selected item."),
    EDIT_ITEM("edit-item", "e E", "Edit Itm",
            "Edit the currently seleted item."),
    VIEW_ITEM("view-item", "v V RET", "View",
            "Display the currently selected item inside a popup window."),
    PIPE_ITEM("pipe-item", "|", "Pipe",
            "Pipe the currently selected item to an external program."),
    FLAG_ITEM("flag-item", "!", "Flag Itm",
            "Flag the currently selected item as important."),
    REPEAT_ITEM("repeat", "r", "Repeat",
            "Repeat an item"),
    EDIT_NOTE("edit-note", "n N", "EditNote",
            "Attach (or edit if one exists) a note to the currently selected item"),
    VIEW_NOTE("view-note", ">", "ViewNote",
            "View the note attached to the currently selected item."),
    RAISE_PRIORITY("raise-priority", "+", "Prio.+",
            "Raise a task priority inside the todo panel."),
    LOWER_PRIORITY("lower-priority", "-", "Prio.-",
            "Lower a task priority inside the todo panel.");

    private static final VirtualKey[] CATALOG = values();
    private static final Map<String, VirtualKey> BY_LABEL = new HashMap<>();

    static {
        for (VirtualKey key : CATALOG) {
            BY_LABEL.put(key.label, key);
        }
    }

    private final String label;
    private final String defaultBinding;
    private final String statusBarLabel;
    private final String description;

    VirtualKey(String label, String defaultBinding, String statusBarLabel, String description) {
        this.label = label;
        this.defaultBinding = defaultBinding;
        this.statusBarLabel = statusBarLabel;
        this.description = description;
    }

    /**
     * @return the name of this action in the bindings file
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the built-in bindings, key names separated by spaces
     */
    public String getDefaultBinding() {
        return defaultBinding;
    }

    public List<String> getDefaultTokens() {
        String trimmed = defaultBinding.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(trimmed.split(" +"));
    }

    public String getStatusBarLabel() {
        return statusBarLabel;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return position of this action in the catalog
     */
    public int index() {
        return ordinal();
    }

    /**
     * Number of actions in the catalog.
     */
    public static int count() {
        return CATALOG.length;
    }

    /**
     * Catalog entry at the given position.
     *
     * @throws IndexOutOfBoundsException if index is outside the catalog
     */
    public static VirtualKey fromIndex(int index) {
        if (index < 0 || index >= CATALOG.length) {
            throw new IndexOutOfBoundsException("Virtual key index out of bounds: " + index);
        }
        return CATALOG[index];
    }

    /**
     * @return the action with the given bindings file label, or null if there is none
     */
    public static VirtualKey fromLabel(String label) {
        if (label == null) {
            return null;
        }
        return BY_LABEL.get(label);
    }

    public static VirtualKey requireLabel(String label) throws UnknownActionException {
        VirtualKey key = fromLabel(label);
        if (key == null) {
            throw new UnknownActionException(label);
        }
        return key;
    }
}
