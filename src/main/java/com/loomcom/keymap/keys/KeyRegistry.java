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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assignment of physical keys to virtual keys.
 *
 * Two views of the same bindings are kept in step:
 * - per virtual key, the ordered list of bound key names (the first one is
 *   the key shown in the status bar)
 * - per physical key, the virtual key it is bound to: a table indexed by
 *   code for the dense range and a map for multibyte characters
 *
 * A physical key is bound to at most one virtual key. Every mutator and
 * lookup holds the registry monitor, so both views change together.
 */
public class KeyRegistry {

    private final static Logger logger = LoggerFactory.getLogger(KeyRegistry.class.getName());

    /** Shown by {@link #first(VirtualKey)} for an action without keys. */
    public static final String NO_KEY = "XXX";

    /** Written by {@link #all(VirtualKey)} for an action without keys. */
    public static final String UNDEFINED = "UNDEFINED";

    private final KeyCodec codec;

    private final VirtualKey[] actions = new VirtualKey[KeyCodes.UNICODE_OFFSET];
    private final Map<Integer, VirtualKey> extendedActions = new HashMap<>();
    private final Bindings[] bindings = new Bindings[VirtualKey.count()];

    /**
     * Keys of one virtual key, with its state made explicit.
     */
    private static final class Bindings {
        private BindingState state = BindingState.UNINITIALIZED;
        private final List<String> keys = new ArrayList<>();
    }

    public KeyRegistry(KeyCodec codec) {
        this.codec = codec;
        for (int i = 0; i < bindings.length; i++) {
            bindings[i] = new Bindings();
        }
        logger.info("Key registry created for {} actions", bindings.length);
    }

    public KeyCodec getCodec() {
        return codec;
    }

    /**
     * Bind a physical key to a virtual key.
     *
     * Assigning {@link KeyCodes#NONE} binds nothing; it only moves an
     * uninitialized action to {@link BindingState#UNDEFINED}.
     *
     * @return {@link AssignResult#CONFLICT} if the key is already bound,
     *         {@link AssignResult#INVALID} if the key has no name
     */
    public synchronized AssignResult assign(int code, VirtualKey action) {
        if (action == null) {
            return AssignResult.INVALID;
        }
        if (code == KeyCodes.NONE) {
            markUndefined(action);
            return AssignResult.OK;
        }

        String name = codec.codeToName(code);
        if (name == null) {
            logger.debug("No name for key code {}, not assigned to {}", code, action.getLabel());
            return AssignResult.INVALID;
        }

        VirtualKey current = lookup(code);
        if (current != null) {
            logger.debug("Key {} already bound to {}", name, current.getLabel());
            return AssignResult.CONFLICT;
        }

        if (KeyCodes.isDense(code)) {
            actions[code] = action;
        } else {
            extendedActions.put(code, action);
        }

        Bindings b = bindings[action.index()];
        b.keys.add(name);
        b.state = BindingState.BOUND;
        logger.debug("Key {} bound to {}", name, action.getLabel());
        return AssignResult.OK;
    }

    /**
     * Unbind a physical key from a virtual key. The key's reverse mapping is
     * cleared whatever it pointed to. When the last key of the action goes,
     * the action is left {@link BindingState#UNDEFINED}.
     */
    public synchronized void remove(int code, VirtualKey action) {
        if (code < 0 || action == null) {
            return;
        }

        if (KeyCodes.isDense(code)) {
            actions[code] = null;
        } else {
            extendedActions.remove(code);
        }

        Bindings b = bindings[action.index()];
        String name = codec.codeToName(code);
        if (name != null) {
            b.keys.remove(name);
        }
        if (b.keys.isEmpty()) {
            b.state = BindingState.UNDEFINED;
        }
        logger.debug("Key {} removed from {}", name, action.getLabel());
    }

    /**
     * Mark an action as deliberately left without keys. Has no effect on a
     * bound action.
     */
    public synchronized void markUndefined(VirtualKey action) {
        if (action == null) {
            return;
        }
        Bindings b = bindings[action.index()];
        if (b.state != BindingState.BOUND) {
            b.state = BindingState.UNDEFINED;
        }
    }

    /**
     * @return the virtual key bound to the given code, or null if there is none
     */
    public synchronized VirtualKey lookup(int code) {
        if (code < 0) {
            return null;
        }
        if (KeyCodes.isDense(code)) {
            return actions[code];
        }
        return extendedActions.get(code);
    }

    /**
     * @return the binding state, {@link BindingState#UNDEFINED} for a null action
     */
    public synchronized BindingState getState(VirtualKey action) {
        if (action == null) {
            return BindingState.UNDEFINED;
        }
        return bindings[action.index()].state;
    }

    /**
     * @return the number of keys bound to the action, 0 if none
     */
    public synchronized int count(VirtualKey action) {
        if (action == null) {
            return 0;
        }
        return bindings[action.index()].keys.size();
    }

    /**
     * @return the name of the first key of the action, or {@link #NO_KEY}
     */
    public synchronized String first(VirtualKey action) {
        if (action == null) {
            return NO_KEY;
        }
        List<String> keys = bindings[action.index()].keys;
        return keys.isEmpty() ? NO_KEY : keys.get(0);
    }

    /**
     * @return the name of the n-th key of the action, or null if there are not that many
     */
    public synchronized String nth(VirtualKey action, int n) {
        if (action == null) {
            return null;
        }
        List<String> keys = bindings[action.index()].keys;
        if (n < 0 || n >= keys.size()) {
            return null;
        }
        return keys.get(n);
    }

    /**
     * @return the names of all keys of the action separated by spaces,
     *         or {@link #UNDEFINED} if it has none
     */
    public synchronized String all(VirtualKey action) {
        if (action == null) {
            return UNDEFINED;
        }
        List<String> keys = bindings[action.index()].keys;
        if (keys.isEmpty()) {
            return UNDEFINED;
        }
        return String.join(" ", keys);
    }

    public synchronized List<String> keys(VirtualKey action) {
        if (action == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(bindings[action.index()].keys));
    }

    /**
     * @return true if some action is {@link BindingState#UNDEFINED}
     */
    public synchronized boolean isUndefinedAny() {
        for (Bindings b : bindings) {
            if (b.state == BindingState.UNDEFINED) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if some action is {@link BindingState#UNINITIALIZED}
     */
    public synchronized boolean isUninitializedAny() {
        for (Bindings b : bindings) {
            if (b.state == BindingState.UNINITIALIZED) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drop every binding and return all actions to {@link BindingState#UNINITIALIZED}.
     */
    public synchronized void clear() {
        for (int i = 0; i < actions.length; i++) {
            actions[i] = null;
        }
        extendedActions.clear();
        for (Bindings b : bindings) {
            b.keys.clear();
            b.state = BindingState.UNINITIALIZED;
        }
        logger.debug("Key registry cleared");
    }
}
