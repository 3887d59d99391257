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

package com.loomcom.keymap.config;

import com.loomcom.keymap.exceptions.KeyConfigException;
import com.loomcom.keymap.keys.AssignResult;
import com.loomcom.keymap.keys.BindingState;
import com.loomcom.keymap.keys.KeyCodec;
import com.loomcom.keymap.keys.KeyCodes;
import com.loomcom.keymap.keys.KeyRegistry;
import com.loomcom.keymap.keys.VirtualKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writing of the key bindings file and completion of the bindings from the
 * built-in defaults.
 *
 * The file holds a fixed comment header, then one line per action in
 * catalog order: the action label, two spaces, and the key names bound to
 * it, or UNDEFINED.
 */
public class KeyConfigIO {

    private final static Logger logger = LoggerFactory.getLogger(KeyConfigIO.class.getName());

    public static final String HEADER =
            "#\n"
            + "# Calcurse keys configuration file\n#\n"
            + "# In this file the keybindings used by Calcurse are defined.\n"
            + "# It is generated automatically by Calcurse and is maintained\n"
            + "# via the key configuration menu of the interactive user\n"
            + "# interface. It should not be edited directly.\n"
            + "\n";

    private static final String SEPARATOR = "  ";

    private final KeyRegistry registry;

    public KeyConfigIO(KeyRegistry registry) {
        this.registry = registry;
    }

    /**
     * Write the built-in default bindings of every action.
     */
    public void dumpDefaults(Writer out) throws IOException {
        out.write(HEADER);
        for (VirtualKey key : VirtualKey.values()) {
            out.write(key.getLabel() + SEPARATOR + key.getDefaultBinding() + "\n");
        }
        out.flush();
    }

    /**
     * Create the bindings file with the default bindings. Failure here is
     * fatal for the caller: the configuration directory must be writable.
     */
    public void dumpDefaults(Path file) throws KeyConfigException {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                dumpDefaults(out);
            }
        } catch (IOException e) {
            logger.error("FATAL ERROR: could not create default keys file {}", file);
            throw new KeyConfigException("Could not create default keys file", file, e);
        }
        logger.info("Default key bindings written to {}", file);
    }

    /**
     * Write the current bindings of every action.
     */
    public void save(Writer out) throws IOException {
        out.write(HEADER);
        for (VirtualKey key : VirtualKey.values()) {
            out.write(key.getLabel() + SEPARATOR + registry.all(key) + "\n");
        }
        out.flush();
    }

    /**
     * Write the current bindings to a file, replacing it only once the new
     * contents are complete.
     */
    public void save(Path file) throws KeyConfigException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                save(out);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            logger.error("Could not save key bindings to {}", file, e);
            throw new KeyConfigException("Could not save key bindings", file, e);
        }
        logger.info("Key bindings saved to {}", file);
    }

    /**
     * @return true if some action was left without keys
     */
    public boolean checkUndefined() {
        return registry.isUndefinedAny();
    }

    /**
     * @return true if some action has no entry yet, e.g. one added by an upgrade
     */
    public boolean checkMissing() {
        return registry.isUninitializedAny();
    }

    /**
     * Assign the default keys to every uninitialized action, in catalog order.
     *
     * Stops at the first default key that cannot be assigned. Keys assigned
     * before that stay assigned.
     *
     * @return the number of actions that received default keys, or the
     *         negated catalog index of the action whose default failed
     */
    public int fillMissing() {
        KeyCodec codec = registry.getCodec();
        int assigned = 0;

        for (VirtualKey action : VirtualKey.values()) {
            if (registry.getState(action) != BindingState.UNINITIALIZED) {
                continue;
            }

            boolean assign = false;
            for (String token : action.getDefaultTokens()) {
                int code = codec.nameToCode(token);
                AssignResult result = code == KeyCodes.NONE ? AssignResult.INVALID : registry.assign(code, action);
                if (!result.isOk()) {
                    logger.warn("Default key {} of {} could not be assigned: {}",
                            token, action.getLabel(), result);
                    return -action.index();
                }
                assign = true;
            }
            if (assign) {
                assigned++;
            }
        }

        if (assigned > 0) {
            logger.info("Default key(s) assigned to {} action{}.", assigned, assigned == 1 ? "" : "s");
        }
        return assigned;
    }
}
