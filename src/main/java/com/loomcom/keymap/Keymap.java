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

package com.loomcom.keymap;

import com.loomcom.keymap.config.KeyConfigIO;
import com.loomcom.keymap.config.KeyConfigLoader;
import com.loomcom.keymap.config.KeymapSettings;
import com.loomcom.keymap.config.LoadReport;
import com.loomcom.keymap.exceptions.KeyConfigException;
import com.loomcom.keymap.exceptions.UnknownActionException;
import com.loomcom.keymap.input.InputReader;
import com.loomcom.keymap.input.InputSource;
import com.loomcom.keymap.keys.AssignResult;
import com.loomcom.keymap.keys.BindingState;
import com.loomcom.keymap.keys.KeyCodec;
import com.loomcom.keymap.keys.KeyCodes;
import com.loomcom.keymap.keys.KeyRegistry;
import com.loomcom.keymap.keys.VirtualKey;
import com.loomcom.keymap.ui.HintBar;
import com.loomcom.keymap.ui.KeyInfoPopup;
import com.loomcom.keymap.ui.Screen;
import com.loomcom.keymap.ui.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The keybinding subsystem, assembled.
 *
 * Components:
 * - KeyCodec: key names
 * - KeyRegistry: bindings between physical and virtual keys
 * - KeyConfigIO / KeyConfigLoader: the bindings file
 * - InputReader: commands from the keyboard
 * - HintBar / KeyInfoPopup: status bar hints and key descriptions
 */
public class Keymap {

    private final static Logger logger = LoggerFactory.getLogger(Keymap.class.getName());

    private final KeymapSettings settings;
    private final KeyCodec codec;
    private final KeyRegistry registry;
    private final KeyConfigIO configIO;
    private final KeyConfigLoader loader;
    private final InputReader reader;
    private final HintBar hintBar;
    private final KeyInfoPopup infoPopup;

    public Keymap(KeymapSettings settings, InputSource input, Screen screen, Translator translator) {
        this.settings = settings;
        this.codec = new KeyCodec();
        this.registry = new KeyRegistry(codec);
        this.configIO = new KeyConfigIO(registry);
        this.loader = new KeyConfigLoader(registry);
        this.reader = new InputReader(input, registry);
        this.hintBar = new HintBar(registry, translator,
                settings.getStatusBarKeyLength(), settings.getStatusBarLabelLength());
        this.infoPopup = new KeyInfoPopup(screen, reader, translator, settings.getPopupRows());
    }

    /**
     * Load the key bindings: create the bindings file with the defaults on
     * first run, replay it, then give default keys to actions the file does
     * not mention.
     *
     * @throws KeyConfigException if the bindings file cannot be created or read
     */
    public LoadReport start() throws KeyConfigException {
        Path file = settings.getKeysFile();
        if (!Files.exists(file)) {
            logger.info("No key bindings file at {}, creating it with the defaults", file);
            configIO.dumpDefaults(file);
        }

        registry.clear();
        LoadReport report = loader.load(file);

        int filled = configIO.fillMissing();
        if (filled < 0 || (filled == 0 && configIO.checkMissing())) {
            VirtualKey failed = VirtualKey.fromIndex(-filled);
            logger.warn("Default key(s) for action \"{}\" could not be assigned, "
                    + "please set them in the key configuration menu", failed.getLabel());
        }
        if (configIO.checkUndefined()) {
            logger.warn("Some actions do not have any associated key bindings!");
        }
        return report;
    }

    /**
     * Save the current bindings to the bindings file.
     */
    public void save() throws KeyConfigException {
        configIO.save(settings.getKeysFile());
    }

    /**
     * Bind a key, by name, to an action, by label.
     */
    public AssignResult bind(String keyName, String actionLabel) throws UnknownActionException {
        VirtualKey action = VirtualKey.requireLabel(actionLabel);
        int code = codec.nameToCode(keyName);
        if (code == KeyCodes.NONE) {
            return AssignResult.INVALID;
        }
        return registry.assign(code, action);
    }

    /**
     * Remove a key, by name, from an action, by label.
     */
    public void unbind(String keyName, String actionLabel) throws UnknownActionException {
        VirtualKey action = VirtualKey.requireLabel(actionLabel);
        registry.remove(codec.nameToCode(keyName), action);
    }

    public BindingState getState(String actionLabel) throws UnknownActionException {
        return registry.getState(VirtualKey.requireLabel(actionLabel));
    }

    public KeymapSettings getSettings() {
        return settings;
    }

    public KeyCodec getCodec() {
        return codec;
    }

    public KeyRegistry getRegistry() {
        return registry;
    }

    public KeyConfigIO getConfigIO() {
        return configIO;
    }

    public KeyConfigLoader getLoader() {
        return loader;
    }

    public InputReader getReader() {
        return reader;
    }

    public HintBar getHintBar() {
        return hintBar;
    }

    public KeyInfoPopup getInfoPopup() {
        return infoPopup;
    }
}
