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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Runtime settings: where the bindings file lives and how the status bar
 * and popups are sized.
 *
 * Defaults come from the keymap.properties resource; a system property of
 * the same name overrides a resource value. "${user.home}" is expanded.
 */
public class KeymapSettings {

    private final static Logger logger = LoggerFactory.getLogger(KeymapSettings.class.getName());

    private static final String SETTINGS_RESOURCE = "/keymap.properties";

    public static final String CONFIG_DIR = "keymap.config.dir";
    public static final String KEYS_FILE = "keymap.keys.file";
    public static final String STATUSBAR_KEYLEN = "keymap.statusbar.keylen";
    public static final String STATUSBAR_LABELLEN = "keymap.statusbar.labellen";
    public static final String POPUP_ROWS = "keymap.popup.rows";

    private static final String DEFAULT_CONFIG_DIR = "${user.home}/.config/calcurse";
    private static final String DEFAULT_KEYS_FILE = "keys";
    private static final int DEFAULT_KEYLEN = 3;
    private static final int DEFAULT_LABELLEN = 8;
    private static final int DEFAULT_POPUP_ROWS = 10;

    private final Properties properties;

    public KeymapSettings(Properties properties) {
        this.properties = properties;
    }

    /**
     * Settings from the bundled resource, overridden by system properties.
     */
    public static KeymapSettings load() {
        Properties props = new Properties();
        try (InputStream resource = KeymapSettings.class.getResourceAsStream(SETTINGS_RESOURCE)) {
            if (resource == null) {
                logger.warn("Settings resource {} not found, using built-in defaults", SETTINGS_RESOURCE);
            } else {
                props.load(resource);
            }
        } catch (IOException e) {
            logger.warn("Could not read settings resource {}: {}", SETTINGS_RESOURCE, e.getMessage());
        }

        for (String name : new String[] { CONFIG_DIR, KEYS_FILE, STATUSBAR_KEYLEN, STATUSBAR_LABELLEN, POPUP_ROWS }) {
            String value = System.getProperty(name);
            if (value != null) {
                props.setProperty(name, value);
            }
        }
        return new KeymapSettings(props);
    }

    public Path getConfigDir() {
        return Paths.get(expand(properties.getProperty(CONFIG_DIR, DEFAULT_CONFIG_DIR)));
    }

    /**
     * @return the key bindings file
     */
    public Path getKeysFile() {
        return getConfigDir().resolve(properties.getProperty(KEYS_FILE, DEFAULT_KEYS_FILE));
    }

    public int getStatusBarKeyLength() {
        return getInt(STATUSBAR_KEYLEN, DEFAULT_KEYLEN);
    }

    public int getStatusBarLabelLength() {
        return getInt(STATUSBAR_LABELLEN, DEFAULT_LABELLEN);
    }

    public int getPopupRows() {
        return getInt(POPUP_ROWS, DEFAULT_POPUP_ROWS);
    }

    private int getInt(String name, int defaultValue) {
        String value = properties.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using {}", value, name, defaultValue);
            return defaultValue;
        }
        if (n <= 0) {
            logger.warn("Value {} for {} must be positive, using {}", n, name, defaultValue);
            return defaultValue;
        }
        return n;
    }

    private static String expand(String value) {
        return value.replace("${user.home}", System.getProperty("user.home"));
    }
}
