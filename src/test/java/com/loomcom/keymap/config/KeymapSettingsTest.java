package com.loomcom.keymap.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class KeymapSettingsTest {

    @AfterEach
    public void clearOverrides() {
        System.clearProperty(KeymapSettings.POPUP_ROWS);
    }

    @Test
    public void testDefaultsWithoutProperties() {
        KeymapSettings settings = new KeymapSettings(new Properties());

        assertEquals(Paths.get(System.getProperty("user.home"), ".config", "calcurse", "keys"),
                settings.getKeysFile());
        assertEquals(3, settings.getStatusBarKeyLength());
        assertEquals(8, settings.getStatusBarLabelLength());
        assertEquals(10, settings.getPopupRows());
    }

    @Test
    public void testConfiguredValues() {
        Properties props = new Properties();
        props.setProperty(KeymapSettings.CONFIG_DIR, "/tmp/keymap-test");
        props.setProperty(KeymapSettings.KEYS_FILE, "bindings");
        props.setProperty(KeymapSettings.STATUSBAR_KEYLEN, " 4 ");
        KeymapSettings settings = new KeymapSettings(props);

        assertEquals(Paths.get("/tmp/keymap-test"), settings.getConfigDir());
        assertEquals(Paths.get("/tmp/keymap-test", "bindings"), settings.getKeysFile());
        assertEquals(4, settings.getStatusBarKeyLength());
    }

    @Test
    public void testInvalidNumbersFallBack() {
        Properties props = new Properties();
        props.setProperty(KeymapSettings.STATUSBAR_KEYLEN, "three");
        props.setProperty(KeymapSettings.STATUSBAR_LABELLEN, "0");
        props.setProperty(KeymapSettings.POPUP_ROWS, "-2");
        KeymapSettings settings = new KeymapSettings(props);

        assertEquals(3, settings.getStatusBarKeyLength());
        assertEquals(8, settings.getStatusBarLabelLength());
        assertEquals(10, settings.getPopupRows());
    }

    @Test
    public void testResourceAndSystemPropertyOverride() {
        System.setProperty(KeymapSettings.POPUP_ROWS, "7");
        KeymapSettings settings = KeymapSettings.load();

        assertEquals(7, settings.getPopupRows());
        assertEquals(8, settings.getStatusBarLabelLength());
        assertTrue(settings.getKeysFile().endsWith(Paths.get(".config", "calcurse", "keys")));
    }
}
