package com.loomcom.keymap.ui;

import com.loomcom.keymap.input.InputReader;
import com.loomcom.keymap.input.ScriptedInputSource;
import com.loomcom.keymap.keys.KeyCodec;
import com.loomcom.keymap.keys.KeyRegistry;
import com.loomcom.keymap.keys.VirtualKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the key description popup.
 */
public class KeyInfoPopupTest {

    private RecordingScreen screen;
    private ScriptedInputSource source;
    private KeyInfoPopup popup;

    @BeforeEach
    public void setUp() {
        screen = new RecordingScreen(24, 80);
        source = new ScriptedInputSource();
        InputReader reader = new InputReader(source, new KeyRegistry(new KeyCodec()));
        popup = new KeyInfoPopup(screen, reader, Translator.IDENTITY, 10);
    }

    @Test
    public void testShowDescription() throws IOException {
        source.text("xy");
        popup.show(VirtualKey.ADD_ITEM.index());

        assertEquals(1, screen.getOpened().size());
        RecordingScreen.Popup shown = screen.getOpened().get(0);
        assertEquals("add-item", shown.title);
        assertEquals(VirtualKey.ADD_ITEM.getDescription(), shown.message);
        assertEquals(10, shown.rows);
        assertEquals(76, shown.cols);
        assertEquals(7, shown.y);
        assertEquals(2, shown.x);

        // One key closes the popup
        assertEquals(1, source.remaining());
        assertEquals(1, screen.getClosed().size());
        assertSame(shown.surface, screen.getClosed().get(0));
    }

    @Test
    public void testIndexOutsideCatalog() throws IOException {
        popup.show(-1);
        popup.show(VirtualKey.count());
        popup.show((VirtualKey) null);

        assertTrue(screen.getOpened().isEmpty());
    }

    @Test
    public void testPopupIsClosedWhenInputFails() {
        assertThrows(EOFException.class, () -> popup.show(VirtualKey.GENERIC_HELP));
        assertEquals(1, screen.getOpened().size());
        assertEquals(1, screen.getClosed().size());
    }

    @Test
    public void testDescriptionIsTranslated() throws IOException {
        popup = new KeyInfoPopup(screen, new InputReader(source, new KeyRegistry(new KeyCodec())),
                msgid -> "[" + msgid + "]", 5);
        source.text(" ");
        popup.show(VirtualKey.GENERIC_QUIT);

        RecordingScreen.Popup shown = screen.getOpened().get(0);
        assertEquals("[" + VirtualKey.GENERIC_QUIT.getDescription() + "]", shown.message);
        assertEquals("generic-quit", shown.title);
    }
}
