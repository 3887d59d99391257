package com.loomcom.keymap;

import com.loomcom.keymap.config.KeyConfigIO;
import com.loomcom.keymap.config.KeymapSettings;
import com.loomcom.keymap.config.LoadReport;
import com.loomcom.keymap.exceptions.KeyConfigException;
import com.loomcom.keymap.exceptions.UnknownActionException;
import com.loomcom.keymap.input.KeyCommand;
import com.loomcom.keymap.input.ScriptedInputSource;
import com.loomcom.keymap.keys.AssignResult;
import com.loomcom.keymap.keys.BindingState;
import com.loomcom.keymap.keys.VirtualKey;
import com.loomcom.keymap.ui.RecordingScreen;
import com.loomcom.keymap.ui.TextBufferSurface;
import com.loomcom.keymap.ui.Translator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the assembled keybinding subsystem, from first run to saving.
 */
public class KeymapTest {

    @TempDir
    Path tempDir;

    private final ScriptedInputSource input = new ScriptedInputSource();

    private Keymap keymap(Path configDir) {
        Properties props = new Properties();
        props.setProperty(KeymapSettings.CONFIG_DIR, configDir.toString());
        return new Keymap(new KeymapSettings(props), input, new RecordingScreen(24, 80), Translator.IDENTITY);
    }

    @Test
    public void testFirstRunCreatesDefaults() throws Exception {
        Path dir = tempDir.resolve("calcurse");
        Keymap keymap = keymap(dir);

        LoadReport report = keymap.start();

        Path file = dir.resolve("keys");
        assertTrue(Files.exists(file));
        assertTrue(new String(Files.readAllBytes(file), StandardCharsets.UTF_8).startsWith(KeyConfigIO.HEADER));
        assertFalse(report.hasProblems());
        assertEquals(VirtualKey.count() + 8, report.getLines());
        for (VirtualKey key : VirtualKey.values()) {
            assertEquals(BindingState.BOUND, keymap.getRegistry().getState(key), key.getLabel());
        }
        assertEquals(0, keymap.getConfigIO().fillMissing());
    }

    @Test
    public void testPartialFileIsCompleted() throws Exception {
        Path file = tempDir.resolve("keys");
        Files.write(file, List.of("add-item  F5", "repeat  UNDEFINED", "bogus-action  z"), StandardCharsets.UTF_8);
        Keymap keymap = keymap(tempDir);

        LoadReport report = keymap.start();

        assertEquals(1, report.getProblems().size());
        assertEquals(List.of("F5"), keymap.getRegistry().keys(VirtualKey.ADD_ITEM));
        assertNull(keymap.getRegistry().lookup('a'));
        assertEquals(BindingState.UNDEFINED, keymap.getState("repeat"));
        assertEquals(BindingState.BOUND, keymap.getState("del-item"));
        assertFalse(keymap.getConfigIO().checkMissing());
        assertTrue(keymap.getConfigIO().checkUndefined());
    }

    @Test
    public void testUnwritableConfigurationIsFatal() throws IOException {
        Path blocker = tempDir.resolve("not-a-directory");
        Files.write(blocker, new byte[0]);
        Keymap keymap = keymap(blocker);

        assertThrows(KeyConfigException.class, keymap::start);
    }

    @Test
    public void testRebindSaveAndRestart() throws Exception {
        Keymap keymap = keymap(tempDir);
        keymap.start();

        keymap.unbind("a", "add-item");
        assertEquals(AssignResult.OK, keymap.bind("F6", "add-item"));
        assertEquals(AssignResult.CONFLICT, keymap.bind("d", "add-item"));
        assertEquals(AssignResult.INVALID, keymap.bind("NOPE", "add-item"));
        keymap.save();

        Keymap restarted = keymap(tempDir);
        restarted.start();
        assertEquals(List.of("A", "F6"), restarted.getRegistry().keys(VirtualKey.ADD_ITEM));
        assertNull(restarted.getRegistry().lookup('a'));
    }

    @Test
    public void testUnknownActionLabels() throws Exception {
        Keymap keymap = keymap(tempDir);
        keymap.start();

        UnknownActionException e = assertThrows(UnknownActionException.class,
                () -> keymap.bind("a", "no-such-action"));
        assertEquals("no-such-action", e.getLabel());
        assertThrows(UnknownActionException.class, () -> keymap.unbind("a", "no-such-action"));
        assertThrows(UnknownActionException.class, () -> keymap.getState("no-such-action"));
    }

    @Test
    public void testCommandsAndHints() throws Exception {
        Keymap keymap = keymap(tempDir);
        keymap.start();

        input.text("3j");
        KeyCommand command = keymap.getReader().readCommand();
        assertEquals(VirtualKey.MOVE_DOWN, command.getAction());
        assertEquals(3, command.getCount());

        TextBufferSurface bar = new TextBufferSurface(2, 80);
        keymap.getHintBar().render(bar, new int[] { VirtualKey.GENERIC_HELP.index() }, 0, 4);
        assertTrue(bar.getLine(0).startsWith("  ? Help"));
    }
}
