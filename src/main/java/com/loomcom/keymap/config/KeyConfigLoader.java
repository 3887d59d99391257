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
import com.loomcom.keymap.keys.KeyCodes;
import com.loomcom.keymap.keys.KeyRegistry;
import com.loomcom.keymap.keys.VirtualKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Replays a bindings file into a {@link KeyRegistry}.
 *
 * Each line is "label key key ...". Lines that are blank or start with '#'
 * are skipped. The token UNDEFINED leaves the action deliberately without
 * keys. Unknown labels, unknown key names and keys that are already bound
 * are collected in the {@link LoadReport}; the rest of the file is still
 * applied.
 */
public class KeyConfigLoader {

    private final static Logger logger = LoggerFactory.getLogger(KeyConfigLoader.class.getName());

    private final KeyRegistry registry;

    public KeyConfigLoader(KeyRegistry registry) {
        this.registry = registry;
    }

    public LoadReport load(Reader in) throws IOException {
        LoadReport report = new LoadReport();
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            report.lineRead();

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            String[] tokens = trimmed.split("\\s+");
            VirtualKey action = VirtualKey.fromLabel(tokens[0]);
            if (action == null) {
                report.problem(lineNumber, "unknown action \"" + tokens[0] + "\"");
                continue;
            }
            if (tokens.length == 1) {
                report.problem(lineNumber, "no key for action \"" + tokens[0] + "\"");
                continue;
            }

            for (int i = 1; i < tokens.length; i++) {
                applyToken(tokens[i], action, lineNumber, report);
            }
        }

        for (LoadReport.Problem problem : report.getProblems()) {
            logger.warn("Key bindings, {}", problem);
        }
        logger.debug("{} lines read, {} keys bound", report.getLines(), report.getAssigned());
        return report;
    }

    /**
     * Replay a bindings file.
     *
     * @throws KeyConfigException if the file cannot be read
     */
    public LoadReport load(Path file) throws KeyConfigException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            LoadReport report = load(in);
            logger.info("Key bindings loaded from {}", file);
            return report;
        } catch (IOException e) {
            throw new KeyConfigException("Could not read key bindings", file, e);
        }
    }

    private void applyToken(String token, VirtualKey action, int lineNumber, LoadReport report) {
        if (KeyRegistry.UNDEFINED.equals(token)) {
            registry.markUndefined(action);
            return;
        }

        int code = registry.getCodec().nameToCode(token);
        if (code == KeyCodes.NONE) {
            report.problem(lineNumber, "unknown key \"" + token + "\"");
            return;
        }

        AssignResult result = registry.assign(code, action);
        switch (result) {
            case OK:
                report.bindingAssigned();
                break;
            case CONFLICT:
                report.problem(lineNumber, "key \"" + token + "\" is already assigned to \""
                        + registry.lookup(code).getLabel() + "\"");
                break;
            default:
                report.problem(lineNumber, "key \"" + token + "\" cannot be assigned");
                break;
        }
    }
}
