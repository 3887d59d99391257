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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What happened while replaying a bindings file.
 */
public class LoadReport {

    /**
     * A line that could not be applied, entirely or in part.
     */
    public static final class Problem {
        private final int line;
        private final String message;

        Problem(int line, String message) {
            this.line = line;
            this.message = message;
        }

        public int getLine() {
            return line;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "line " + line + ": " + message;
        }
    }

    private final List<Problem> problems = new ArrayList<>();
    private int lines;
    private int assigned;

    void lineRead() {
        lines++;
    }

    void bindingAssigned() {
        assigned++;
    }

    void problem(int line, String message) {
        problems.add(new Problem(line, message));
    }

    /**
     * @return the number of lines read, comments included
     */
    public int getLines() {
        return lines;
    }

    /**
     * @return the number of keys bound
     */
    public int getAssigned() {
        return assigned;
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }

    public List<Problem> getProblems() {
        return Collections.unmodifiableList(problems);
    }
}
