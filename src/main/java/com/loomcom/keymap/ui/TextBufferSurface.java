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

package com.loomcom.keymap.ui;

/**
 * A {@link Surface} kept in memory as a grid of characters, one code point
 * per cell, with a highlight flag per cell.
 */
public class TextBufferSurface implements Surface {

    private static final int BLANK = ' ';

    private final int rows;
    private final int cols;
    private final int[][] textBuffer;
    private final boolean[][] highlightBuffer;
    private int refreshCount = 0;

    public TextBufferSurface(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Surface size must be positive: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.textBuffer = new int[rows][cols];
        this.highlightBuffer = new boolean[rows][cols];
        erase();
    }

    @Override
    public int getColumns() {
        return cols;
    }

    @Override
    public int getRows() {
        return rows;
    }

    @Override
    public void erase() {
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                textBuffer[y][x] = BLANK;
                highlightBuffer[y][x] = false;
            }
        }
    }

    @Override
    public void print(int row, int col, String text, boolean highlight) {
        if (row < 0 || row >= rows) {
            return;
        }
        int x = col;
        for (int i = 0; i < text.length() && x < cols; ) {
            int cp = text.codePointAt(i);
            if (x >= 0) {
                textBuffer[row][x] = cp;
                highlightBuffer[row][x] = highlight;
            }
            x++;
            i += Character.charCount(cp);
        }
    }

    @Override
    public void refresh() {
        refreshCount++;
    }

    /**
     * @return the row's text, trailing blanks removed
     */
    public String getLine(int row) {
        StringBuilder sb = new StringBuilder();
        for (int x = 0; x < cols; x++) {
            sb.appendCodePoint(textBuffer[row][x]);
        }
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == BLANK) {
            end--;
        }
        return sb.substring(0, end);
    }

    public int getCodePointAt(int row, int col) {
        return textBuffer[row][col];
    }

    public boolean isHighlighted(int row, int col) {
        return highlightBuffer[row][col];
    }

    /**
     * @return how many times the surface was refreshed
     */
    public int getRefreshCount() {
        return refreshCount;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < rows; y++) {
            sb.append(getLine(y)).append('\n');
        }
        return sb.toString();
    }
}
