/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Parses the {@code key=value} lines a user typed into a map.
 * <p>
 * A value starting with a backtick opens a block which continues over the following lines
 * (joined with {@code \n}) until a line ending with an unescaped backtick, which is dropped.
 * Inside a block {@code \`} stands for a literal backtick and does not end the block.
 * <pre>
 * user=admin
 * config=`first line
 * second line with a \` in it`
 * </pre>
 * If a key occurs more than once the last value wins.
 */
public final class ValueParser {

    private static final char SEPARATOR = '=';
    private static final String BACKTICK = "`";
    private static final String ESCAPED_BACKTICK = "\\`";

    private enum State {
        NORMAL,
        INSIDE_BLOCK
    }

    private ValueParser() {
    }

    /**
     * Parses the given text.
     * @param text The text.
     * @return The key to value mapping, which is never empty.
     * @throws FormatException If the text is empty, a line lacks a {@code =}, or a block is never closed.
     */
    @NonNull
    public static Map<String, String> parse(@NonNull String text) {
        Objects.requireNonNull(text);
        if (text.isEmpty()) {
            throw new FormatException("empty input");
        }
        var result = new LinkedHashMap<String, String>();
        var state = State.NORMAL;
        var blockValue = new StringBuilder();
        String blockKey = null;

        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            switch (state) {
                case NORMAL -> {
                    int separator = line.indexOf(SEPARATOR);
                    if (separator < 0) {
                        throw new FormatException("Missing '" + SEPARATOR + "' at line: " + i, i);
                    }
                    String key = line.substring(0, separator);
                    String value = line.substring(separator + 1);
                    if (!value.startsWith(BACKTICK)) {
                        result.put(key, value);
                        continue;
                    }
                    blockKey = key;
                    if (appendBlockLine(blockValue, value.substring(BACKTICK.length()))) {
                        result.put(blockKey, blockValue.toString());
                        blockValue.setLength(0);
                    }
                    else {
                        state = State.INSIDE_BLOCK;
                    }
                }
                case INSIDE_BLOCK -> {
                    blockValue.append('\n');
                    if (appendBlockLine(blockValue, line)) {
                        result.put(blockKey, blockValue.toString());
                        blockValue.setLength(0);
                        state = State.NORMAL;
                    }
                }
            }
        }
        if (state == State.INSIDE_BLOCK) {
            throw new FormatException("unterminated multi-line value");
        }
        return result;
    }

    /**
     * Appends one line of a block, unescaping backticks.
     * @return true if the line closed the block.
     */
    private static boolean appendBlockLine(StringBuilder blockValue, String line) {
        boolean closes = line.endsWith(BACKTICK) && !line.endsWith(ESCAPED_BACKTICK);
        String content = closes ? line.substring(0, line.length() - BACKTICK.length()) : line;
        blockValue.append(content.replace(ESCAPED_BACKTICK, BACKTICK));
        return closes;
    }
}
