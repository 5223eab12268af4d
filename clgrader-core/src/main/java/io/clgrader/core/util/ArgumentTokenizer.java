package io.clgrader.core.util;

import java.util.ArrayList;
import java.util.List;

/// Splits a command line into arguments using POSIX shell quoting rules.
///
/// Supports single quotes (literal), double quotes (with `\"`, `\\`, `\$` and `` \` ``
/// escapes) and backslash escapes outside quotes. No variable expansion, globbing or
/// operators: `a > b` yields three arguments.
///
/// {@snippet :
/// ArgumentTokenizer.split("grep -e 'a b' \"c\\\"d\""); // [grep, -e, a b, c"d]
/// }
public final class ArgumentTokenizer {

    private ArgumentTokenizer() {}

    /// Tokenizes a command line.
    ///
    /// @param commandLine the line to split, not null
    /// @return the arguments, never null, empty for a blank line
    /// @throws IllegalArgumentException on an unterminated quote or trailing backslash
    public static List<String> split(String commandLine) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int length = commandLine.length();

        while (i < length) {
            char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int end = commandLine.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated single quote in: " + commandLine);
                }
                current.append(commandLine, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(commandLine, i + 1, current);
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= length) {
                    throw new IllegalArgumentException("Trailing backslash in: " + commandLine);
                }
                current.append(commandLine.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static int readDoubleQuoted(String line, int start, StringBuilder out) {
        int i = start;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < line.length() && "\"\\$`".indexOf(line.charAt(i + 1)) >= 0) {
                out.append(line.charAt(i + 1));
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        throw new IllegalArgumentException("Unterminated double quote in: " + line);
    }
}
