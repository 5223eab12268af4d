package io.clgrader.core.assessment;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Expectation on captured stdout or stderr.
///
/// ### Permitted Subtypes
/// - {@link Exact} - byte-for-byte comparison, optionally ignoring surrounding whitespace
/// - {@link Matches} - the text contains a match of a regular expression
public sealed interface TextPredicate {

    /// Tests captured bytes against this predicate.
    ///
    /// @param actual captured output, not null
    /// @return `true` if the predicate holds
    boolean test(byte[] actual);

    /// Returns the expectation as shown in diagnostics.
    ///
    /// @return description, never null
    String describe();

    static TextPredicate exact(String expected) {
        return new Exact(expected, false);
    }

    static TextPredicate trimmed(String expected) {
        return new Exact(expected, true);
    }

    static TextPredicate matches(String regex) {
        return new Matches(regex);
    }

    /// Exact comparison against the UTF-8 encoding of `expected`.
    ///
    /// @param expected expected text, not null
    /// @param trim strip leading and trailing whitespace on both sides before comparing
    record Exact(String expected, boolean trim) implements TextPredicate {

        public Exact {
            Objects.requireNonNull(expected, "expected must not be null");
        }

        @Override
        public boolean test(byte[] actual) {
            if (trim) {
                return new String(actual, StandardCharsets.UTF_8).strip().equals(expected.strip());
            }
            return Arrays.equals(expected.getBytes(StandardCharsets.UTF_8), actual);
        }

        @Override
        public String describe() {
            return trim ? expected.strip() : expected;
        }
    }

    /// Regular-expression search over the UTF-8 decoded text.
    ///
    /// Uses `find` semantics; anchor the pattern with `^...$` for a full match.
    ///
    /// @param regex the pattern source, must compile
    record Matches(String regex) implements TextPredicate {

        public Matches {
            Objects.requireNonNull(regex, "regex must not be null");
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid pattern: " + regex, e);
            }
        }

        @Override
        public boolean test(byte[] actual) {
            return Pattern.compile(regex)
                    .matcher(new String(actual, StandardCharsets.UTF_8))
                    .find();
        }

        @Override
        public String describe() {
            return "matches /" + regex + "/";
        }
    }
}
