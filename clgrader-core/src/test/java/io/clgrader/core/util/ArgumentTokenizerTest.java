package io.clgrader.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ArgumentTokenizerTest {

    @Test
    void shouldSplitOnWhitespace() {
        assertThat(ArgumentTokenizer.split("  add\t1   2 ")).containsExactly("add", "1", "2");
    }

    @Test
    void shouldReturnEmptyListForBlankLine() {
        assertThat(ArgumentTokenizer.split("   ")).isEmpty();
    }

    @Test
    void shouldKeepSingleQuotedTextLiteral() {
        assertThat(ArgumentTokenizer.split("echo 'a  b' '$HOME\\n'"))
                .containsExactly("echo", "a  b", "$HOME\\n");
    }

    @Test
    void shouldHonorEscapesInsideDoubleQuotes() {
        assertThat(ArgumentTokenizer.split("grep -e \"c\\\"d\" \"x\\y\""))
                .containsExactly("grep", "-e", "c\"d", "x\\y");
    }

    @Test
    void shouldJoinAdjacentQuotedParts() {
        assertThat(ArgumentTokenizer.split("a'b c'\"d\"")).containsExactly("ab cd");
    }

    @Test
    void shouldKeepEmptyQuotedArgument() {
        assertThat(ArgumentTokenizer.split("x '' y")).containsExactly("x", "", "y");
    }

    @Test
    void shouldTreatShellOperatorsAsPlainArguments() {
        assertThat(ArgumentTokenizer.split("a > b | c")).containsExactly("a", ">", "b", "|", "c");
    }

    @Test
    void shouldRejectUnterminatedQuotes() {
        assertThatThrownBy(() -> ArgumentTokenizer.split("echo 'oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unterminated single quote");
        assertThatThrownBy(() -> ArgumentTokenizer.split("echo \"oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unterminated double quote");
    }

    @Test
    void shouldRejectTrailingBackslash() {
        assertThatThrownBy(() -> ArgumentTokenizer.split("echo \\"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Trailing backslash");
    }
}
