package com.nevis.notebook.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextFormatterTest {

    private final TextFormatter formatter = new TextFormatter();

    @Test
    @DisplayName("Should collapse runs of blank lines to one empty line")
    void shouldCollapseBlankLines() {
        assertThat(formatter.format("First\n\n\n\n\nSecond")).isEqualTo("First\n\nSecond");
    }

    @Test
    @DisplayName("Should normalize line endings and drop trailing blanks")
    void shouldNormalizeLineEndings() {
        assertThat(formatter.format("First   \r\nSecond\t\r\nThird")).isEqualTo("First\nSecond\nThird");
    }

    @Test
    @DisplayName("Should join lines broken inside CJK text only")
    void shouldJoinBrokenCjkLines() {
        assertThat(formatter.format("日本語の\n文章です")).isEqualTo("日本語の文章です");
        assertThat(formatter.format("English\nline")).isEqualTo("English\nline");
    }

    @Test
    @DisplayName("Should remove standalone page numbers")
    void shouldRemovePageNumbers() {
        assertThat(formatter.format("Intro\n- 2 -\nBody")).isEqualTo("Intro\nBody");
        assertThat(formatter.format("Intro\n3 / 10\nBody")).isEqualTo("Intro\nBody");
        assertThat(formatter.format("Intro\nPage 4\nBody")).isEqualTo("Intro\nBody");
        assertThat(formatter.format("Intro\nP. 5\nBody")).isEqualTo("Intro\nBody");
    }

    @Test
    @DisplayName("Should keep numbers that are part of the text")
    void shouldKeepInlineNumbers() {
        assertThat(formatter.format("Revenue grew 3 / 10 of a point on page 4."))
            .isEqualTo("Revenue grew 3 / 10 of a point on page 4.");
    }

    @Test
    @DisplayName("Should squeeze repeated spaces")
    void shouldSqueezeSpaces() {
        assertThat(formatter.format("one    two\t\tthree")).isEqualTo("one two three");
    }

    @Test
    @DisplayName("Blank input formats to an empty string")
    void shouldHandleBlankInput() {
        assertThat(formatter.format(null)).isEmpty();
        assertThat(formatter.format("  \n ")).isEmpty();
    }

    @Test
    @DisplayName("Should cap formatted text at maxChars")
    void shouldTruncateToMaxChars() {
        assertThat(formatter.format("  abcdefghij  ", 4)).isEqualTo("abcd");
        assertThat(formatter.format("abc", 10)).isEqualTo("abc");
    }
}
