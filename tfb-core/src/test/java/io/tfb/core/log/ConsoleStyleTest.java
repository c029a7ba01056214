package io.tfb.core.log;

import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsoleStyleTest {

    @Test
    void shouldLeaveTextAloneWhenDisabled() {
        var style = new ConsoleStyle(Ansi.OFF);

        assertThat(style.enabled()).isFalse();
        assertThat(style.cyan("|")).isEqualTo("|");
        assertThat(style.red("ERROR")).isEqualTo("ERROR");
        assertThat(style.bold("gemini")).isEqualTo("gemini");
    }

    @Test
    void shouldWrapTextInEscapesWhenEnabled() {
        var style = new ConsoleStyle(Ansi.ON);

        String red = style.red("ERROR");

        assertThat(red).startsWith("\u001B[").contains("ERROR").isNotEqualTo("ERROR");
        assertThat(TranscriptFile.strip(red)).isEqualTo("ERROR");
        assertThat(style.green("PASS")).isNotEqualTo(style.yellow("PASS"));
    }

    @Test
    void boldShouldEndWithFullReset() {
        String bold = new ConsoleStyle(Ansi.ON).bold("gemini");

        assertThat(bold).startsWith("\u001B[1m").endsWith("\u001B[0m");
        assertThat(bold).doesNotContain("\u001B[21m");
    }

    @Test
    void everyColorShouldEndWithFullReset() {
        var style = new ConsoleStyle(Ansi.ON);

        assertThat(style.cyan("|")).endsWith("\u001B[0m");
        assertThat(style.red("ERROR")).endsWith("\u001B[0m");
        assertThat(style.yellow("WARN")).endsWith("\u001B[0m");
        assertThat(style.green("PASS")).endsWith("\u001B[0m");
    }

    @Test
    void shouldNotStyleEmptyText() {
        assertThat(new ConsoleStyle(Ansi.ON).cyan("")).isEmpty();
    }

    @Test
    void shouldRequireMode() {
        assertThatThrownBy(() -> new ConsoleStyle(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
