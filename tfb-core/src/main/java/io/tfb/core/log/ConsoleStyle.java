package io.tfb.core.log;

import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

/**
 * Console color helpers backed by picocli's ANSI support.
 * When the configured {@link Ansi} mode is disabled every method returns its input unchanged.
 * Styled text always ends with a full reset ({@code ESC[0m}).
 */
public final class ConsoleStyle {

    private final Ansi ansi;

    public ConsoleStyle(Ansi ansi) {
        if (ansi == null) {
            throw new IllegalArgumentException("Ansi mode must not be null");
        }
        this.ansi = ansi;
    }

    public Ansi ansi() {
        return ansi;
    }

    public boolean enabled() {
        return ansi.enabled();
    }

    public String bold(String text) {
        return apply(Style.bold, text);
    }

    /** Structural output: banners, borders, framework and type names. */
    public String cyan(String text) {
        return apply(Style.fg_cyan, text);
    }

    public String red(String text) {
        return apply(Style.fg_red, text);
    }

    public String yellow(String text) {
        return apply(Style.fg_yellow, text);
    }

    public String green(String text) {
        return apply(Style.fg_green, text);
    }

    private String apply(IStyle style, String text) {
        if (!ansi.enabled() || text.isEmpty()) {
            return text;
        }
        return style.on() + text + Style.reset.on();
    }
}
