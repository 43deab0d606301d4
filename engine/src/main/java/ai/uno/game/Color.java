package ai.uno.game;

import java.util.List;

/**
 * Enumeration of the four UNO card colours plus the {@link #WILD} marker.
 * <p>
 * {@code WILD} is the nominal colour printed on wild cards before a colour is chosen.
 * It is never a legal active colour; {@link #STANDARD} lists the four playable colours
 * in enumeration order, which is also the order used to break ties when a colour is
 * picked automatically.
 * <p>
 * This enum also provides ANSI colour formatting utilities for terminal display.
 */
public enum Color {
    /** Red: rendered in red text. */
    RED("\u001B[31m"),
    /** Yellow: rendered in yellow text. */
    YELLOW("\u001B[33m"),
    /** Green: rendered in green text. */
    GREEN("\u001B[32m"),
    /** Blue: rendered in blue text. */
    BLUE("\u001B[34m"),
    /** Nominal colour of an unresolved wild card. */
    WILD("\u001B[35m");

    /** The four playable colours, in tie-break order. */
    public static final List<Color> STANDARD = List.of(RED, YELLOW, GREEN, BLUE);

    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    /** ANSI escape code selecting this colour's text colour. */
    private final String ansi;

    Color(String ansi) {
        this.ansi = ansi;
    }

    /**
     * Checks whether this colour can be the active colour of a game.
     *
     * @return {@code true} for the four standard colours; {@code false} for {@link #WILD}
     */
    public boolean isStandard() {
        return this != WILD;
    }

    /**
     * Wraps the given value in this colour's ANSI codes for terminal display.
     *
     * @param value the text to colourise
     * @return the coloured text
     */
    public String colourise(String value) {
        return ansi + value + ANSI_RESET;
    }
}
