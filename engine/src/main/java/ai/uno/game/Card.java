package ai.uno.game;

import java.util.Locale;
import java.util.Objects;

/**
 * Represents a single UNO card with a {@link Color} and a {@link Rank}.
 * <p>
 * Cards are immutable and compared by value. Wild cards always carry {@link Color#WILD};
 * the colour chosen when a wild is played is recorded as the game's active colour, never
 * on the card itself. Coloured cards always carry one of the {@link Color#STANDARD} colours.
 */
public class Card {
    /** The colour printed on the card ({@link Color#WILD} for wild ranks). */
    private final Color color;
    /** The rank of the card. */
    private final Rank rank;

    /**
     * Constructs a card.
     *
     * @param color the printed colour
     * @param rank  the rank
     * @throws NullPointerException     if color or rank is null
     * @throws IllegalArgumentException if a wild rank is given a standard colour or a
     *                                  coloured rank is given {@link Color#WILD}
     */
    public Card(Color color, Rank rank) {
        this.color = Objects.requireNonNull(color, "color");
        this.rank = Objects.requireNonNull(rank, "rank");
        if (rank.isWild() != (color == Color.WILD)) {
            throw new IllegalArgumentException("Invalid card " + color + " " + rank);
        }
    }

    /**
     * Creates a wild card of the given rank.
     *
     * @param rank {@link Rank#WILD} or {@link Rank#WILD_DRAW_FOUR}
     * @return the wild card
     */
    public static Card wild(Rank rank) {
        return new Card(Color.WILD, rank);
    }

    /**
     * Parses a card from its {@link #shortName()} form, case-insensitively.
     * <p>
     * Accepted shapes are {@code "<COLOR> <RANK>"} (e.g. "RED 5", "blue draw_two") and a
     * bare wild rank ("WILD", "WILD_DRAW_FOUR").
     *
     * @param name the card name
     * @return the parsed card
     * @throws IllegalArgumentException if the name is not a valid card
     */
    public static Card parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Empty card name");
        }
        String[] tokens = name.trim().toUpperCase(Locale.ROOT).split("\\s+");
        if (tokens.length == 1) {
            return wild(parseRank(tokens[0]));
        }
        if (tokens.length == 2) {
            return new Card(Color.valueOf(tokens[0]), parseRank(tokens[1]));
        }
        throw new IllegalArgumentException("Unrecognised card: " + name);
    }

    private static Rank parseRank(String token) {
        for (Rank r : Rank.values()) {
            if (r.getLabel().equals(token) || r.name().equals(token)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unrecognised rank: " + token);
    }

    public Color getColor() {
        return color;
    }

    public Rank getRank() {
        return rank;
    }

    public boolean isWild() {
        return rank.isWild();
    }

    /**
     * Checks whether this card may legally be played onto {@code top}.
     * <ul>
     *   <li>A wild card can always be played.</li>
     *   <li>On a wild top card, the card must match the active colour or the top card's rank.</li>
     *   <li>Otherwise the card must match the top card's colour or rank.</li>
     * </ul>
     * Stacking restrictions and Wild Draw Four legality are turn-engine rules, not card rules.
     *
     * @param top         the current top of the discard pile
     * @param activeColor the colour currently in effect
     * @return {@code true} if the play is legal
     */
    public boolean matches(Card top, Color activeColor) {
        if (rank.isWild()) {
            return true;
        }
        if (top.rank.isWild()) {
            return color == activeColor || rank == top.rank;
        }
        return color == top.color || rank == top.rank;
    }

    /**
     * Returns an uncoloured display name, e.g. "RED 5", "BLUE SKIP" or "WILD_DRAW_FOUR".
     *
     * @return the short name of the card
     */
    public String shortName() {
        if (rank.isWild()) {
            return rank.getLabel();
        }
        return color.name() + " " + rank.getLabel();
    }

    /**
     * Returns the short name wrapped in ANSI colour codes for terminal display.
     *
     * @return the coloured card name
     */
    public String toColoredString() {
        return color.colourise(shortName());
    }

    @Override
    public String toString() {
        return shortName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return color == card.color && rank == card.rank;
    }

    @Override
    public int hashCode() {
        return Objects.hash(color, rank);
    }
}
