package ai.uno.game;

/**
 * Enumeration representing the fifteen UNO card ranks.
 * <p>
 * Every rank belongs to exactly one family: the ten numbers, the three coloured
 * action cards, or the two wilds. Rule logic asks the family through {@link #isNumber()},
 * {@link #isAction()} and {@link #isWild()} rather than inspecting names.
 */
public enum Rank {
    ZERO(Family.NUMBER, "0"),
    ONE(Family.NUMBER, "1"),
    TWO(Family.NUMBER, "2"),
    THREE(Family.NUMBER, "3"),
    FOUR(Family.NUMBER, "4"),
    FIVE(Family.NUMBER, "5"),
    SIX(Family.NUMBER, "6"),
    SEVEN(Family.NUMBER, "7"),
    EIGHT(Family.NUMBER, "8"),
    NINE(Family.NUMBER, "9"),
    /** Skips the next seat. */
    SKIP(Family.ACTION, "SKIP"),
    /** Flips the direction of play; acts as a skip with two seats. */
    REVERSE(Family.ACTION, "REVERSE"),
    /** Adds two to the pending forced draw. */
    DRAW_TWO(Family.ACTION, "DRAW_TWO"),
    /** Lets the player choose the active colour. */
    WILD(Family.WILD, "WILD"),
    /** Chooses the active colour and adds four to the pending forced draw, subject to challenge. */
    WILD_DRAW_FOUR(Family.WILD, "WILD_DRAW_FOUR");

    private enum Family {
        NUMBER,
        ACTION,
        WILD
    }

    /** The family this rank belongs to. */
    private final Family family;
    /** Short label for display (e.g. "7", "SKIP"). */
    private final String label;

    Rank(Family family, String label) {
        this.family = family;
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNumber() {
        return family == Family.NUMBER;
    }

    public boolean isAction() {
        return family == Family.ACTION;
    }

    public boolean isWild() {
        return family == Family.WILD;
    }

    /**
     * Checks whether a card of this rank may answer a pending forced draw.
     *
     * @return {@code true} for {@link #DRAW_TWO} and {@link #WILD_DRAW_FOUR}
     */
    public boolean isDrawPenalty() {
        return this == DRAW_TWO || this == WILD_DRAW_FOUR;
    }

    @Override
    public String toString() {
        return label;
    }
}
