package ai.uno.game;

import java.util.Objects;

/**
 * A move proposed by a player for the current turn.
 *
 * <p><b>Shapes:</b>
 * <ul>
 *   <li>{@link Type#PLAY}: play {@link #getCard()}; {@link #getChosenColor()} is the colour
 *       named for a wild and is ignored otherwise. {@link #isChallenge()} is the challenge
 *       intent carried with the play (see {@code TurnEngine}); it never affects legality.</li>
 *   <li>{@link Type#DRAW}: draw one card, or absorb the whole pending forced draw.</li>
 *   <li>{@link Type#INVALID}: the player's own signal that it could not produce a legal move
 *       (for example, it has to stack but chose a card that cannot); costs one penalty card.</li>
 * </ul>
 */
public final class Move {

    public enum Type {
        PLAY,
        DRAW,
        INVALID
    }

    private static final Move DRAW = new Move(Type.DRAW, null, null, false);
    private static final Move INVALID = new Move(Type.INVALID, null, null, false);

    private final Type type;
    private final Card card;
    private final Color chosenColor;
    private final boolean challenge;

    private Move(Type type, Card card, Color chosenColor, boolean challenge) {
        this.type = type;
        this.card = card;
        this.chosenColor = chosenColor;
        this.challenge = challenge;
    }

    /**
     * Creates a play move.
     *
     * @param card        the card to play
     * @param chosenColor the colour to name if the card is wild; may be null otherwise
     * @param challenge   challenge intent carried with the play
     * @return the move
     */
    public static Move play(Card card, Color chosenColor, boolean challenge) {
        return new Move(Type.PLAY, Objects.requireNonNull(card, "card"), chosenColor, challenge);
    }

    /**
     * Creates a play move for a coloured card without challenge intent.
     */
    public static Move play(Card card) {
        return play(card, null, false);
    }

    public static Move draw() {
        return DRAW;
    }

    public static Move invalid() {
        return INVALID;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the card to play; null unless this is a {@link Type#PLAY} move
     */
    public Card getCard() {
        return card;
    }

    public Color getChosenColor() {
        return chosenColor;
    }

    public boolean isChallenge() {
        return challenge;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Move)) {
            return false;
        }
        Move move = (Move) o;
        return type == move.type
                && challenge == move.challenge
                && Objects.equals(card, move.card)
                && chosenColor == move.chosenColor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, card, chosenColor, challenge);
    }

    @Override
    public String toString() {
        switch (type) {
            case DRAW:
                return "draw";
            case INVALID:
                return "invalid";
            default:
                StringBuilder sb = new StringBuilder("play ").append(card.shortName());
                if (card.isWild() && chosenColor != null) {
                    sb.append(" as ").append(chosenColor);
                }
                if (challenge) {
                    sb.append(" (challenge)");
                }
                return sb.toString();
        }
    }
}
