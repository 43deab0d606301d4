package ai.uno.game.event;

import ai.uno.game.Card;
import ai.uno.game.Color;
import java.util.Objects;

/**
 * Immutable notification of something that happened in a game.
 * <p>
 * Events carry a per-game sequence number starting at 1, so a presentation layer can order
 * them independently of how it receives them. The optional fields are set when they are
 * meaningful for the {@link GameEventType}: {@code card} for plays and draws, {@code color}
 * for colour changes, {@code count} for draw amounts.
 */
public final class GameEvent {
    private final long sequence;
    private final GameEventType type;
    private final String player;
    private final Card card;
    private final Color color;
    private final int count;

    private GameEvent(long sequence, GameEventType type, String player, Card card, Color color, int count) {
        this.sequence = sequence;
        this.type = Objects.requireNonNull(type, "type");
        this.player = player;
        this.card = card;
        this.color = color;
        this.count = count;
    }

    public static GameEvent of(long sequence, GameEventType type, String player, Card card, Color color, int count) {
        return new GameEvent(sequence, type, player, card, color, count);
    }

    public long getSequence() {
        return sequence;
    }

    public GameEventType getType() {
        return type;
    }

    /**
     * @return the name of the seat the event concerns; null for table-wide events
     */
    public String getPlayer() {
        return player;
    }

    public Card getCard() {
        return card;
    }

    public Color getColor() {
        return color;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('#').append(sequence).append(' ').append(type);
        if (player != null) {
            sb.append(" player=").append(player);
        }
        if (card != null) {
            sb.append(" card=").append(card.shortName());
        }
        if (color != null) {
            sb.append(" color=").append(color);
        }
        if (count != 0) {
            sb.append(" count=").append(count);
        }
        return sb.toString();
    }
}
