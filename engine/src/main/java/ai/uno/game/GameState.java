package ai.uno.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complete state of one UNO game.
 * <p>
 * Tracks the seat whose turn it is, the direction of play, the active colour, the pending
 * forced draw accumulated by unanswered DRAW_TWO / WILD_DRAW_FOUR chains, the deck and every
 * seat's hand. Players see it only as a {@link TableView}; only the {@link TurnEngine} that
 * owns it mutates it, through the package-private methods below.
 * <p>
 * <strong>Seats:</strong> seat {@code i} holds {@code getHands().get(i)}. Direction {@code +1}
 * moves to higher seat indexes, {@code -1} to lower ones, wrapping around the table.
 */
public class GameState implements TableView {
    private final Deck deck;
    private final List<Hand> hands;
    private final boolean noMercy;

    private int currentIndex;
    private int direction = 1;
    /** Colour new plays must match; null until the opening discard is seeded. */
    private Color activeColor;
    private int pendingDraw;
    private int turn;
    private Hand winner;

    /**
     * Creates the state for a fresh game; the engine deals and seeds the discard pile.
     *
     * @param deck    the deck, shuffled and with nothing dealt
     * @param hands   one empty hand per seat, in seat order
     * @param noMercy whether matching drawn cards are auto-played
     */
    public GameState(Deck deck, List<Hand> hands, boolean noMercy) {
        this.deck = Objects.requireNonNull(deck, "deck");
        this.hands = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(hands, "hands")));
        this.noMercy = noMercy;
        if (this.hands.size() < 2) {
            throw new IllegalArgumentException("At least two seats are required, got " + this.hands.size());
        }
    }

    /**
     * Creates the state of a known position: the deck already has a top discard, the hands
     * are already dealt, and seat 0 is to act with no pending draw.
     *
     * @param deck        the deck with its discard pile seeded
     * @param hands       the dealt hands, in seat order
     * @param noMercy     whether matching drawn cards are auto-played
     * @param activeColor the colour in effect; must be one of {@link Color#STANDARD}
     */
    public GameState(Deck deck, List<Hand> hands, boolean noMercy, Color activeColor) {
        this(deck, hands, noMercy);
        setActiveColor(activeColor);
        deck.topDiscard(); // throws if the discard pile was never seeded
    }

    public Deck getDeck() {
        return deck;
    }

    public List<Hand> getHands() {
        return hands;
    }

    @Override
    public int getPlayerCount() {
        return hands.size();
    }

    public boolean isNoMercy() {
        return noMercy;
    }

    @Override
    public int getCurrentIndex() {
        return currentIndex;
    }

    /**
     * @return {@code +1} for ascending seat order, {@code -1} after an odd number of reverses
     */
    @Override
    public int getDirection() {
        return direction;
    }

    @Override
    public Color getActiveColor() {
        return activeColor;
    }

    @Override
    public int getPendingDraw() {
        return pendingDraw;
    }

    /**
     * @return the number of turns taken so far
     */
    @Override
    public int getTurn() {
        return turn;
    }

    /**
     * @return the winning hand, or null while the game is running
     */
    public Hand getWinner() {
        return winner;
    }

    public boolean isOver() {
        return winner != null;
    }

    @Override
    public Card getTopDiscard() {
        return deck.topDiscard();
    }

    @Override
    public int getDrawPileSize() {
        return deck.drawPileSize();
    }

    @Override
    public List<Integer> getHandSizes() {
        List<Integer> sizes = new ArrayList<>(hands.size());
        for (Hand hand : hands) {
            sizes.add(hand.size());
        }
        return Collections.unmodifiableList(sizes);
    }

    public Hand current() {
        return hands.get(currentIndex);
    }

    /**
     * @return the seat index one step after the current seat in the current direction
     */
    public int nextIndex() {
        return Math.floorMod(currentIndex + direction, hands.size());
    }

    public Hand next() {
        return hands.get(nextIndex());
    }

    void advanceTurn(int steps) {
        currentIndex = Math.floorMod(currentIndex + steps * direction, hands.size());
    }

    void reverse() {
        direction = -direction;
    }

    void setActiveColor(Color color) {
        Objects.requireNonNull(color, "color");
        if (!color.isStandard()) {
            throw new IllegalArgumentException("Active colour must be a standard colour, got " + color);
        }
        this.activeColor = color;
    }

    void addPendingDraw(int amount) {
        pendingDraw += amount;
    }

    void clearPendingDraw() {
        pendingDraw = 0;
    }

    void incrementTurn() {
        turn++;
    }

    void setWinner(Hand winner) {
        this.winner = winner;
    }

    /**
     * Counts every card in the draw pile, the discard pile and all hands. Always
     * {@link Deck#SIZE} for a game built from a standard deck.
     *
     * @return total cards in play
     */
    public int totalCards() {
        int total = deck.drawPileSize() + deck.discardPileSize();
        for (Hand hand : hands) {
            total += hand.size();
        }
        return total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Top: ").append(deck.discardPileSize() == 0 ? "-" : deck.topDiscard().shortName());
        sb.append(" | Active colour: ").append(activeColor);
        sb.append(" | Direction: ").append(direction > 0 ? "+1" : "-1");
        if (pendingDraw > 0) {
            sb.append(" | Pending draw: ").append(pendingDraw);
        }
        for (int i = 0; i < hands.size(); i++) {
            Hand hand = hands.get(i);
            sb.append('\n').append(i == currentIndex ? "> " : "  ")
                    .append(hand.getOwner()).append(": ").append(hand.size()).append(" cards");
        }
        return sb.toString();
    }
}
