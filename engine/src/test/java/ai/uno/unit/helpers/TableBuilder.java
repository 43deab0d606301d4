package ai.uno.unit.helpers;

import ai.uno.game.Card;
import ai.uno.game.Color;
import ai.uno.game.Deck;
import ai.uno.game.GameState;
import ai.uno.game.Hand;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fluent builder for constructing known UNO positions for tests.
 *
 * <p><strong>How to use</strong>
 * <pre>{@code
 * GameState state = TableBuilder
 *     .newTable()
 *     .top("RED 5")
 *     .hand("A", "RED DRAW_TWO", "GREEN 7")
 *     .hand("B", "BLUE 3")
 *     .drawPile("GREEN 1", "GREEN 2")
 *     .build();
 * }
 * </pre>
 *
 * <p><strong>Conventions</strong>
 * <ul>
 *   <li>Seat 0 acts first, direction +1, no pending draw.</li>
 *   <li>The active colour defaults to the top card's colour; a wild top needs {@link #activeColor(Color)}.</li>
 *   <li>{@link #drawPile(String...)} and {@link #discardUnder(String...)} list cards front first:
 *       the next card drawn, and the card just beneath the top.</li>
 *   <li>Unless {@link #exactDrawPile()} is called, every card of the standard deck not placed
 *       elsewhere is appended to the draw pile in {@link Deck#standardCards()} order, so the
 *       position holds exactly 108 cards. Placing more copies of a card than the deck has fails.</li>
 * </ul>
 */
public final class TableBuilder {
    private final List<String> names = new ArrayList<>();
    private final List<List<Card>> hands = new ArrayList<>();
    private final List<Card> drawPile = new ArrayList<>();
    private final List<Card> discardUnder = new ArrayList<>();
    private Card top;
    private Color activeColor;
    private boolean noMercy = true;
    private boolean exactDrawPile;
    private long seed = 1L;

    private TableBuilder() {
    }

    public static TableBuilder newTable() {
        return new TableBuilder();
    }

    public TableBuilder top(String card) {
        this.top = Card.parse(card);
        return this;
    }

    public TableBuilder activeColor(Color color) {
        this.activeColor = color;
        return this;
    }

    public TableBuilder discardUnder(String... cards) {
        for (String card : cards) {
            discardUnder.add(Card.parse(card));
        }
        return this;
    }

    public TableBuilder hand(String owner, String... cards) {
        List<Card> parsed = new ArrayList<>();
        for (String card : cards) {
            parsed.add(Card.parse(card));
        }
        names.add(owner);
        hands.add(parsed);
        return this;
    }

    public TableBuilder drawPile(String... cards) {
        for (String card : cards) {
            drawPile.add(Card.parse(card));
        }
        return this;
    }

    /** Uses only the cards given to {@link #drawPile(String...)}; the position is partial. */
    public TableBuilder exactDrawPile() {
        this.exactDrawPile = true;
        return this;
    }

    public TableBuilder noMercy(boolean noMercy) {
        this.noMercy = noMercy;
        return this;
    }

    public TableBuilder seed(long seed) {
        this.seed = seed;
        return this;
    }

    public GameState build() {
        if (top == null) {
            throw new IllegalStateException("A top card is required");
        }
        Color color = activeColor != null ? activeColor : top.getColor();
        if (!color.isStandard()) {
            throw new IllegalStateException("A wild top card needs an explicit active colour");
        }

        List<Card> draw = new ArrayList<>(drawPile);
        if (!exactDrawPile) {
            List<Card> remaining = Deck.standardCards();
            List<Card> placed = new ArrayList<>(drawPile);
            placed.add(top);
            placed.addAll(discardUnder);
            hands.forEach(placed::addAll);
            for (Card card : placed) {
                if (!remaining.remove(card)) {
                    throw new IllegalStateException("More copies of " + card + " than a standard deck holds");
                }
            }
            draw.addAll(remaining);
        }

        Deck deck = new Deck(draw, new Random(seed));
        for (int i = discardUnder.size() - 1; i >= 0; i--) {
            deck.discard(discardUnder.get(i));
        }
        deck.discard(top);

        List<Hand> seated = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            seated.add(new Hand(names.get(i), hands.get(i)));
        }
        return new GameState(deck, seated, noMercy, color);
    }
}
