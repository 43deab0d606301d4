package ai.uno.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The cards held by one seat at the table.
 * <p>
 * Card order is display order only. Hands grow on draws and shrink on plays; the game ends
 * when any hand becomes empty. Only the {@link TurnEngine} mutates a hand, through its
 * package-private methods; players see it through the query methods and {@link #getCards()}.
 */
public class Hand {
    private final String owner;
    private final List<Card> cards = new ArrayList<>();

    public Hand(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /**
     * Creates a hand already holding the given cards, e.g. to resume a known position.
     *
     * @param owner display name of the seat
     * @param cards the initial cards, in display order
     */
    public Hand(String owner, List<Card> cards) {
        this(owner);
        this.cards.addAll(Objects.requireNonNull(cards, "cards"));
    }

    public String getOwner() {
        return owner;
    }

    /**
     * Draws up to {@code count} cards from the deck into this hand.
     * <p>
     * Stops silently when the deck cannot supply a card.
     *
     * @param deck  the deck to draw from
     * @param count the number of cards requested
     * @return the number of cards actually drawn
     */
    int draw(Deck deck, int count) {
        int drawn = 0;
        for (int i = 0; i < count; i++) {
            Card card = deck.draw();
            if (card == null) {
                break;
            }
            cards.add(card);
            drawn++;
        }
        return drawn;
    }

    void add(Card card) {
        cards.add(Objects.requireNonNull(card, "card"));
    }

    boolean remove(Card card) {
        return cards.remove(card);
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Checks whether any card in the hand may legally be played.
     *
     * @param top         the top of the discard pile
     * @param activeColor the colour currently in effect
     * @return {@code true} if at least one card matches
     */
    public boolean hasPlayable(Card top, Color activeColor) {
        for (Card card : cards) {
            if (card.matches(top, activeColor)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts the cards printed in the given colour.
     *
     * @param color the colour to count
     * @return the number of matching cards
     */
    public int countColor(Color color) {
        int count = 0;
        for (Card card : cards) {
            if (card.getColor() == color) {
                count++;
            }
        }
        return count;
    }

    /**
     * Checks whether the hand holds a non-wild card of the given colour. This is the test
     * that decides whether a Wild Draw Four was played illegally.
     *
     * @param color the colour to look for
     * @return {@code true} if a coloured card of that colour is held
     */
    public boolean hasNonWildColor(Color color) {
        for (Card card : cards) {
            if (!card.isWild() && card.getColor() == color) {
                return true;
            }
        }
        return false;
    }

    /**
     * Picks the standard colour held most often. Ties go to the earliest colour in
     * {@link Color#STANDARD} order, so an all-wild hand picks {@link Color#RED}.
     *
     * @return the most-held colour
     */
    public Color mostHeldColor() {
        Color best = Color.STANDARD.get(0);
        int bestCount = -1;
        for (Color color : Color.STANDARD) {
            int count = countColor(color);
            if (count > bestCount) {
                best = color;
                bestCount = count;
            }
        }
        return best;
    }

    /**
     * @return an unmodifiable view of the cards in display order
     */
    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return owner + cards;
    }
}
