package ai.uno.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The draw pile and discard pile of a 108-card UNO deck.
 * <p>
 * Both piles are ordered front first: index 0 of the draw pile is the next card drawn and
 * index 0 of the discard pile is the current top card. When the draw pile runs out, every
 * discard except the top card is shuffled back into it (see {@link #reshuffleFromDiscard()}),
 * so the top card stays stable across any draw.
 * <p>
 * All shuffling goes through the injected {@link Random}, which makes seeded games
 * reproducible.
 */
public class Deck {
    private static final Logger log = LoggerFactory.getLogger(Deck.class);

    /** Total number of cards in a standard deck. */
    public static final int SIZE = 108;

    /** Cards available to draw; index 0 is drawn next. */
    private final List<Card> drawPile = new ArrayList<>();
    /** Played cards; index 0 is the top card. */
    private final List<Card> discardPile = new ArrayList<>();
    private final Random random;
    private int reshuffleCount;

    /**
     * Constructs a standard 108-card deck and shuffles it.
     *
     * @param random source of randomness for this and all later shuffles
     */
    public Deck(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        drawPile.addAll(standardCards());
        Collections.shuffle(drawPile, random);
    }

    /**
     * Constructs a deck whose draw pile is exactly {@code drawOrder}, front first, unshuffled.
     * <p>
     * Useful for replaying a known deal. The random source is still used for reshuffles.
     *
     * @param drawOrder cards in the order they will be drawn
     * @param random    source of randomness for reshuffles
     */
    public Deck(List<Card> drawOrder, Random random) {
        this.random = Objects.requireNonNull(random, "random");
        drawPile.addAll(Objects.requireNonNull(drawOrder, "drawOrder"));
    }

    /**
     * Returns the standard composition, unshuffled: per colour one 0 and two each of 1 to 9,
     * SKIP, REVERSE and DRAW_TWO, followed by four WILD and four WILD_DRAW_FOUR cards.
     *
     * @return a new mutable list of 108 cards
     */
    public static List<Card> standardCards() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (Color color : Color.STANDARD) {
            cards.add(new Card(color, Rank.ZERO));
            for (int copy = 0; copy < 2; copy++) {
                for (Rank rank : Rank.values()) {
                    if (rank != Rank.ZERO && !rank.isWild()) {
                        cards.add(new Card(color, rank));
                    }
                }
            }
        }
        for (int i = 0; i < 4; i++) {
            cards.add(Card.wild(Rank.WILD));
            cards.add(Card.wild(Rank.WILD_DRAW_FOUR));
        }
        return cards;
    }

    /**
     * Draws the next card, recycling the discard pile first if the draw pile is empty.
     *
     * @return the drawn card, or {@code null} if no card is available even after a reshuffle
     */
    public Card draw() {
        if (drawPile.isEmpty()) {
            reshuffleFromDiscard();
        }
        if (drawPile.isEmpty()) {
            return null;
        }
        return drawPile.remove(0);
    }

    /**
     * Places a card on top of the discard pile.
     *
     * @param card the played card
     */
    public void discard(Card card) {
        discardPile.add(0, Objects.requireNonNull(card, "card"));
    }

    /**
     * Returns the top of the discard pile without removing it.
     *
     * @return the top card
     * @throws IllegalStateException if nothing has been discarded yet
     */
    public Card topDiscard() {
        if (discardPile.isEmpty()) {
            throw new IllegalStateException("Discard pile is empty; the starting card was never seeded");
        }
        return discardPile.get(0);
    }

    /**
     * Draws and discards until the top card is not wild, establishing the opening discard.
     * A wild cannot open the game because no active colour exists yet.
     *
     * @return the opening card
     * @throws IllegalStateException if the deck runs out before a non-wild card turns up
     */
    public Card startDiscardNonWild() {
        while (true) {
            Card card = draw();
            if (card == null) {
                throw new IllegalStateException("Deck exhausted before a non-wild starting card was found");
            }
            discard(card);
            if (!card.isWild()) {
                return card;
            }
        }
    }

    /**
     * Shuffles every discard except the top card into the draw pile.
     * <p>
     * The top card remains the sole member of the discard pile. Does nothing when the
     * discard pile is empty.
     */
    public void reshuffleFromDiscard() {
        if (discardPile.isEmpty()) {
            return;
        }
        Card top = discardPile.remove(0);
        List<Card> rest = new ArrayList<>(discardPile);
        discardPile.clear();
        Collections.shuffle(rest, random);
        drawPile.addAll(rest);
        discardPile.add(top);
        reshuffleCount++;
        if (log.isDebugEnabled()) {
            log.debug("Reshuffled {} discards into the draw pile; {} stays on top", rest.size(), top);
        }
    }

    public int drawPileSize() {
        return drawPile.size();
    }

    public int discardPileSize() {
        return discardPile.size();
    }

    /**
     * Returns how many times the discard pile has been recycled.
     *
     * @return the reshuffle count
     */
    public int getReshuffleCount() {
        return reshuffleCount;
    }

    /**
     * @return an unmodifiable view of the draw pile, next card first
     */
    public List<Card> getDrawPile() {
        return Collections.unmodifiableList(drawPile);
    }

    /**
     * @return an unmodifiable view of the discard pile, top card first
     */
    public List<Card> getDiscardPile() {
        return Collections.unmodifiableList(discardPile);
    }

    @Override
    public String toString() {
        return "Deck(draw=" + drawPile.size() + ", discard=" + discardPile.size() + ")";
    }
}
