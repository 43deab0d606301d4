package ai.uno.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.uno.game.Card;
import ai.uno.game.Color;
import ai.uno.game.Deck;
import ai.uno.game.Rank;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Card value semantics and the matching predicate.
 *
 * <p>The exhaustive test walks every distinct candidate, every distinct top card and every
 * active colour (54 x 54 x 4 combinations) and checks the three matching conditions.
 */
class CardMatchingTest {

    private static List<Card> distinctCards() {
        return new ArrayList<>(new LinkedHashSet<>(Deck.standardCards()));
    }

    @Test
    void matchesHoldsExactlyWhenOneOfTheThreeConditionsHolds() {
        List<Card> cards = distinctCards();
        assertEquals(54, cards.size());
        for (Card candidate : cards) {
            for (Card top : cards) {
                for (Color active : Color.STANDARD) {
                    boolean wildCandidate = candidate.getRank().isWild();
                    boolean onWildTop = !wildCandidate && top.getRank().isWild()
                            && (candidate.getColor() == active || candidate.getRank() == top.getRank());
                    boolean onColouredTop = !wildCandidate && !top.getRank().isWild()
                            && (candidate.getColor() == top.getColor() || candidate.getRank() == top.getRank());
                    assertEquals(wildCandidate || onWildTop || onColouredTop, candidate.matches(top, active),
                            candidate + " on " + top + " with active " + active);
                }
            }
        }
    }

    @Test
    void colouredTopIgnoresActiveColour() {
        Card top = Card.parse("RED 5");
        assertTrue(Card.parse("RED 9").matches(top, Color.BLUE));
        assertFalse(Card.parse("BLUE 9").matches(top, Color.BLUE));
        assertTrue(Card.parse("GREEN 5").matches(top, Color.BLUE));
    }

    @Test
    void wildTopUsesActiveColour() {
        Card top = Card.wild(Rank.WILD);
        assertTrue(Card.parse("BLUE 2").matches(top, Color.BLUE));
        assertFalse(Card.parse("RED 2").matches(top, Color.BLUE));
        assertTrue(Card.wild(Rank.WILD_DRAW_FOUR).matches(top, Color.BLUE));
    }

    @Test
    void actionRankMatchesAcrossColours() {
        assertTrue(Card.parse("YELLOW SKIP").matches(Card.parse("GREEN SKIP"), Color.GREEN));
        assertTrue(Card.parse("YELLOW DRAW_TWO").matches(Card.parse("BLUE DRAW_TWO"), Color.BLUE));
        assertFalse(Card.parse("YELLOW REVERSE").matches(Card.parse("BLUE SKIP"), Color.BLUE));
    }

    @Test
    void rankFamiliesComeFromTheRank() {
        for (Rank rank : Rank.values()) {
            int families = (rank.isNumber() ? 1 : 0) + (rank.isAction() ? 1 : 0) + (rank.isWild() ? 1 : 0);
            assertEquals(1, families, rank.name());
        }
        assertTrue(Rank.ZERO.isNumber());
        assertTrue(Rank.NINE.isNumber());
        assertTrue(Rank.REVERSE.isAction());
        assertTrue(Rank.WILD_DRAW_FOUR.isWild());
        assertTrue(Rank.DRAW_TWO.isDrawPenalty());
        assertTrue(Rank.WILD_DRAW_FOUR.isDrawPenalty());
        assertFalse(Rank.WILD.isDrawPenalty());
    }

    @Test
    void cardsAreEqualByValue() {
        assertEquals(new Card(Color.RED, Rank.FIVE), Card.parse("red 5"));
        assertEquals(new Card(Color.RED, Rank.FIVE).hashCode(), Card.parse("RED 5").hashCode());
        assertEquals(Card.wild(Rank.WILD_DRAW_FOUR), Card.parse("WILD_DRAW_FOUR"));
        assertEquals("WILD_DRAW_FOUR", Card.wild(Rank.WILD_DRAW_FOUR).shortName());
        assertEquals("BLUE SKIP", Card.parse("blue skip").shortName());
    }

    @Test
    void invalidCardsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Card(Color.WILD, Rank.FIVE));
        assertThrows(IllegalArgumentException.class, () -> new Card(Color.RED, Rank.WILD));
        assertThrows(NullPointerException.class, () -> new Card(null, Rank.FIVE));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("PURPLE 5"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("RED ELEVEN"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse(" "));
    }
}
