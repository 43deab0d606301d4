package ai.uno.unit.helpers;

import static org.junit.jupiter.api.Assertions.*;

import ai.uno.game.Card;
import ai.uno.game.Color;
import ai.uno.game.Deck;
import ai.uno.game.GameState;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableBuilderTest {

    @Test
    void buildsACompleteDeckAroundThePlacedCards() {
        GameState state = TableBuilder.newTable()
                .top("RED 5")
                .discardUnder("GREEN 5", "GREEN 2")
                .hand("A", "RED 7")
                .hand("B", "BLUE 3", "WILD")
                .drawPile("YELLOW 1")
                .build();

        assertEquals(Deck.SIZE, state.totalCards());
        assertEquals(Card.parse("RED 5"), state.getTopDiscard());
        assertEquals(Card.parse("GREEN 5"), state.getDeck().getDiscardPile().get(1));
        assertEquals(Card.parse("YELLOW 1"), state.getDeck().getDrawPile().get(0));
        assertEquals(Color.RED, state.getActiveColor());
        assertEquals("A", state.current().getOwner());
        assertEquals(0, state.getPendingDraw());
        assertEquals(List.of(1, 2), state.getHandSizes());
        assertEquals(Deck.SIZE - 6, state.getDrawPileSize());
    }

    @Test
    void exactDrawPileLeavesAPartialPosition() {
        GameState state = TableBuilder.newTable()
                .top("WILD")
                .activeColor(Color.GREEN)
                .hand("A", "RED 7")
                .hand("B", "BLUE 3")
                .exactDrawPile()
                .build();

        assertEquals(0, state.getDeck().drawPileSize());
        assertEquals(3, state.totalCards());
        assertEquals(Color.GREEN, state.getActiveColor());
    }

    @Test
    void rejectsImpossiblePositions() {
        assertThrows(IllegalStateException.class, () -> TableBuilder.newTable()
                .top("RED 0")
                .hand("A", "RED 0")
                .hand("B", "BLUE 3")
                .build());
        assertThrows(IllegalStateException.class, () -> TableBuilder.newTable()
                .top("WILD")
                .hand("A", "RED 1")
                .hand("B", "BLUE 3")
                .build());
    }
}
