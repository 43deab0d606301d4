package ai.uno.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.uno.game.Card;
import ai.uno.game.Deck;
import ai.uno.game.GameState;
import ai.uno.game.Hand;
import ai.uno.game.TurnEngine;
import ai.uno.player.AIPlayer;
import ai.uno.player.Player;
import ai.uno.player.ai.AggressivePlayer;
import ai.uno.player.ai.SimpleRuleBasedPlayer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Plays seeded automated games and checks the table after every turn: the 108 cards are all
 * accounted for, the active colour is a standard one and the pending draw never goes negative.
 */
class ConservationTest {
    private static final int MAX_TURNS = 3000;
    private static final int SEEDS = 5;

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5})
    void aggressiveTablesConserveTheDeck(int players) {
        int wins = playAll(new AggressivePlayer(), players);
        assertTrue(wins > 0, "at least one seeded game should finish");
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5})
    void simpleTablesConserveTheDeck(int players) {
        int wins = playAll(new SimpleRuleBasedPlayer(), players);
        assertTrue(wins > 0, "at least one seeded game should finish");
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void sameSeedReplaysTheSameGame(boolean noMercy) {
        GameState first = play(new AggressivePlayer(), 3, 42L, noMercy);
        GameState second = play(new AggressivePlayer(), 3, 42L, noMercy);

        assertEquals(first.getTurn(), second.getTurn());
        assertEquals(first.getTopDiscard(), second.getTopDiscard());
        assertEquals(first.getDeck().getDrawPile(), second.getDeck().getDrawPile());
    }

    private int playAll(AIPlayer policy, int players) {
        int wins = 0;
        for (long seed = 1; seed <= SEEDS; seed++) {
            GameState state = play(policy, players, seed * 7919, true);
            if (state.isOver()) {
                wins++;
                assertTrue(state.getWinner().isEmpty());
            }
        }
        return wins;
    }

    private GameState play(AIPlayer policy, int players, long seed, boolean noMercy) {
        List<Hand> hands = new ArrayList<>();
        for (int i = 0; i < players; i++) {
            hands.add(new Hand("AI-" + (i + 1)));
        }
        GameState state = new GameState(new Deck(new Random(seed)), hands, noMercy);
        List<Player> seats = new ArrayList<>(Collections.nCopies(players, policy));
        TurnEngine engine = new TurnEngine(state, seats);
        engine.start();
        assertInvariants(state, seed);

        while (!state.isOver() && state.getTurn() < MAX_TURNS) {
            engine.playTurn();
            assertInvariants(state, seed);
        }
        return state;
    }

    private static void assertInvariants(GameState state, long seed) {
        String where = "seed " + seed + " turn " + state.getTurn();
        assertEquals(standardCounts(), countCards(state), where);
        assertTrue(state.getActiveColor().isStandard(), where);
        assertTrue(state.getPendingDraw() >= 0, where);
        assertTrue(state.getCurrentIndex() >= 0 && state.getCurrentIndex() < state.getPlayerCount(), where);
        assertTrue(Math.abs(state.getDirection()) == 1, where);
    }

    private static Map<Card, Integer> standardCounts() {
        return count(Deck.standardCards());
    }

    private static Map<Card, Integer> countCards(GameState state) {
        List<Card> all = new ArrayList<>(state.getDeck().getDrawPile());
        all.addAll(state.getDeck().getDiscardPile());
        for (Hand hand : state.getHands()) {
            all.addAll(hand.getCards());
        }
        return count(all);
    }

    private static Map<Card, Integer> count(List<Card> cards) {
        Map<Card, Integer> counts = new HashMap<>();
        for (Card card : cards) {
            counts.merge(card, 1, Integer::sum);
        }
        return counts;
    }
}
