package ai.uno.unit.helpers;

import ai.uno.game.Card;
import ai.uno.game.GameState;
import ai.uno.game.Move;
import ai.uno.game.TurnEngine;
import java.util.List;

/**
 * Canned positions shared by the player tests.
 */
public final class Positions {

    private Positions() {
    }

    /**
     * Seat A opens with RED DRAW_TWO on RED 5, leaving seat B (holding {@code cards}) to act
     * under a pending draw of 2.
     */
    public static GameState facingDrawTwo(String... cards) {
        GameState state = TableBuilder.newTable()
                .top("RED 5")
                .hand("A", "RED DRAW_TWO", "GREEN 7")
                .hand("B", cards)
                .build();
        new TurnEngine(state, List.of(ScriptedPlayer.of(Move.play(Card.parse("RED DRAW_TWO"))), ScriptedPlayer.of()))
                .playTurn();
        return state;
    }

    /** Seat A to act on RED 5 holding {@code cards}; seat B holds a single BLUE 1. */
    public static GameState onRedFive(String... cards) {
        return TableBuilder.newTable()
                .top("RED 5")
                .hand("A", cards)
                .hand("B", "BLUE 1")
                .build();
    }
}
