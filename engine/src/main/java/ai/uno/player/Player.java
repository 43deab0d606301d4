package ai.uno.player;

import ai.uno.game.Hand;
import ai.uno.game.Move;
import ai.uno.game.TableView;

/**
 * Represents a decision-maker seated at the table, asked for a move once per turn.
 * <p>
 * Players decide from a read-only {@link TableView} and their own hand, neither of which they
 * can change. Automated players must answer in bounded time; the console player may block
 * on input.
 */
public interface Player {

    /**
     * Provide the move for the current turn.
     *
     * @param table what the seat can see: top discard, active colour, pending draw, seat sizes
     * @param hand  the hand of the seat being asked
     * @return the proposed move; never null
     */
    Move chooseMove(TableView table, Hand hand);

    /**
     * Whether this player challenges every Wild Draw Four played against it.
     * <p>
     * The engine consults this when the player sits next in turn order after a Wild Draw
     * Four; a player that returns {@code false} challenges only when the Wild Draw Four
     * move itself carried the challenge flag.
     *
     * @return {@code true} to always challenge
     */
    default boolean alwaysChallenges() {
        return false;
    }
}
