package ai.uno.game;

import java.util.List;

/**
 * Read-only view of the table handed to players when they are asked for a move.
 * <p>
 * It exposes what a seat at a real table can see: the top discard, the active colour, the
 * pending forced draw, whose turn it is and how many cards everyone holds. The deck is not
 * reachable through it, and {@link Hand} has no public mutators, so a player cannot change
 * the game while deciding.
 */
public interface TableView {

    Card getTopDiscard();

    /**
     * @return the colour a card must match when the top card is wild; set by the opening
     *         card and by every wild played since
     */
    Color getActiveColor();

    int getPendingDraw();

    int getPlayerCount();

    int getCurrentIndex();

    /**
     * @return {@code +1} for ascending seat order, {@code -1} after an odd number of reverses
     */
    int getDirection();

    int getTurn();

    int getDrawPileSize();

    /**
     * @return the number of cards each seat holds, in seat order
     */
    List<Integer> getHandSizes();
}
