package ai.uno.player;

import ai.uno.game.Card;
import ai.uno.game.Color;
import ai.uno.game.Hand;
import ai.uno.game.Move;
import ai.uno.game.TableView;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for automated players with helper methods for rule evaluation.
 * <p>
 * Automated players always challenge a Wild Draw Four played against them, and they are
 * stateless: everything they need comes from the table view and hand passed to
 * {@link #chooseMove(TableView, Hand)}, so one instance can serve several seats.
 */
public abstract class AIPlayer implements Player {

    /**
     * Short name used to select this policy in configuration (e.g. "aggressive").
     *
     * @return the policy name
     */
    public abstract String getPolicyName();

    @Override
    public boolean alwaysChallenges() {
        return true;
    }

    protected List<Card> playableCards(TableView table, Hand hand) {
        Card top = table.getTopDiscard();
        List<Card> playable = new ArrayList<>();
        for (Card card : hand.getCards()) {
            if (card.matches(top, table.getActiveColor())) {
                playable.add(card);
            }
        }
        return playable;
    }

    /**
     * Finds the first held card that can answer a pending draw and is legal on the current top.
     *
     * @return the stacking card, or null if the seat has to draw
     */
    protected Card stackCard(TableView table, Hand hand) {
        for (Card card : playableCards(table, hand)) {
            if (card.getRank().isDrawPenalty()) {
                return card;
            }
        }
        return null;
    }

    /**
     * Builds a play move, naming the hand's most-held colour if the card is wild.
     */
    protected Move playWithColor(Card card, Hand hand, boolean challenge) {
        Color chosen = card.isWild() ? hand.mostHeldColor() : null;
        return Move.play(card, chosen, challenge);
    }
}
