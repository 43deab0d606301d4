package ai.uno.player.ai;

import ai.uno.game.Card;
import ai.uno.game.Hand;
import ai.uno.game.Move;
import ai.uno.game.Rank;
import ai.uno.game.TableView;
import ai.uno.player.AIPlayer;
import org.springframework.stereotype.Component;

/**
 * Aggressive heuristics. Rules:
 * 1) With a pending draw, stack the first legal DRAW_TWO or WILD_DRAW_FOUR; otherwise take the draw.
 * 2) Play a WILD_DRAW_FOUR straight away when it is legal (no card of the active colour held),
 *    inviting the challenge.
 * 3) Otherwise play the first matching SKIP, REVERSE or DRAW_TWO.
 * 4) Otherwise play the first matching card, keeping an illegal WILD_DRAW_FOUR as a last resort.
 * 5) Otherwise draw.
 * Wilds always name the most-held colour.
 */
@Component
public class AggressivePlayer extends AIPlayer {

    @Override
    public String getPolicyName() {
        return "aggressive";
    }

    @Override
    public Move chooseMove(TableView table, Hand hand) {
        if (table.getPendingDraw() > 0) {
            Card stack = stackCard(table, hand);
            if (stack != null) {
                return playWithColor(stack, hand, true);
            }
            return Move.draw();
        }

        Card best = null;
        Card bluff = null;
        for (Card card : playableCards(table, hand)) {
            if (card.getRank() == Rank.WILD_DRAW_FOUR) {
                if (!hand.hasNonWildColor(table.getActiveColor())) {
                    return playWithColor(card, hand, true);
                }
                if (bluff == null) {
                    bluff = card;
                }
                continue;
            }
            if (card.getRank().isAction()) {
                return Move.play(card);
            }
            if (best == null) {
                best = card;
            }
        }
        if (best != null) {
            return playWithColor(best, hand, false);
        }
        if (bluff != null) {
            return playWithColor(bluff, hand, false);
        }
        return Move.draw();
    }
}
