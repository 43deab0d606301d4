package ai.uno.player.ai;

import ai.uno.game.Card;
import ai.uno.game.Hand;
import ai.uno.game.Move;
import ai.uno.game.TableView;
import ai.uno.player.AIPlayer;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Baseline policy: stack when possible under a pending draw, otherwise play the first
 * matching card in hand order, otherwise draw. Never invites a challenge.
 */
@Component
public class SimpleRuleBasedPlayer extends AIPlayer {

    @Override
    public String getPolicyName() {
        return "simple";
    }

    @Override
    public Move chooseMove(TableView table, Hand hand) {
        if (table.getPendingDraw() > 0) {
            Card stack = stackCard(table, hand);
            return stack != null ? playWithColor(stack, hand, false) : Move.draw();
        }
        List<Card> playable = playableCards(table, hand);
        if (playable.isEmpty()) {
            return Move.draw();
        }
        return playWithColor(playable.get(0), hand, false);
    }
}
