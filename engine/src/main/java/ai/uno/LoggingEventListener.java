package ai.uno;

import ai.uno.game.GameState;
import ai.uno.game.Hand;
import ai.uno.game.event.GameEvent;
import ai.uno.game.event.GameEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders engine events as human-readable log lines: the table commentary of the CLI.
 */
public class LoggingEventListener implements GameEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    private final GameState state;

    public LoggingEventListener(GameState state) {
        this.state = state;
    }

    @Override
    public void onEvent(GameEvent event) {
        if (!log.isInfoEnabled()) {
            return;
        }
        String player = event.getPlayer();
        switch (event.getType()) {
            case GAME_STARTED:
                log.info("Starting card: {} | Active color: {}", event.getCard(), event.getColor());
                break;
            case START_CARD_EFFECT:
                log.info("Start card is {} - its effect applies before the first turn.", event.getCard());
                break;
            case TURN_STARTED:
                log.info("");
                log.info("--- {}'s turn ---", player);
                for (Hand hand : state.getHands()) {
                    if (!hand.getOwner().equals(player)) {
                        log.info("{} has {} cards.", hand.getOwner(), hand.size());
                    }
                }
                break;
            case CARD_PLAYED:
                if (event.getCard().isWild()) {
                    log.info("{} plays: {} -> color set to {}", player, event.getCard(), event.getColor());
                } else {
                    log.info("{} plays: {}", player, event.getCard());
                }
                break;
            case LAST_CARD:
                log.info("{} says UNO!", player);
                break;
            case CARD_DRAWN:
                log.info("{} draws a card.", player);
                break;
            case AUTO_PLAYED:
                log.info("{} auto-plays drawn card: {}", player, event.getCard());
                break;
            case PENDING_DRAW_INCREASED:
                log.info("Pending draw increased to {}.", event.getCount());
                break;
            case PENDING_DRAW_ABSORBED:
                log.info("{} draws {} (no stack).", player, event.getCount());
                break;
            case SKIPPED:
                log.info("{} is skipped.", player);
                break;
            case DIRECTION_REVERSED:
                log.info("Direction reversed.");
                break;
            case CHALLENGE_RAISED:
                log.info("{} challenges the WILD DRAW FOUR!", player);
                break;
            case CHALLENGE_SUCCEEDED:
                log.info("Challenge successful - {} draws {}.", player, event.getCount());
                break;
            case CHALLENGE_FAILED:
                log.info("Challenge failed - {} draws {}.", player, event.getCount());
                break;
            case INVALID_MOVE:
                log.info("Invalid move. {} draws one as penalty.", player);
                break;
            case TURN_FORFEITED:
                log.info("{} cannot play {}. Turn forfeited.", player, event.getCard());
                break;
            case DRAW_EXHAUSTED:
                log.info("The deck is out of cards; {} is {} short.", player, event.getCount());
                break;
            case GAME_WON:
                log.info("");
                log.info("{} wins!", player);
                break;
            default:
                break;
        }
    }
}
