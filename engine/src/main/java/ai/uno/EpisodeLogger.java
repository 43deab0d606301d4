package ai.uno;

import ai.uno.game.GameState;
import ai.uno.game.Hand;
import ai.uno.game.event.GameEvent;
import ai.uno.game.event.GameEventListener;
import ai.uno.game.event.GameEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs for episode training data.
 *
 * <p>One {@code EPISODE_STEP} line is written per turn, after the turn has resolved: the seat
 * that acted, the events the turn produced, and the table afterwards (top card, active colour,
 * direction, pending draw, hand sizes). One {@code EPISODE_SUMMARY} line closes the game.
 * The prefixes let downstream tools filter the lines out of mixed logs.
 *
 * <p>Enabled with {@code -Dlog.episodes=true}.
 */
public class EpisodeLogger implements GameEventListener {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final GameState state;
    private final String solverId;
    private final List<String> turnEvents = new ArrayList<>();
    private String turnPlayer;
    private int turnNumber;

    public EpisodeLogger(GameState state, String solverId) {
        this.state = state;
        this.solverId = solverId;
    }

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    @Override
    public void onEvent(GameEvent event) {
        if (event.getType() == GameEventType.TURN_STARTED) {
            flushStep();
            turnPlayer = event.getPlayer();
            turnNumber = state.getTurn();
            return;
        }
        if (turnPlayer != null) {
            turnEvents.add(event.getType().name());
        }
        if (event.getType() == GameEventType.GAME_WON) {
            flushStep();
        }
    }

    /**
     * Writes the pending step line, if a turn has been recorded since the last one.
     */
    private void flushStep() {
        if (turnPlayer == null) {
            return;
        }
        Map<String, Object> step = new LinkedHashMap<>();
        step.put("type", "step");
        putGameIndex(step);
        step.put("solver", solverId);
        step.put("turn", turnNumber);
        step.put("player", turnPlayer);
        step.put("events", new ArrayList<>(turnEvents));
        step.put("top", state.getTopDiscard().shortName());
        step.put("active_color", String.valueOf(state.getActiveColor()));
        step.put("direction", state.getDirection());
        step.put("pending_draw", state.getPendingDraw());
        Map<String, Integer> handSizes = new LinkedHashMap<>();
        for (Hand hand : state.getHands()) {
            handSizes.put(hand.getOwner(), hand.size());
        }
        step.put("hand_sizes", handSizes);
        step.put("draw_pile", state.getDeck().drawPileSize());
        write("EPISODE_STEP", step);
        turnEvents.clear();
        turnPlayer = null;
    }

    /**
     * Emit a single structured JSON line summarising the whole game.
     */
    public void logSummary(long seed, long durationNanos) {
        flushStep();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "summary");
        putGameIndex(summary);
        summary.put("solver", solverId);
        summary.put("seed", seed);
        summary.put("turns", state.getTurn());
        summary.put("winner", state.getWinner() == null ? null : state.getWinner().getOwner());
        summary.put("reshuffles", state.getDeck().getReshuffleCount());
        summary.put("duration_nanos", durationNanos);
        write("EPISODE_SUMMARY", summary);
    }

    private static void putGameIndex(Map<String, Object> line) {
        String gameIndex = System.getProperty("game.index");
        String gameTotal = System.getProperty("game.total");
        if (gameIndex != null) {
            line.put("game_index", gameIndex);
        }
        if (gameTotal != null) {
            line.put("game_total", gameTotal);
        }
    }

    private static void write(String prefix, Map<String, Object> line) {
        try {
            if (log.isInfoEnabled()) {
                log.info("{} {}", prefix, OBJECT_MAPPER.writeValueAsString(line));
            }
        } catch (JsonProcessingException e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log {}", prefix, e);
            }
        }
    }
}
