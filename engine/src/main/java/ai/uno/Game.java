package ai.uno;

import ai.uno.config.RulesProperties;
import ai.uno.config.TableProperties;
import ai.uno.game.Deck;
import ai.uno.game.GameState;
import ai.uno.game.Hand;
import ai.uno.game.TurnEngine;
import ai.uno.player.AIPlayer;
import ai.uno.player.HumanPlayer;
import ai.uno.player.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final TableProperties table;
    private final RulesProperties rules;
    private final HumanPlayer human;
    private final List<AIPlayer> policies;

    @Autowired
    public Game(TableProperties table, RulesProperties rules, ObjectProvider<HumanPlayer> human,
            List<AIPlayer> policies) {
        this(table, rules, policies, human.getIfAvailable());
    }

    /**
     * Creates a runner without Spring. {@code human} may be null for an all-AI table.
     */
    public Game(TableProperties table, RulesProperties rules, List<AIPlayer> policies, HumanPlayer human) {
        this.table = table;
        this.rules = rules;
        this.human = human;
        this.policies = policies;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint only reports the result; tests call play() directly.
        GameResult result = play();
        if (result.getWinner() == null) {
            log.info("Game over without a winner after {} turns.", result.getTurns());
        } else {
            log.info("Game over. {} won in {} turns.", result.getWinner(), result.getTurns());
        }
    }

    /**
     * Seats the players, deals a fresh deck and plays one game to the end.
     *
     * <p>Seat 0 is "You" when the {@code uno-human} profile supplies a {@link HumanPlayer};
     * every other seat is an automated player named {@code AI-1}, {@code AI-2}, ... using the
     * configured policy. The game stops at the first win, at {@code table.max-turns}, or when
     * the console input closes.
     *
     * @return the winner (if any), turns taken, seed and duration
     * @throws IllegalArgumentException if fewer than two seats or an unknown policy is configured
     */
    public GameResult play() {
        if (table.getPlayers() < 2) {
            throw new IllegalArgumentException("table.players must be at least 2, got " + table.getPlayers());
        }
        long seed = table.getSeed() != null ? table.getSeed() : System.nanoTime();
        AIPlayer policy = selectPolicy(table.getAiPolicy());

        List<Hand> hands = new ArrayList<>();
        List<Player> seats = new ArrayList<>();
        if (human != null) {
            hands.add(new Hand("You"));
            seats.add(human);
        }
        int aiNumber = 1;
        while (hands.size() < table.getPlayers()) {
            hands.add(new Hand("AI-" + aiNumber++));
            seats.add(policy);
        }

        GameState state = new GameState(new Deck(new Random(seed)), hands, rules.isNoMercy());
        TurnEngine engine = new TurnEngine(state, seats);
        engine.addListener(new LoggingEventListener(state));
        EpisodeLogger episodeLogger = null;
        if (EpisodeLogger.isEnabled()) {
            episodeLogger = new EpisodeLogger(state, policy.getPolicyName());
            engine.addListener(episodeLogger);
        }

        if (log.isInfoEnabled()) {
            log.info("UNO - No Mercy Edition{}", rules.isNoMercy() ? "" : " (no-mercy off)");
            List<String> names = new ArrayList<>();
            for (Hand hand : hands) {
                names.add(hand.getOwner());
            }
            log.info("Players: {}", names);
        }
        if (log.isDebugEnabled()) {
            log.debug("Seed {} policy {}", seed, policy.getPolicyName());
        }

        long startNanos = System.nanoTime();
        engine.start();
        try {
            engine.run(table.getMaxTurns());
        } catch (NoSuchElementException e) {
            log.info("Input closed. Exiting: {}", e.getMessage());
        }
        if (!state.isOver() && log.isDebugEnabled()) {
            log.debug("Stopped after {} turns without a winner (limit {}).", state.getTurn(), table.getMaxTurns());
        }
        long durationNanos = System.nanoTime() - startNanos;
        if (episodeLogger != null) {
            episodeLogger.logSummary(seed, durationNanos);
        }
        Hand winner = state.getWinner();
        return new GameResult(winner == null ? null : winner.getOwner(), state.getTurn(), seed, durationNanos);
    }

    private AIPlayer selectPolicy(String name) {
        for (AIPlayer candidate : policies) {
            if (candidate.getPolicyName().equalsIgnoreCase(name)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown table.ai-policy '" + name + "'");
    }

    /**
     * Lightweight summary of a single game run.
     */
    public static final class GameResult {
        private final String winner;
        private final int turns;
        private final long seed;
        private final long durationNanos;

        public GameResult(String winner, int turns, long seed, long durationNanos) {
            this.winner = winner;
            this.turns = turns;
            this.seed = seed;
            this.durationNanos = durationNanos;
        }

        /**
         * @return the winning seat's name, or null if the game stopped without a winner
         */
        public String getWinner() {
            return winner;
        }

        public int getTurns() {
            return turns;
        }

        public long getSeed() {
            return seed;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
