package ai.uno.game;

import ai.uno.game.event.GameEvent;
import ai.uno.game.event.GameEventListener;
import ai.uno.game.event.GameEventType;
import ai.uno.player.Player;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The UNO "No Mercy" turn engine: validates and applies one move per turn and advances play.
 * <p>
 * <strong>Turn structure</strong> ({@link #playTurn()}):
 * <ol>
 *   <li>Ask the current seat's {@link Player} for a {@link Move}.</li>
 *   <li>{@code INVALID}: the seat draws one penalty card and the turn passes.</li>
 *   <li>{@code DRAW}: with a pending forced draw the seat takes all of it and the turn passes.
 *       Otherwise it draws one card; under the no-mercy rule a matching drawn card is played
 *       at once, else it is kept and the turn passes.</li>
 *   <li>{@code PLAY}: a card that is not held, does not match, or is a wild without a standard
 *       colour forfeits the turn. A legal card is discarded and its effect applied.</li>
 *   <li>An empty hand after any of the above wins the game.</li>
 * </ol>
 * <p>
 * <strong>Active colour:</strong> set from the opening card, then changed only by a wild, to
 * the colour its player names. A coloured card matched by rank leaves it unchanged.
 * <p>
 * <strong>Stacking:</strong> DRAW_TWO adds 2 and an unchallenged WILD_DRAW_FOUR adds 4 to the
 * pending draw, which passes to the next seat. The engine does not force a stack; players
 * report a non-stacking play under a pending draw as {@code INVALID}.
 * <p>
 * <strong>Wild Draw Four challenge:</strong> the play is illegal if the player still holds a
 * non-wild card of the colour that was active before it. The next seat challenges when its
 * player {@link Player#alwaysChallenges() always challenges} or the move carried the challenge
 * flag. A successful challenge makes the player draw 4; a failed one makes the challenger
 * draw 6; without a challenge the pending draw grows by 4.
 * <p>
 * Every state change is reported to the registered {@link GameEventListener}s in order.
 * An engine and its state are confined to one thread.
 */
public class TurnEngine {
    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    /** Cards dealt to each seat at the start. */
    public static final int HAND_SIZE = 7;
    /** Cards added to the pending draw by a DRAW_TWO. */
    public static final int DRAW_TWO_PENALTY = 2;
    /** Cards added to the pending draw by an unchallenged WILD_DRAW_FOUR. */
    public static final int WILD_DRAW_FOUR_PENALTY = 4;
    /** Cards drawn by a player whose WILD_DRAW_FOUR was successfully challenged. */
    public static final int ILLEGAL_WILD_DRAW_FOUR_PENALTY = 4;
    /** Cards drawn by a challenger whose challenge failed. */
    public static final int FAILED_CHALLENGE_PENALTY = 6;
    /** Cards drawn for an INVALID move. */
    public static final int INVALID_MOVE_PENALTY = 1;

    private final GameState state;
    private final List<Player> players;
    private final List<GameEventListener> listeners = new ArrayList<>();
    private long sequence;

    /**
     * Creates an engine for the given state.
     *
     * @param state   the game state; seat {@code i} is played by {@code players.get(i)}
     * @param players one player per seat, in seat order
     * @throws IllegalArgumentException if the number of players differs from the number of seats
     */
    public TurnEngine(GameState state, List<Player> players) {
        this.state = Objects.requireNonNull(state, "state");
        this.players = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(players, "players")));
        if (this.players.size() != state.getPlayerCount()) {
            throw new IllegalArgumentException(
                    "Expected " + state.getPlayerCount() + " players but got " + this.players.size());
        }
        for (Player player : this.players) {
            Objects.requireNonNull(player, "player");
        }
    }

    public void addListener(GameEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public GameState getState() {
        return state;
    }

    /**
     * Deals {@link #HAND_SIZE} cards to every seat, turns the opening card and applies its
     * effect. Only for a fresh state; a known position built with an active colour is ready
     * to play as is.
     *
     * @throws IllegalStateException if the game has already been started
     */
    public void start() {
        Deck deck = state.getDeck();
        if (deck.discardPileSize() > 0 || state.getActiveColor() != null) {
            throw new IllegalStateException("Game already started");
        }
        for (Hand hand : state.getHands()) {
            drawCards(hand, HAND_SIZE);
        }
        Card opening = deck.startDiscardNonWild();
        state.setActiveColor(opening.getColor());
        emit(GameEventType.GAME_STARTED, null, opening, opening.getColor(), 0);
        applyInitialEffect(opening);
    }

    /**
     * Applies the opening card's effect once, before anyone has acted.
     */
    private void applyInitialEffect(Card opening) {
        switch (opening.getRank()) {
            case SKIP:
                emit(GameEventType.START_CARD_EFFECT, null, opening, null, 0);
                emit(GameEventType.SKIPPED, state.current().getOwner(), opening, null, 0);
                state.advanceTurn(1);
                break;
            case REVERSE:
                emit(GameEventType.START_CARD_EFFECT, null, opening, null, 0);
                state.reverse();
                emit(GameEventType.DIRECTION_REVERSED, null, opening, null, state.getDirection());
                break;
            case DRAW_TWO:
                emit(GameEventType.START_CARD_EFFECT, null, opening, null, 0);
                state.addPendingDraw(DRAW_TWO_PENALTY);
                emit(GameEventType.PENDING_DRAW_INCREASED, state.current().getOwner(), opening, null,
                        state.getPendingDraw());
                break;
            default:
                break;
        }
    }

    /**
     * Plays turns until a seat wins or {@code maxTurns} turns have been taken.
     *
     * @param maxTurns maximum number of turns to play; {@code 0} or less means no limit
     * @return the winning hand, or null if the limit was reached first
     */
    public Hand run(int maxTurns) {
        int taken = 0;
        while (!state.isOver() && (maxTurns <= 0 || taken < maxTurns)) {
            playTurn();
            taken++;
        }
        return state.getWinner();
    }

    /**
     * Plays a single turn for the current seat.
     *
     * @return {@code true} if the game continues; {@code false} once it has been won
     * @throws IllegalStateException if neither {@link #start()} nor a known position set the
     *                               active colour
     */
    public boolean playTurn() {
        if (state.isOver()) {
            return false;
        }
        if (state.getActiveColor() == null) {
            throw new IllegalStateException("Game not started: no active colour");
        }
        int seat = state.getCurrentIndex();
        Hand hand = state.current();
        state.incrementTurn();
        emit(GameEventType.TURN_STARTED, hand.getOwner(), null, null, 0);

        Move move = Objects.requireNonNull(players.get(seat).chooseMove(state, hand),
                "Player for seat " + seat + " returned no move");
        if (log.isDebugEnabled()) {
            log.debug("Turn {}: {} -> {}", state.getTurn(), hand.getOwner(), move);
        }
        switch (move.getType()) {
            case INVALID:
                applyInvalid(hand);
                break;
            case DRAW:
                applyDraw(hand);
                break;
            default:
                applyPlayMove(hand, move);
                break;
        }
        return !state.isOver();
    }

    private void applyInvalid(Hand hand) {
        int drawn = drawCards(hand, INVALID_MOVE_PENALTY);
        emit(GameEventType.INVALID_MOVE, hand.getOwner(), null, null, drawn);
        state.advanceTurn(1);
    }

    private void applyDraw(Hand hand) {
        Deck deck = state.getDeck();
        if (state.getPendingDraw() > 0) {
            int drawn = drawCards(hand, state.getPendingDraw());
            state.clearPendingDraw();
            emit(GameEventType.PENDING_DRAW_ABSORBED, hand.getOwner(), null, null, drawn);
            state.advanceTurn(1);
        } else {
            Card drawn = deck.draw();
            if (drawn == null) {
                emit(GameEventType.DRAW_EXHAUSTED, hand.getOwner(), null, null, 1);
                state.advanceTurn(1);
            } else {
                hand.add(drawn);
                emit(GameEventType.CARD_DRAWN, hand.getOwner(), drawn, null, 1);
                if (state.isNoMercy() && drawn.matches(deck.topDiscard(), state.getActiveColor())) {
                    emit(GameEventType.AUTO_PLAYED, hand.getOwner(), drawn, null, 0);
                    Color chosen = drawn.isWild() ? hand.mostHeldColor() : null;
                    applyPlay(hand, drawn, chosen, false);
                } else {
                    state.advanceTurn(1);
                }
            }
        }
        checkWin(hand);
    }

    private void applyPlayMove(Hand hand, Move move) {
        Card card = move.getCard();
        if (!hand.contains(card)) {
            forfeit(hand, card, "card not in hand");
            return;
        }
        if (!card.matches(state.getTopDiscard(), state.getActiveColor())) {
            forfeit(hand, card, "card does not match " + state.getTopDiscard() + " / " + state.getActiveColor());
            return;
        }
        Color chosen = move.getChosenColor();
        if (card.isWild() && (chosen == null || !chosen.isStandard())) {
            forfeit(hand, card, "wild played without a colour");
            return;
        }
        applyPlay(hand, card, chosen, move.isChallenge());
        checkWin(hand);
    }

    private void forfeit(Hand hand, Card card, String reason) {
        if (log.isDebugEnabled()) {
            log.debug("{} forfeits the turn playing {}: {}", hand.getOwner(), card, reason);
        }
        emit(GameEventType.TURN_FORFEITED, hand.getOwner(), card, null, 0);
        state.advanceTurn(1);
    }

    /**
     * Moves an already validated card from the hand to the discard pile and applies its effect,
     * including the turn advance.
     */
    private void applyPlay(Hand hand, Card card, Color chosenColor, boolean challengeFlag) {
        Color colorBefore = state.getActiveColor();
        hand.remove(card);
        state.getDeck().discard(card);
        emit(GameEventType.CARD_PLAYED, hand.getOwner(), card, card.isWild() ? chosenColor : null, 0);
        if (card.isWild()) {
            // Only a wild changes the active colour; a coloured card leaves it as it was.
            state.setActiveColor(chosenColor);
            emit(GameEventType.COLOR_CHOSEN, hand.getOwner(), card, chosenColor, 0);
        }
        if (hand.size() == 1) {
            emit(GameEventType.LAST_CARD, hand.getOwner(), null, null, 1);
        }

        switch (card.getRank()) {
            case SKIP:
                emit(GameEventType.SKIPPED, state.next().getOwner(), card, null, 0);
                state.advanceTurn(2);
                break;
            case REVERSE:
                state.reverse();
                emit(GameEventType.DIRECTION_REVERSED, hand.getOwner(), card, null, state.getDirection());
                if (state.getPlayerCount() == 2) {
                    emit(GameEventType.SKIPPED, state.next().getOwner(), card, null, 0);
                    state.advanceTurn(2);
                } else {
                    state.advanceTurn(1);
                }
                break;
            case DRAW_TWO:
                state.addPendingDraw(DRAW_TWO_PENALTY);
                emit(GameEventType.PENDING_DRAW_INCREASED, state.next().getOwner(), card, null,
                        state.getPendingDraw());
                state.advanceTurn(1);
                break;
            case WILD_DRAW_FOUR:
                resolveWildDrawFour(hand, card, colorBefore, challengeFlag);
                state.advanceTurn(1);
                break;
            default:
                state.advanceTurn(1);
                break;
        }
    }

    /**
     * Runs the challenge sub-protocol for a WILD_DRAW_FOUR just played from {@code hand}.
     * The card has already left the hand, so the hand is exactly what the player held besides it.
     */
    private void resolveWildDrawFour(Hand hand, Card card, Color colorBefore, boolean challengeFlag) {
        int nextSeat = state.nextIndex();
        Hand challengerHand = state.getHands().get(nextSeat);
        boolean challenged = players.get(nextSeat).alwaysChallenges() || challengeFlag;
        if (!challenged) {
            state.addPendingDraw(WILD_DRAW_FOUR_PENALTY);
            emit(GameEventType.PENDING_DRAW_INCREASED, challengerHand.getOwner(), card, null,
                    state.getPendingDraw());
            return;
        }
        emit(GameEventType.CHALLENGE_RAISED, challengerHand.getOwner(), card, colorBefore, 0);
        if (hand.hasNonWildColor(colorBefore)) {
            int drawn = drawCards(hand, ILLEGAL_WILD_DRAW_FOUR_PENALTY);
            emit(GameEventType.CHALLENGE_SUCCEEDED, hand.getOwner(), card, colorBefore, drawn);
        } else {
            int drawn = drawCards(challengerHand, FAILED_CHALLENGE_PENALTY);
            emit(GameEventType.CHALLENGE_FAILED, challengerHand.getOwner(), card, colorBefore, drawn);
        }
    }

    /**
     * Draws up to {@code count} cards into the hand, reporting any shortfall.
     */
    private int drawCards(Hand hand, int count) {
        int drawn = hand.draw(state.getDeck(), count);
        if (drawn < count) {
            log.warn("Deck exhausted: {} received {} of {} cards", hand.getOwner(), drawn, count);
            emit(GameEventType.DRAW_EXHAUSTED, hand.getOwner(), null, null, count - drawn);
        }
        return drawn;
    }

    private void checkWin(Hand hand) {
        if (hand.isEmpty() && !state.isOver()) {
            state.setWinner(hand);
            emit(GameEventType.GAME_WON, hand.getOwner(), null, null, 0);
        }
    }

    private void emit(GameEventType type, String player, Card card, Color color, int count) {
        GameEvent event = GameEvent.of(++sequence, type, player, card, color, count);
        for (GameEventListener listener : listeners) {
            listener.onEvent(event);
        }
    }
}
