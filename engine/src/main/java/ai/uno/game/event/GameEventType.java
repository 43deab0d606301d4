package ai.uno.game.event;

/**
 * Kinds of notification emitted by the turn engine, in the order they can occur in a turn.
 */
public enum GameEventType {
    /** Hands dealt and the opening card turned; carries the opening card and colour. */
    GAME_STARTED,
    /** The opening card's effect was applied before anyone acted. */
    START_CARD_EFFECT,
    /** A seat is about to be asked for a move. */
    TURN_STARTED,
    /** A card left a hand for the discard pile. */
    CARD_PLAYED,
    /** A wild set the active colour. */
    COLOR_CHOSEN,
    /** The seat has one card left. */
    LAST_CARD,
    /** A seat drew a single card by choice; the card is attached. */
    CARD_DRAWN,
    /** A drawn card matched and was played straight away under the no-mercy rule. */
    AUTO_PLAYED,
    /** A DRAW_TWO or unchallenged WILD_DRAW_FOUR raised the pending draw; count is the new total. */
    PENDING_DRAW_INCREASED,
    /** A seat took the whole pending draw instead of stacking; count is the cards received. */
    PENDING_DRAW_ABSORBED,
    /** A seat lost its turn to a SKIP, or to a REVERSE with two seats. */
    SKIPPED,
    /** The direction of play flipped. */
    DIRECTION_REVERSED,
    /** The next seat challenged a WILD_DRAW_FOUR. */
    CHALLENGE_RAISED,
    /** The challenged play was illegal; the player drew the count as penalty. */
    CHALLENGE_SUCCEEDED,
    /** The challenged play was legal; the challenger drew the count as penalty. */
    CHALLENGE_FAILED,
    /** The player returned an INVALID move and drew a penalty card. */
    INVALID_MOVE,
    /** The proposed card was not held or did not match; the turn passed with no cards moving. */
    TURN_FORFEITED,
    /** The deck could not supply every requested card; count is the shortfall. */
    DRAW_EXHAUSTED,
    /** A hand emptied; the game is over. */
    GAME_WON
}
