package ai.uno.game.event;

/**
 * Receives engine notifications synchronously and in emission order.
 * <p>
 * Listeners must not mutate the game; an exception thrown here propagates out of the
 * engine call that emitted the event.
 */
@FunctionalInterface
public interface GameEventListener {

    void onEvent(GameEvent event);
}
