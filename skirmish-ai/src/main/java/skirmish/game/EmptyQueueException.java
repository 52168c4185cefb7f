package skirmish.game;

/**
 * Thrown when a ticket is removed from a queue that has no live tickets left.
 * Turn loops are expected to check {@link BattleQueue#isEmpty()} first.
 */
public class EmptyQueueException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public EmptyQueueException(String message) {
        super(message);
    }
}
