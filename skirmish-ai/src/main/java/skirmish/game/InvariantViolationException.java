package skirmish.game;

/**
 * Signals a logic defect in queue bookkeeping or search, such as a running game
 * whose next actor has nothing to do.
 */
public class InvariantViolationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public InvariantViolationException(String message) {
        super(message);
    }
}
