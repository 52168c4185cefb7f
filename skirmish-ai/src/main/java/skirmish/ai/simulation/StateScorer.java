package skirmish.ai.simulation;

import org.apache.commons.lang3.tuple.Pair;
import skirmish.ai.AiProfile;
import skirmish.ai.AiProps;
import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.game.InvariantViolationException;

import java.util.List;

/**
 * Computes the best score a combatant can guarantee from a position, by playing
 * out every possible continuation.
 *
 * A finished battle is worth the winner's remaining HP to the winner and minus
 * that to the loser; a tie is worth 0. Every combatant maximizes its own score,
 * and since one side's gain is the other's loss no separate minimizing step is
 * needed.
 *
 * Instances are meant for a single decision: the optional transposition table
 * is only valid while the players' skills stay the same.
 */
public class StateScorer {
    private static final boolean DEBUG = Boolean.getBoolean("skirmish.debug");

    private final TranspositionTable transpositionTable;
    private final GameStateHasher stateHasher;
    private final boolean trace;
    private long nodesVisited;

    /**
     * Creates a plain scorer without caching or tracing.
     */
    public StateScorer() {
        this(null, false);
    }

    /**
     * @param transpositionTable cache for exact scores, or null to search every position
     * @param trace whether to print every scored move to stderr
     */
    public StateScorer(TranspositionTable transpositionTable, boolean trace) {
        this.transpositionTable = transpositionTable;
        this.stateHasher = transpositionTable != null ? new GameStateHasher() : null;
        this.trace = trace || DEBUG;
    }

    /**
     * Creates a scorer configured by the given profile, with a fresh cache if enabled.
     */
    public static StateScorer fromProfile(AiProfile profile) {
        TranspositionTable table = null;
        if (profile.getBoolProperty(AiProps.USE_TRANSPOSITION_TABLE)) {
            table = new TranspositionTable(profile.getIntProperty(AiProps.TRANSPOSITION_TABLE_SIZE));
        }
        return new StateScorer(table, profile.getBoolProperty(AiProps.SEARCH_TRACE));
    }

    /**
     * Returns the highest score the combatant at the front of {@code queue} can
     * guarantee. {@code queue} itself is not modified.
     */
    public int scoreState(BattleQueue queue) {
        BattleQueue copy = queue.copy();
        return scoreFor(copy.peek(), copy);
    }

    /**
     * Returns the highest score {@code perspective} can guarantee in {@code queue}.
     * Every continuation is played on a copy; {@code queue} keeps its tickets and
     * its combatants keep their stats.
     */
    public int scoreFor(Combatant perspective, BattleQueue queue) {
        return score(perspective, queue, 0);
    }

    private int score(Combatant perspective, BattleQueue queue, int depth) {
        nodesVisited++;
        if (queue.isOver()) {
            return terminalScore(queue, perspective);
        }

        String key = null;
        if (transpositionTable != null) {
            key = stateHasher.computeKey(queue, perspective);
            Integer cached = transpositionTable.probe(key);
            if (cached != null) {
                return cached;
            }
        }

        Combatant actor = queue.peek();
        List<Action> actions = actor.getAvailableActions();
        if (actions.isEmpty()) {
            throw new InvariantViolationException("Battle is not over but " + actor + " has no action");
        }

        int best = Integer.MIN_VALUE;
        for (Action action : actions) {
            Pair<BattleQueue, Combatant> next = TurnSimulator.simulate(queue, perspective, action);
            int value = score(next.getRight(), next.getLeft(), depth + 1);
            printState(depth, actor, action, value);
            best = Math.max(best, value);
        }

        if (transpositionTable != null) {
            transpositionTable.store(key, best);
        }
        return best;
    }

    /**
     * Score of a finished battle for {@code perspective}.
     */
    public static int terminalScore(BattleQueue queue, Combatant perspective) {
        Combatant winner = queue.getWinner();
        if (winner == null) {
            return 0;
        }
        return winner == perspective ? winner.getHp() : -winner.getHp();
    }

    public long getNodesVisited() {
        return nodesVisited;
    }

    public TranspositionTable getTranspositionTable() {
        return transpositionTable;
    }

    private void printState(int depth, Combatant actor, Action action, int value) {
        if (!trace) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(depth).append(": [").append(value).append("] ").append(actor.getName()).append(' ').append(action);
        System.err.println(sb);
    }
}
