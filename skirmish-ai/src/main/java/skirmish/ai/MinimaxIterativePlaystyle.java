package skirmish.ai;

import org.apache.commons.lang3.tuple.Pair;
import skirmish.ai.simulation.GameStateNode;
import skirmish.ai.simulation.StateScorer;
import skirmish.ai.simulation.TurnSimulator;
import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.game.InvariantViolationException;
import skirmish.game.Playstyle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Same choice as {@link MinimaxRecursivePlaystyle}, but builds the whole search
 * tree with an explicit stack instead of recursing, so deep battles cannot
 * overflow the call stack.
 *
 * Nodes are visited twice: once to expand them (the node goes back on the stack
 * under its children) and once more, after all children are scored, to take the
 * best child score.
 */
public class MinimaxIterativePlaystyle extends Playstyle {
    private int nodesBuilt;

    public MinimaxIterativePlaystyle(BattleQueue battleQueue) {
        super(battleQueue);
    }

    @Override
    public Action selectAction() {
        if (battleQueue.isOver()) {
            return Action.NONE;
        }
        if (battleQueue.peek().getAvailableActions().isEmpty()) {
            return Action.NONE;
        }

        GameStateNode root = search(battleQueue);
        for (GameStateNode child : root.getChildren()) {
            if (child.getBestScore().equals(root.getBestScore())) {
                return child.getAction();
            }
        }
        return Action.NONE;
    }

    /**
     * Builds and scores the full tree below a copy of {@code queue}.
     */
    GameStateNode search(BattleQueue queue) {
        BattleQueue start = queue.copy();
        GameStateNode root = new GameStateNode(start, start.peek(), Action.NONE);
        nodesBuilt = 1;

        Deque<GameStateNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            GameStateNode node = stack.pop();
            if (node.getQueue().isOver()) {
                node.setBestScore(StateScorer.terminalScore(node.getQueue(), node.getPerspective()));
            } else if (!node.isExpanded()) {
                node.setChildren(expand(node));
                stack.push(node);
                for (GameStateNode child : node.getChildren()) {
                    stack.push(child);
                }
            } else {
                int best = Integer.MIN_VALUE;
                for (GameStateNode child : node.getChildren()) {
                    best = Math.max(best, child.getBestScore());
                }
                node.setBestScore(best);
            }
        }
        return root;
    }

    private List<GameStateNode> expand(GameStateNode parent) {
        BattleQueue queue = parent.getQueue();
        Combatant actor = queue.peek();
        List<Action> actions = actor.getAvailableActions();
        if (actions.isEmpty()) {
            throw new InvariantViolationException("Battle is not over but " + actor + " has no action");
        }
        List<GameStateNode> children = new ArrayList<>(actions.size());
        for (Action action : actions) {
            Pair<BattleQueue, Combatant> next = TurnSimulator.simulate(queue, parent.getPerspective(), action);
            children.add(new GameStateNode(next.getLeft(), next.getRight(), action));
        }
        nodesBuilt += children.size();
        return children;
    }

    /**
     * Number of nodes in the tree built by the most recent decision.
     */
    public int getNodesBuilt() {
        return nodesBuilt;
    }

    @Override
    public Playstyle copy(BattleQueue queue) {
        return new MinimaxIterativePlaystyle(queue);
    }

    @Override
    public String getName() {
        return "iterative";
    }
}
