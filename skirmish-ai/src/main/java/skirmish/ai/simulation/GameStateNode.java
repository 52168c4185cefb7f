package skirmish.ai.simulation;

import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;

import java.util.List;

/**
 * A position in an explicitly built search tree.
 *
 * Holds a queue snapshot, the combatant whose score the node represents and the
 * action that led here. Children and score stay null until the node is expanded
 * and scored.
 */
public class GameStateNode {
    private final BattleQueue queue;
    private final Combatant perspective;
    private final Action action;
    private List<GameStateNode> children;
    private Integer bestScore;

    public GameStateNode(BattleQueue queue, Combatant perspective, Action action) {
        this.queue = queue;
        this.perspective = perspective;
        this.action = action;
    }

    public BattleQueue getQueue() { return queue; }
    public Combatant getPerspective() { return perspective; }
    public Action getAction() { return action; }
    public List<GameStateNode> getChildren() { return children; }
    public Integer getBestScore() { return bestScore; }

    public boolean isExpanded() { return children != null; }

    public void setChildren(List<GameStateNode> children) { this.children = children; }
    public void setBestScore(int bestScore) { this.bestScore = bestScore; }

    @Override
    public String toString() {
        return String.format("%s [score=%s] %s", action, bestScore, queue);
    }
}
