package skirmish.game;

import com.google.common.base.Preconditions;
import skirmish.game.skill.Skill;

import java.util.ArrayList;
import java.util.List;

/**
 * One of the two fighters in a match.
 *
 * A combatant knows the queue it takes turns in, the playstyle that picks its
 * moves and its enemy. The enemy link is a plain reference; whoever builds or
 * copies the pair is responsible for linking both sides.
 *
 * Identity is reference identity: two combatants with equal stats are still
 * different fighters.
 */
public abstract class Combatant {
    public static final int STARTING_HP = 100;
    public static final int STARTING_SP = 100;

    private final String name;
    private final int defense;
    private final Skill attackSkill;
    private final Skill specialSkill;
    private final BattleQueue battleQueue;
    private final Playstyle playstyle;

    private int hp = STARTING_HP;
    private int sp = STARTING_SP;
    private Combatant enemy;

    protected Combatant(String name, BattleQueue battleQueue, Playstyle playstyle,
                        int defense, Skill attackSkill, Skill specialSkill) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.battleQueue = Preconditions.checkNotNull(battleQueue, "battleQueue");
        this.playstyle = Preconditions.checkNotNull(playstyle, "playstyle");
        this.defense = defense;
        this.attackSkill = attackSkill;
        this.specialSkill = specialSkill;
    }

    /**
     * Returns a fresh combatant of the same archetype, with the same name and stats,
     * taking turns in {@code queue}. The enemy link is left for the caller to rebuild.
     */
    public Combatant copy(BattleQueue queue) {
        Combatant copy = newInstance(queue, playstyle.copy(queue));
        copy.hp = hp;
        copy.sp = sp;
        return copy;
    }

    protected abstract Combatant newInstance(BattleQueue queue, Playstyle playstyle);

    /**
     * Archetype name as shown in logs, e.g. {@code Rogue}.
     */
    public abstract String getArchetype();

    /**
     * Actions this combatant can afford, attack first.
     */
    public List<Action> getAvailableActions() {
        List<Action> actions = new ArrayList<>(2);
        if (sp >= attackSkill.getSpCost()) {
            actions.add(Action.ATTACK);
        }
        if (sp >= specialSkill.getSpCost()) {
            actions.add(Action.SPECIAL);
        }
        return actions;
    }

    public void attack() {
        attackSkill.use(this, enemy);
    }

    public void specialAttack() {
        specialSkill.use(this, enemy);
    }

    /**
     * Performs {@code action}; {@link Action#NONE} does nothing.
     */
    public void perform(Action action) {
        switch (action) {
            case ATTACK:
                attack();
                break;
            case SPECIAL:
                specialAttack();
                break;
            default:
                break;
        }
    }

    /**
     * Takes {@code damage} reduced by defense; HP never drops below 0.
     */
    public void applyDamage(int damage) {
        int taken = Math.max(0, damage - defense);
        hp = Math.max(0, hp - taken);
    }

    public void reduceSp(int cost) {
        sp -= cost;
    }

    public String getName() {
        return name;
    }

    public int getHp() {
        return hp;
    }

    public void setHp(int hp) {
        this.hp = hp;
    }

    public int getSp() {
        return sp;
    }

    public void setSp(int sp) {
        this.sp = sp;
    }

    public int getDefense() {
        return defense;
    }

    public Skill getAttackSkill() {
        return attackSkill;
    }

    public Skill getSpecialSkill() {
        return specialSkill;
    }

    public BattleQueue getBattleQueue() {
        return battleQueue;
    }

    public Playstyle getPlaystyle() {
        return playstyle;
    }

    public Combatant getEnemy() {
        return enemy;
    }

    public void setEnemy(Combatant enemy) {
        this.enemy = enemy;
    }

    @Override
    public String toString() {
        return name + " (" + getArchetype() + "): " + hp + "/" + sp;
    }
}
