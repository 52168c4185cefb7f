package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * A move a combatant can use on its enemy.
 *
 * Using a skill spends SP, deals damage and decides who gets extra turns by
 * adding tickets to the caster's battle queue.
 */
public abstract class Skill {
    private final String name;
    private final int cost;
    private final int damage;

    protected Skill(String name, int cost, int damage) {
        this.name = name;
        this.cost = cost;
        this.damage = damage;
    }

    public String getName() {
        return name;
    }

    public int getSpCost() {
        return cost;
    }

    public int getDamage() {
        return damage;
    }

    /**
     * Makes {@code caster} use this skill on {@code target}.
     */
    public abstract void use(Combatant caster, Combatant target);

    /**
     * Charges the caster and hits the target.
     */
    protected void dealDamage(Combatant caster, Combatant target) {
        caster.reduceSp(cost);
        target.applyDamage(damage);
    }

    @Override
    public String toString() {
        return name;
    }
}
