package skirmish.ai.simulation;

import org.testng.Assert;
import org.testng.annotations.Test;
import skirmish.ai.RandomPlaystyle;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.game.Mage;
import skirmish.game.RestrictedBattleQueue;
import skirmish.game.Rogue;

public class GameStateHasherTest {
    private final GameStateHasher hasher = new GameStateHasher();

    private static Combatant[] queued(BattleQueue bq) {
        Combatant r = new Rogue("r", bq, new RandomPlaystyle(bq));
        Combatant m = new Mage("m", bq, new RandomPlaystyle(bq));
        r.setEnemy(m);
        m.setEnemy(r);
        bq.add(r);
        bq.add(m);
        return new Combatant[] {r, m};
    }

    @Test
    public void testKeyLayout() {
        BattleQueue bq = new BattleQueue();
        Combatant[] c = queued(bq);
        Assert.assertEquals(hasher.computeKey(bq, c[0]), "R100/100|M100/100|12|1");
        Assert.assertEquals(hasher.computeKey(bq, c[1]), "R100/100|M100/100|12|2");
    }

    @Test
    public void testCopiesShareKeys() {
        BattleQueue bq = new BattleQueue();
        Combatant[] c = queued(bq);
        c[1].setHp(41);
        BattleQueue copy = bq.copy();
        Assert.assertEquals(hasher.computeKey(copy, copy.getPlayer2()), hasher.computeKey(bq, c[1]));
    }

    @Test
    public void testRestrictedKeyHoldsPermissions() {
        RestrictedBattleQueue rbq = new RestrictedBattleQueue();
        Combatant[] c = queued(rbq);
        rbq.add(c[1]);
        Assert.assertEquals(hasher.computeKey(rbq, c[0]), "R100/100|M100/100|1+2+2-|1");
    }

    @Test
    public void testStatsChangeKey() {
        BattleQueue bq = new BattleQueue();
        Combatant[] c = queued(bq);
        String before = hasher.computeKey(bq, c[0]);
        c[0].setSp(99);
        Assert.assertNotEquals(hasher.computeKey(bq, c[0]), before);
    }
}
