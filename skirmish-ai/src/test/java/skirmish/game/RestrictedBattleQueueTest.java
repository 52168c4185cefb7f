package skirmish.game;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import skirmish.ai.RandomPlaystyle;

public class RestrictedBattleQueueTest {
    private RestrictedBattleQueue rbq;
    private Combatant a;
    private Combatant b;

    @BeforeMethod
    public void setUp() {
        rbq = new RestrictedBattleQueue();
        a = new Rogue("a", rbq, new RandomPlaystyle(rbq));
        b = new Rogue("b", rbq, new RandomPlaystyle(rbq));
        a.setEnemy(b);
        b.setEnemy(a);
    }

    private String permissions() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rbq.size(); i++) {
            sb.append(rbq.canAdd(i) ? 'Y' : 'N');
        }
        return sb.toString();
    }

    private String order() {
        StringBuilder sb = new StringBuilder();
        for (Combatant c : rbq.getTickets()) {
            sb.append(c.getName());
        }
        return sb.toString();
    }

    @Test
    public void testFirstTicketCanAlwaysBeAdded() {
        rbq.add(a);
        rbq.add(b);
        Assert.assertEquals(order(), "ab");
        Assert.assertEquals(permissions(), "YY");
    }

    @Test
    public void testSameStatsAreStillDifferentCombatants() {
        RestrictedBattleQueue queue = new RestrictedBattleQueue();
        Combatant c = new Rogue("Sophia", queue, new RandomPlaystyle(queue));
        Combatant c2 = new Rogue("Sophia", queue, new RandomPlaystyle(queue));
        c.setEnemy(c2);
        c2.setEnemy(c);
        queue.add(c);
        queue.add(c2);
        Assert.assertEquals(queue.size(), 2);
        Assert.assertTrue(queue.canAdd(1), "c2 was never in the queue, so its first ticket can add");
    }

    @Test
    public void testTicketAddedForOtherCombatantCannotAdd() {
        rbq.add(a);
        rbq.add(b);
        rbq.add(b);
        Assert.assertEquals(order(), "abb");
        Assert.assertEquals(permissions(), "YYN");
    }

    @Test
    public void testSelfAddCappedAtTwoAddingTickets() {
        rbq.add(a);
        rbq.add(a);
        rbq.add(b);
        Assert.assertEquals(permissions(), "YYY");

        rbq.add(a);
        Assert.assertEquals(order(), "aaba");
        Assert.assertEquals(permissions(), "YYYN");
        Assert.assertEquals(rbq.getAddAbilityCount(a), 2);

        rbq.remove();
        rbq.add(a);
        Assert.assertEquals(order(), "abaa");
        Assert.assertEquals(permissions(), "YYNY");
        Assert.assertEquals(rbq.getAddAbilityCount(a), 2);
    }

    @Test
    public void testFrontWithoutPermissionAddsNothing() {
        rbq.add(a);
        rbq.add(b);
        rbq.add(b);
        rbq.remove();
        rbq.remove();
        Assert.assertEquals(permissions(), "N");

        rbq.add(b);
        rbq.add(b);
        Assert.assertEquals(order(), "b", "Additions are ignored while the front cannot add");
        Assert.assertEquals(rbq.getAddAbilityCount(b), 0);
    }

    @Test
    public void testCombatantWithoutTicketJoinsBehindBlockedFront() {
        rbq.add(a);
        rbq.add(b);
        rbq.add(b);
        rbq.remove();
        rbq.remove();
        Assert.assertEquals(order(), "b");
        Assert.assertEquals(permissions(), "N");

        rbq.add(a);
        Assert.assertEquals(order(), "ba");
        Assert.assertEquals(permissions(), "NY");
        Assert.assertEquals(rbq.getAddAbilityCount(a), 1);
    }

    @Test
    public void testAddAbilityNeverExceedsTwo() {
        rbq.add(a);
        rbq.add(b);
        for (int i = 0; i < 10; i++) {
            rbq.add(a);
            Assert.assertTrue(rbq.getAddAbilityCount(a) <= 2);
        }
        Assert.assertEquals(rbq.getAddAbilityCount(a), 2);
    }

    @Test
    public void testRemoveKeepsPermissionsAligned() {
        rbq.add(a);
        rbq.add(b);
        rbq.add(a);
        b.setSp(0);
        rbq.remove();
        Assert.assertSame(rbq.peek(), a);
        Assert.assertEquals(rbq.size(), 1);
        Assert.assertEquals(permissions(), "Y");
    }

    @Test(expectedExceptions = EmptyQueueException.class)
    public void testRemoveFromEmptyQueue() {
        rbq.remove();
    }

    @Test
    public void testCopyRecomputesPermissions() {
        rbq.add(a);
        rbq.add(b);

        RestrictedBattleQueue copy = rbq.copy();
        copy.peek().attack();
        Assert.assertEquals(copy.toString(),
                "a (Rogue): 100/97 [Y] -> b (Rogue): 95/100 [Y] -> a (Rogue): 100/97 [Y]");
        Assert.assertEquals(rbq.toString(),
                "a (Rogue): 100/100 [Y] -> b (Rogue): 100/100 [Y]");
    }

    @Test
    public void testCopyReplaysAdditions() {
        rbq.add(a);
        rbq.add(b);
        rbq.add(b);
        rbq.add(a);

        RestrictedBattleQueue copy = rbq.copy();
        Assert.assertEquals(copy.size(), 4);
        Assert.assertTrue(copy.canAdd(0));
        Assert.assertTrue(copy.canAdd(1));
        Assert.assertFalse(copy.canAdd(2));
        Assert.assertTrue(copy.canAdd(3));
    }
}
