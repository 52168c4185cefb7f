package skirmish.cli.stats;

import org.testng.Assert;
import org.testng.annotations.Test;

public class WilsonIntervalTest {

    @Test
    public void testNoBattles() {
        WilsonInterval ci = WilsonInterval.forWins(0, 0);
        Assert.assertEquals(ci.getWinRate(), 0.0, 1e-9);
        Assert.assertEquals(ci.getLower(), 0.0, 1e-9);
        Assert.assertEquals(ci.getUpper(), 100.0, 1e-9);
    }

    @Test
    public void testHalfWins() {
        WilsonInterval ci = WilsonInterval.forWins(50, 100);
        Assert.assertEquals(ci.getWinRate(), 50.0, 1e-9);
        Assert.assertEquals(ci.getLower(), 40.38, 0.01);
        Assert.assertEquals(ci.getUpper(), 59.62, 0.01);
    }

    @Test
    public void testBoundsStayInRange() {
        WilsonInterval all = WilsonInterval.forWins(10, 10);
        Assert.assertEquals(all.getUpper(), 100.0, 1e-9);
        Assert.assertEquals(all.getLower(), 72.25, 0.01);

        WilsonInterval none = WilsonInterval.forWins(0, 10);
        Assert.assertEquals(none.getLower(), 0.0, 1e-9);
        Assert.assertEquals(none.getUpper(), 27.75, 0.01);
    }

    @Test
    public void testIntervalContainsRate() {
        for (int wins = 0; wins <= 20; wins++) {
            WilsonInterval ci = WilsonInterval.forWins(wins, 20);
            Assert.assertTrue(ci.getLower() <= ci.getWinRate() && ci.getWinRate() <= ci.getUpper(),
                    "Interval must contain " + ci.getWinRate());
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMoreWinsThanBattles() {
        WilsonInterval.forWins(3, 2);
    }

    @Test
    public void testToString() {
        Assert.assertEquals(WilsonInterval.forWins(7, 10).toString(), "70.0% [39.7%, 89.2%]");
        Assert.assertEquals(WilsonInterval.forWins(7, 10).getWins(), 7);
        Assert.assertEquals(WilsonInterval.forWins(7, 10).getBattles(), 10);
    }
}
