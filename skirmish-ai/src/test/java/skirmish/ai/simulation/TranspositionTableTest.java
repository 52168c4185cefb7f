package skirmish.ai.simulation;

import org.testng.Assert;
import org.testng.annotations.Test;

public class TranspositionTableTest {

    @Test
    public void testStoreAndProbe() {
        TranspositionTable tt = new TranspositionTable(10);
        Assert.assertNull(tt.probe("a"));
        tt.store("a", -7);
        Assert.assertEquals(tt.probe("a"), Integer.valueOf(-7));
        Assert.assertEquals(tt.getHits(), 1);
        Assert.assertEquals(tt.getMisses(), 1);
        Assert.assertEquals(tt.getHitRate(), 0.5, 1e-9);
    }

    @Test
    public void testLeastRecentlyUsedIsEvicted() {
        TranspositionTable tt = new TranspositionTable(2);
        tt.store("a", 1);
        tt.store("b", 2);
        tt.probe("a");
        tt.store("c", 3);
        Assert.assertEquals(tt.size(), 2);
        Assert.assertNull(tt.probe("b"));
        Assert.assertEquals(tt.probe("a"), Integer.valueOf(1));
        Assert.assertEquals(tt.probe("c"), Integer.valueOf(3));
    }

    @Test
    public void testClear() {
        TranspositionTable tt = new TranspositionTable();
        tt.store("a", 1);
        tt.probe("a");
        tt.clear();
        Assert.assertEquals(tt.size(), 0);
        Assert.assertEquals(tt.getHits(), 0);
        Assert.assertEquals(tt.getHitRate(), 0.0, 1e-9);
        Assert.assertTrue(tt.getStatsSummary().startsWith("TranspositionTable: size=0"));
    }
}
