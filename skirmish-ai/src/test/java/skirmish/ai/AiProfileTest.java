package skirmish.ai;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AiProfileTest {

    @Test
    public void testDefaultProfile() {
        AiProfile profile = AiProfile.defaults();
        Assert.assertEquals(profile.getName(), AiProfile.DEFAULT);
        Assert.assertTrue(profile.getBoolProperty(AiProps.USE_TRANSPOSITION_TABLE));
        Assert.assertFalse(profile.getBoolProperty(AiProps.SEARCH_TRACE));
        Assert.assertEquals(profile.getIntProperty(AiProps.MAX_TURNS), 500);
    }

    @Test
    public void testMissingKeysFallBackToDefault() {
        AiProfile exhaustive = AiProfile.load("Exhaustive");
        Assert.assertFalse(exhaustive.getBoolProperty(AiProps.USE_TRANSPOSITION_TABLE));
        Assert.assertEquals(exhaustive.getIntProperty(AiProps.MAX_TURNS), 500);
        Assert.assertEquals(exhaustive.getIntProperty(AiProps.TRANSPOSITION_TABLE_SIZE),
                AiProfile.defaults().getIntProperty(AiProps.TRANSPOSITION_TABLE_SIZE));
    }

    @Test
    public void testProfilesAreCached() {
        Assert.assertSame(AiProfile.load("Debug"), AiProfile.load("Debug"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownProfile() {
        AiProfile.load("NoSuchProfile");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testUnknownKey() {
        AiProfile.defaults().getIntProperty("NoSuchKey");
    }

    @Test
    public void testAvailableProfiles() {
        Assert.assertEquals(AiProfile.getAvailableProfiles().get(0), AiProfile.DEFAULT);
        Assert.assertTrue(AiProfile.getAvailableProfiles().contains("Exhaustive"));
        for (String name : AiProfile.getAvailableProfiles()) {
            Assert.assertEquals(AiProfile.load(name).getName(), name);
        }
    }
}
