package skirmish.util;

/**
 * Version information taken from the jar manifest.
 */
public final class BuildInfo {
    private static final String UNKNOWN_VERSION = "SNAPSHOT";

    private BuildInfo() {
    }

    public static String getVersionString() {
        String version = BuildInfo.class.getPackage().getImplementationVersion();
        return version != null ? version : UNKNOWN_VERSION;
    }
}
