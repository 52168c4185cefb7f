package skirmish.ai;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tunables for the computer players, read from {@code key=value} files on the
 * classpath under {@code /ai/}. Keys missing from a profile fall back to the
 * {@value #DEFAULT} profile.
 */
public final class AiProfile {
    public static final String DEFAULT = "Default";

    private static final String PROFILE_DIR = "/ai/";
    private static final String PROFILE_EXT = ".ai";
    private static final String PROFILE_LIST = PROFILE_DIR + "profiles.txt";

    private static final Map<String, AiProfile> CACHE = new ConcurrentHashMap<>();

    private final String name;
    private final Properties properties;

    private AiProfile(String name, Properties properties) {
        this.name = name;
        this.properties = properties;
    }

    public static AiProfile defaults() {
        return load(DEFAULT);
    }

    /**
     * Loads a profile by name.
     *
     * @throws IllegalArgumentException if there is no such profile on the classpath
     */
    public static AiProfile load(String name) {
        AiProfile cached = CACHE.get(name);
        if (cached != null) {
            return cached;
        }
        // not computeIfAbsent: reading a profile loads Default through this same method
        CACHE.putIfAbsent(name, read(name));
        return CACHE.get(name);
    }

    private static AiProfile read(String name) {
        Properties props = new Properties();
        if (!DEFAULT.equals(name)) {
            props.putAll(defaults().properties);
        }
        try (InputStream in = AiProfile.class.getResourceAsStream(PROFILE_DIR + name + PROFILE_EXT)) {
            if (in == null) {
                throw new IllegalArgumentException("Unknown AI profile: " + name);
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read AI profile " + name, e);
        }
        return new AiProfile(name, props);
    }

    /**
     * Names of the profiles shipped on the classpath.
     */
    public static List<String> getAvailableProfiles() {
        List<String> names = new ArrayList<>();
        try (InputStream in = AiProfile.class.getResourceAsStream(PROFILE_LIST)) {
            if (in == null) {
                return Collections.singletonList(DEFAULT);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty() && !line.startsWith("#")) {
                    names.add(line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + PROFILE_LIST, e);
        }
        return names;
    }

    public String getName() {
        return name;
    }

    public boolean getBoolProperty(String key) {
        return Boolean.parseBoolean(getProperty(key));
    }

    public int getIntProperty(String key) {
        String value = getProperty(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("AI profile " + name + ": " + key + " is not a number: " + value, e);
        }
    }

    private String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("AI profile " + name + " has no value for " + key);
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return name;
    }
}
