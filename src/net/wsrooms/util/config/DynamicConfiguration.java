package net.wsrooms.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Settings gathered from explicit values and a chain of fallback sources.
 */
public class DynamicConfiguration implements Configuration {

    private static final Logger LOGGER = Logger.getLogger("Config");

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    // wsrooms.send.timeout -> WSROOMS_SEND_TIMEOUT
    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase(Locale.ROOT)
                                 .replace('.', '_'));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new CopyOnWriteArrayList<Configuration>();
        data = new HashMap<String, String>();
    }

    /**
     * Look up key.
     * Explicitly put values win; otherwise the sources are consulted in
     * the order they were added and the first non-null result (or the
     * absence of one) is remembered.
     */
    public synchronized String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        data.put(key, ret);
        return ret;
    }

    public synchronized void put(String key, String value) {
        data.put(key, value);
    }
    public synchronized void putAll(Map<String, String> entries) {
        data.putAll(entries);
    }

    /**
     * Forget the value of key, so that the next get() asks the sources
     * again.
     */
    public synchronized void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    /**
     * Add the contents of a properties file as the lowest-priority source.
     */
    public void addFile(File path) throws IOException {
        final Properties props = new Properties();
        InputStream in = new FileInputStream(path);
        try {
            props.load(in);
        } finally {
            in.close();
        }
        LOGGER.config("Loaded " + props.size() + " setting(s) from " + path);
        addSource(new Configuration() {
            public String get(String key) {
                return props.getProperty(key);
            }
        });
    }

    /**
     * Create a configuration backed by system properties and then the
     * environment.
     */
    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
