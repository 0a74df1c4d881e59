package net.wsrooms.util.config;

/**
 * A source of string settings.
 */
public interface Configuration {

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    /**
     * Return the value of key, or null if it is not set.
     */
    String get(String key);

}
