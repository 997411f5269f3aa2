/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

/**
 * A source of configuration values, addressed by section and key.
 */
public abstract class Configuration {

    /**
     * Look up a configuration value
     * @param section the configuration section
     * @param key the key within the section
     * @param defaultValue value to return when none is configured
     * @return the configured value, or defaultValue
     */
    abstract public String getValue(String section, String key, String defaultValue);

    /**
     * Look up an integer configuration value
     * @param section the configuration section
     * @param key the key within the section
     * @param defaultValue value to return when none is configured
     * @return the configured value, or defaultValue
     * @throws IllegalArgumentException if the configured value is not an integer
     */
    public int getIntValue(String section, String key, int defaultValue) {
        String value = getValue(section, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("configuration value " + section + "." + key +
                    " is not an integer: \"" + value + "\"", ex);
        }
    }
}
