/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.Properties;

/**
 * A {@link Configuration} backed by {@link Properties}, where the value for a section and key is held
 * under the property name "section.key".
 */
public class PropertiesConfiguration extends Configuration {
    private final Properties properties;

    public PropertiesConfiguration(final Properties properties) {
        this.properties = properties;
    }

    /**
     * @return a configuration reading the JVM system properties
     */
    public static PropertiesConfiguration fromSystemProperties() {
        return new PropertiesConfiguration(System.getProperties());
    }

    @Override
    public String getValue(String section, String key, String defaultValue) {
        return properties.getProperty(section + "." + key, defaultValue);
    }
}
