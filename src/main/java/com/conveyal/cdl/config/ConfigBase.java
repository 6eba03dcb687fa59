package com.conveyal.cdl.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Shared functionality for classes that load configuration properties. Values from the supplied properties are
 * overridden by environment variables and system properties carrying the "cdl" prefix, in upper or lower case and with
 * dashes, underscores or dots as separators: CDL_SIGNAL_DISTANCE=400 or java -Dcdl.signal.distance=400 both set the
 * signal-distance key. Precedence is: system properties > environment variables > properties file.
 *
 * All parameters are required. Missing or unparseable values are recorded rather than thrown immediately so that every
 * problem can be reported at once by {@link #throwIfErrors()}.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String CDL_PROPERTY_PREFIX = "cdl-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new LinkedHashSet<>();

    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Load a properties file from the filesystem. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new IllegalStateException("Could not load configuration properties from " + filename, e);
        }
    }

    /** Load a properties file from the classpath. */
    protected static Properties propsFromResource (String resourceName) {
        try (InputStream stream = ConfigBase.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new IllegalStateException("Configuration resource not found on classpath: " + resourceName);
            }
            Properties properties = new Properties();
            properties.load(stream);
            return properties;
        } catch (IOException e) {
            throw new IllegalStateException("Could not load configuration properties from " + resourceName, e);
        }
    }

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return Double.NaN;
    }

    /** Record a value that was present and parseable but is not acceptable. */
    protected void invalid (String key, Object value, String requirement) {
        LOG.error("Configuration option '{}' {}, was {}", key, requirement, value);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties to enforce the presence and validity of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new IllegalStateException("Missing or invalid configuration properties: " +
                    String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite options supplied in the properties with environment variables and system properties. Case and
     * separators are normalized to conform to both properties and environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(CDL_PROPERTY_PREFIX)) {
                key = key.substring(CDL_PROPERTY_PREFIX.length());
                if (properties.getProperty(key) != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
