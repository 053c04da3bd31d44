package nl.bytesoflife.circuitjson.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads converter settings. Precedence, highest first: environment variables,
 * {@code -Dkey=value} system properties, an optional configuration file, and the
 * {@code reference.conf} defaults on the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static ConverterSettings load(File configFile) {
        Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            log.info("Loading configuration from {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            if (configFile != null) {
                log.warn("Configuration file {} not found, using defaults", configFile.getAbsolutePath());
            }
            fileConfig = ConfigFactory.empty();
        }

        Config combined = ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();

        ConverterSettings settings = ConverterSettings.from(combined);
        log.debug("Using {}", settings);
        return settings;
    }
}
