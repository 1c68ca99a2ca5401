package org.taskfarm.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration for every CLI command.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dfarm.workers=8})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file found by {@link #locate(File, ConfigMessageHandler)}, if any</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are stacked, so a file that overrides
 * {@code farm.transport.barrierTimeout} also changes every value derived from it.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "taskfarm.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message emitted while locating the configuration file.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located. The CLI routes
     * them to SLF4J; tests usually collect them.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates the configuration file and loads the layered configuration.
     *
     * @param explicitConfigFile file given with {@code --config}, or {@code null}.
     * @param handler            receives one message naming the chosen source.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        File configFile = locate(explicitConfigFile, handler);
        return configFile != null ? loadFromFile(configFile) : loadDefaults();
    }

    /**
     * Picks the configuration file, first match wins:
     * <ol>
     *   <li>the {@code --config} option;</li>
     *   <li>the {@code -Dconfig.file} system property;</li>
     *   <li>{@code config/taskfarm.conf} in the working directory;</li>
     *   <li>{@code config/taskfarm.conf} in the installation directory
     *       ({@code APP_HOME/lib/taskfarm-*.jar} puts it at {@code APP_HOME/config});</li>
     *   <li>none: classpath defaults only.</li>
     * </ol>
     *
     * @return the file, or {@code null} for classpath defaults.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     */
    static File locate(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExisting(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from --config: "
                + explicitConfigFile.getAbsolutePath());
            return explicitConfigFile;
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExisting(systemConfigFile, "Configuration file from -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                + systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file from working directory: "
                + workingDirFile.getAbsolutePath());
            return workingDirFile;
        }

        File installationFile = installationConfigFile(handler);
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                + installationFile.getAbsolutePath());
            return installationFile;
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using defaults from classpath.");
        return null;
    }

    static Config loadFromFile(File configFile) {
        return layered(ConfigFactory.parseFile(configFile));
    }

    static Config loadDefaults() {
        return layered(ConfigFactory.empty());
    }

    private static Config layered(Config fileLayer) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExisting(File file, String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    private static File installationConfigFile(ConfigMessageHandler handler) {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        URL location = codeSource.getLocation();
        File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            handler.log(MessageLevel.WARN, "Cannot derive installation directory from " + location
                + ": " + e.getMessage());
            return null;
        }
        // target/classes during development, APP_HOME/lib/taskfarm.jar when installed
        File appHome = jarOrClasses.isFile() && jarOrClasses.getParentFile() != null
            ? jarOrClasses.getParentFile().getParentFile()
            : jarOrClasses;
        if (appHome == null) {
            return null;
        }
        File candidate = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? candidate : null;
    }
}
