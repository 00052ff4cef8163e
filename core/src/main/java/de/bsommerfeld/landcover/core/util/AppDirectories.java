package de.bsommerfeld.landcover.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Platform conventions for where the application keeps its data and
 * configuration. Paths are absolute but not created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME/{appName}}, else
 * {@code ~/.config/{appName}}</li>
 * </ul>
 */
public final class AppDirectories {

    public static final String APP_NAME = "landcover-aggregator";

    private AppDirectories() {
    }

    public static Path dataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }
        String xdgConfig = System.getenv("XDG_CONFIG_HOME");
        return xdgConfig != null && !xdgConfig.isEmpty()
                ? Paths.get(xdgConfig, appName)
                : Paths.get(home, ".config", appName);
    }

    /** {@code {dataDir}/config.json} for the default application name. */
    public static Path defaultConfigFile() {
        return dataDir(APP_NAME).resolve("config.json");
    }
}
