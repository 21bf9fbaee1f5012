package de.bsommerfeld.drydock.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the platform-specific locations of the application's files:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 * Nothing here touches the file system.
 */
public final class StorageUtils {

    public static final String APP_NAME = "dry-dock";
    public static final String CONFIG_FILE = "config.toml";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    /** {@code logs/} inside the app-data directory. */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }
}
