package de.bsommerfeld.drydock.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-feed-item.sql}, {@code select-latest-feed-items.sql}.
 *
 * @see FeedRepository
 * @see LogRepository
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed SQL statement from {@code sql/<name>.sql}.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Reads a classpath resource as UTF-8 without caching. Used for the
     * schema, which is applied once per pool.
     */
    static String readRaw(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }

    private static String readResource(String name) {
        return readRaw("sql/" + name + ".sql").trim();
    }
}
