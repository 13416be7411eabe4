package org.finos.frame.engine.serialization;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for discovering and retrieving result serializers.
 *
 * Built-in serializers (JSON, CSV) are registered automatically.
 */
public final class SerializerRegistry {

    private static final Map<String, ResultSerializer> SERIALIZERS = new ConcurrentHashMap<>();

    static {
        register(JsonSerializer.INSTANCE);
        register(CsvSerializer.INSTANCE);
    }

    private SerializerRegistry() {
        // Static utility class
    }

    /**
     * Registers a serializer.
     * Replaces any existing serializer with the same format ID.
     */
    public static void register(ResultSerializer serializer) {
        SERIALIZERS.put(serializer.formatId(), serializer);
    }

    /**
     * Gets a serializer by format ID.
     *
     * @throws IllegalArgumentException if no serializer is registered for the
     *                                  format
     */
    public static ResultSerializer get(String formatId) {
        ResultSerializer serializer = SERIALIZERS.get(formatId);
        if (serializer == null) {
            throw new IllegalArgumentException("Unknown serialization format: " + formatId +
                    ". Available formats: " + availableFormats());
        }
        return serializer;
    }

    /**
     * Gets the serializer matching a file's extension.
     *
     * @throws IllegalArgumentException if the file has no extension or no
     *                                  serializer handles it
     */
    public static ResultSerializer forPath(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            throw new IllegalArgumentException("Cannot choose a format for file without extension: " + path);
        }
        return get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the set of available format IDs.
     */
    public static Set<String> availableFormats() {
        return Collections.unmodifiableSet(SERIALIZERS.keySet());
    }

    /**
     * Checks if a format is supported.
     */
    public static boolean isSupported(String formatId) {
        return SERIALIZERS.containsKey(formatId);
    }
}
