package com.blanklines.plugins;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.blanklines.util.LoggerUtil;

/**
 * Enum representing supported file types, detected by extension with a content fallback.
 */
public enum FileType {
    JAVA("java"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int CONTENT_PROBE_BYTES = 4096;

    private static final Pattern JAVA_PATTERN = Pattern.compile(
            "(?m)^\\s*(?:package\\s+[\\w.]+\\s*;|import\\s+(?:static\\s+)?[\\w.]+(?:\\.\\*)?\\s*;|" +
                    "(?:public\\s+)?(?:final\\s+|abstract\\s+)?(?:class|interface|enum|record)\\s+\\w+)");

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects file type based on extension and, for files without a known one, content.
     *
     * @param filePath The path to the file
     * @return The detected FileType
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detectedType = detectByExtension(filePath);
        if (detectedType == UNKNOWN && !_hasExtension(filePath)) {
            detectedType = detectByContent(filePath);
        }

        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    /**
     * Detect file type by file extension.
     */
    public static FileType detectByExtension(Path filePath) {
        if (!_hasExtension(filePath)) {
            return UNKNOWN;
        }

        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        String extension = fileName.substring(fileName.lastIndexOf('.') + 1);

        return switch (extension) {
            case "java" -> JAVA;
            default -> UNKNOWN;
        };
    }

    private static boolean _hasExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        return fileName != null && fileName.toString().contains(".");
    }

    /**
     * Detect file type from the first few kilobytes of the file.
     */
    private static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }

        try {
            byte[] bytes = Files.readAllBytes(filePath);
            int bytesToRead = Math.min(bytes.length, CONTENT_PROBE_BYTES);
            String content = new String(bytes, 0, bytesToRead, StandardCharsets.UTF_8);

            return JAVA_PATTERN.matcher(content).find() ? JAVA : UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    /**
     * Clear the file type detection cache.
     */
    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case JAVA -> "Java source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
