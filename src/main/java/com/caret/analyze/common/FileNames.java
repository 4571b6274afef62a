package com.caret.analyze.common;

import java.util.Objects;

/**
 * File name helpers for choosing readers and writers by extension.
 */
public final class FileNames {

    private static final char SEPARATOR = '/';
    private static final char EXTENSION_SEPARATOR = '.';

    private FileNames() {
        // utility class
    }

    /**
     * Extension of the last path component without the leading dot, or an empty string.
     * Dots at the start of the file name do not begin an extension, so
     * {@code ext(".bashrc")} is {@code ""} while {@code ext("archive.tar.gz")} is {@code "gz"}.
     */
    public static String ext(String path) {
        Objects.requireNonNull(path, "path must not be null");
        String name = basename(path);
        int dotIndex = name.lastIndexOf(EXTENSION_SEPARATOR);
        for (int i = 0; i < dotIndex; i++) {
            if (name.charAt(i) != EXTENSION_SEPARATOR) {
                return name.substring(dotIndex + 1);
            }
        }
        return "";
    }

    /**
     * Text after the last dot of the last path component.
     * Returns the whole file name when it contains no dot.
     */
    public static String getExt(String path) {
        Objects.requireNonNull(path, "path must not be null");
        String name = basename(path);
        return name.substring(name.lastIndexOf(EXTENSION_SEPARATOR) + 1);
    }

    private static String basename(String path) {
        return path.substring(path.lastIndexOf(SEPARATOR) + 1);
    }
}
