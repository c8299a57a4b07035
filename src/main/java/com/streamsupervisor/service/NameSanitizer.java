package com.streamsupervisor.service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps a video filename to the stream id used as registry key and publish path.
 * The result only contains {@code [a-z0-9_-]} and is never empty.
 */
public final class NameSanitizer {
    private static final Pattern INVALID = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern DASHES = Pattern.compile("-+");
    private static final Pattern EDGES = Pattern.compile("^[_-]+|[_-]+$");
    private static final String PLACEHOLDER_PREFIX = "stream_";

    private NameSanitizer() {
    }

    public static String sanitize(Path path) {
        return sanitize(path.getFileName().toString());
    }

    public static String sanitize(String filename) {
        String name = stripExtension(filename == null ? "" : filename);
        name = INVALID.matcher(name).replaceAll("_").toLowerCase(Locale.ROOT);
        name = UNDERSCORES.matcher(name).replaceAll("_");
        name = DASHES.matcher(name).replaceAll("-");
        name = EDGES.matcher(name).replaceAll("");
        return name.isEmpty() ? placeholder(filename == null ? "" : filename) : name;
    }

    private static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static String placeholder(String filename) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(filename.getBytes(StandardCharsets.UTF_8));
            return PLACEHOLDER_PREFIX + HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
