package fr.lapetina.optimizer.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Cache key derivation.
 *
 * The fingerprint is the hex SHA-256 of {@code analysisType + ":" + normalizedContent},
 * where normalization trims and lower-cases the content, so inputs that differ only
 * in case or surrounding whitespace share an entry.
 */
public final class Fingerprint {

    private Fingerprint() {
        // Utility class
    }

    public static String of(String analysisType, String content) {
        String normalized = content.trim().toLowerCase(Locale.ROOT);
        byte[] digest = sha256().digest((analysisType + ":" + normalized).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    /**
     * Maps a fingerprint to a shard using its leading hex digits.
     */
    static int shardIndex(String fingerprint, int shardCount) {
        int prefix = Integer.parseInt(fingerprint.substring(0, 4), 16);
        return prefix % shardCount;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JVM ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
