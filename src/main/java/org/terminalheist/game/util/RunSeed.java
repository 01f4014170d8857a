package org.terminalheist.game.util;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * The seed a whole run is derived from. Text seeds are hashed bytewise (64-bit FNV-1a over UTF-8),
 * numeric seeds are used as-is.
 *
 * @param value the 64-bit value fed into {@link RNG#combine(RunSeed, int)}
 * @param label what the player typed or saw, for display and statistics
 */
public record RunSeed(long value, String label) {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    // cosmetic only; never shares state with a floor stream
    private static final SecureRandom COSMETIC = new SecureRandom();

    public RunSeed {
        Objects.requireNonNull(label, "label");
    }

    public static RunSeed ofNumber(long value) {
        return new RunSeed(value, Long.toString(value));
    }

    public static RunSeed ofText(String text) {
        Objects.requireNonNull(text, "text");
        return new RunSeed(fnv1a(text.getBytes(StandardCharsets.UTF_8)), text);
    }

    /**
     * An optionally signed decimal integer that fits a long is a numeric seed; anything else,
     * including surrounding whitespace, is hashed as text.
     */
    public static RunSeed parse(String input) {
        Objects.requireNonNull(input, "input");
        if (input.matches("[+-]?\\d{1,19}")) {
            try {
                return ofNumber(Long.parseLong(input));
            } catch (NumberFormatException overflow) {
                return ofText(input);
            }
        }
        return ofText(input);
    }

    /** A fresh numeric seed for "random run" menus. Not reproducible. */
    public static RunSeed random() {
        return ofNumber(COSMETIC.nextLong() & 0x7fffffffL);
    }

    static long fnv1a(byte[] bytes) {
        long hash = FNV_OFFSET;
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    @Override
    public String toString() {
        return label;
    }
}
