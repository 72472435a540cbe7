package maestro.coordinator.util;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces prefix-tagged identifiers of the form {@code prefix_<millis>_<random>}.
 * <p>
 * The millisecond part is kept strictly increasing for the lifetime of the
 * generator, so ids never repeat within a running coordinator even when the
 * wall clock stalls or steps back.
 */
public final class IdGenerator {

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final int RANDOM_LENGTH = 9;

    private final SecureRandom random = new SecureRandom();
    private final AtomicLong lastMillis = new AtomicLong();

    public String generate(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix is required");
        }
        long millis = lastMillis.updateAndGet(prev -> Math.max(prev + 1, System.currentTimeMillis()));
        return prefix + "_" + millis + "_" + randomSuffix();
    }

    private String randomSuffix() {
        char[] chars = new char[RANDOM_LENGTH];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }
}
