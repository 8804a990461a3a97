package io.tasklane.kubernetes.utils;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Generates Kubernetes object names with a random 5 characters suffix, restricted to the 63
 * characters allowed for labels and container names.
 */
public class Names {
    public static final int MAX_LENGTH = 63;
    public static final int SUFFIX_LENGTH = 5;

    // same alphabet as k8s.io/apimachinery rand.String, no vowels and no ambiguous characters
    private static final String ALPHABET = "bcdfghjklmnpqrstvwxz2456789";

    private final Supplier<String> suffixes;

    public Names(Supplier<String> suffixes) {
        this.suffixes = suffixes;
    }

    public static Names random() {
        Random random = new SecureRandom();

        return new Names(() -> {
            StringBuilder builder = new StringBuilder(SUFFIX_LENGTH);
            for (int i = 0; i < SUFFIX_LENGTH; i++) {
                builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
            return builder.toString();
        });
    }

    public static Names fixed(String suffix) {
        return new Names(() -> suffix);
    }

    public String withRandomSuffix(String base) {
        String suffix = suffixes.get();
        int max = MAX_LENGTH - suffix.length() - 1;

        if (base.length() > max) {
            base = base.substring(0, max);
        }

        return base + "-" + suffix;
    }
}
