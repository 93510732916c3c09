package com.fedsearch.embedding;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * Local, deterministic bag-of-words embedding using the hashing trick. Identifiers are split on
 * underscores and camel case, stop words are dropped and simple plurals are folded, so
 * "customer orders" lands close to a table {@code customer_order}.
 */
public class HashingEmbeddingService implements EmbeddingService {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "get", "give", "how",
            "in", "is", "it", "list", "me", "of", "on", "or", "show", "than", "that", "the", "their",
            "there", "this", "to", "was", "what", "which", "who", "with", "all", "table", "columns",
            "sample", "rows", "find", "many", "much"
    );

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] v = new float[dimension];
        for (String token : tokenize(text)) {
            v[bucket(token)] += 1.0f;
        }
        return Vectors.normalize(v);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        String spaced = text.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
        for (String raw : spaced.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (raw.length() < 2 || STOP_WORDS.contains(raw) || raw.chars().allMatch(Character::isDigit)) {
                continue;
            }
            out.add(singular(raw));
        }
        return out;
    }

    static String singular(String word) {
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.length() > 4 && (word.endsWith("ses") || word.endsWith("xes"))) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private int bucket(String token) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return (int) Math.floorMod(crc.getValue(), (long) dimension);
    }
}
