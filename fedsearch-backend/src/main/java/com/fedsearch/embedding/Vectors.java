package com.fedsearch.embedding;

/**
 * Vector math shared by the schema index and the in-memory vector store.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Cosine similarity. Zero vectors and vectors of different length score 0.
     *
     * @param a first vector
     * @param b second vector
     * @return similarity in [-1, 1]
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Normalize in place to unit length. Zero vectors are left unchanged.
     */
    public static float[] normalize(float[] v) {
        double norm = 0.0;
        for (float x : v) {
            norm += (double) x * x;
        }
        if (norm == 0.0) {
            return v;
        }
        double len = Math.sqrt(norm);
        for (int i = 0; i < v.length; i++) {
            v[i] = (float) (v[i] / len);
        }
        return v;
    }

    public static double clamp01(double v) {
        if (Double.isNaN(v) || v < 0.0) {
            return 0.0;
        }
        return Math.min(v, 1.0);
    }
}
