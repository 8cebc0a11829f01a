package org.adseller.server.audience;

import org.adseller.server.exception.DimensionMismatchException;

public class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Returns cosine similarity of the vectors clamped to [0, 1]. Opposite, zero-norm or non-finite vectors score 0.
     */
    public static double similarity(float[] first, float[] second) {
        if (first.length != second.length) {
            throw new DimensionMismatchException(first.length, second.length);
        }

        double dot = 0.0d;
        double firstNorm = 0.0d;
        double secondNorm = 0.0d;
        for (int i = 0; i < first.length; i++) {
            dot += (double) first[i] * second[i];
            firstNorm += (double) first[i] * first[i];
            secondNorm += (double) second[i] * second[i];
        }

        if (firstNorm == 0.0d || secondNorm == 0.0d) {
            return 0.0d;
        }

        final double cosine = dot / (Math.sqrt(firstNorm) * Math.sqrt(secondNorm));
        if (!Double.isFinite(cosine)) {
            return 0.0d;
        }
        return Math.min(1.0d, Math.max(0.0d, cosine));
    }
}
