package com.partner.match.utils;

import com.google.common.collect.Sets;
import lombok.experimental.UtilityClass;

import java.util.Map;
import java.util.Set;

@UtilityClass
public final class SimilarityUtils {

    /**
     * |A∩B| / |A∪B|, or 0 when both sets are empty.
     */
    public static double jaccard(Set<?> left, Set<?> right) {
        int union = Sets.union(left, right).size();
        if (union == 0) {
            return 0.0;
        }
        return (double) Sets.intersection(left, right).size() / union;
    }

    /**
     * Pearson correlation coefficient; 0 for mismatched or empty vectors and for
     * vectors with zero variance.
     */
    public static double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n != y.length || n == 0) {
            return 0.0;
        }

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0, sumY2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
            sumY2 += y[i] * y[i];
        }

        double numerator = n * sumXY - sumX * sumY;
        double denominator = Math.sqrt((n * sumX2 - sumX * sumX) * (n * sumY2 - sumY * sumY));
        return denominator == 0 || Double.isNaN(denominator) ? 0.0 : numerator / denominator;
    }

    public static double cosine(Map<String, Double> left, Map<String, Double> right) {
        double dot = 0, normLeft = 0, normRight = 0;
        for (String key : Sets.union(left.keySet(), right.keySet())) {
            double l = left.getOrDefault(key, 0.0);
            double r = right.getOrDefault(key, 0.0);
            dot += l * r;
            normLeft += l * l;
            normRight += r * r;
        }
        double denominator = Math.sqrt(normLeft) * Math.sqrt(normRight);
        return denominator == 0 ? 0.0 : dot / denominator;
    }
}
