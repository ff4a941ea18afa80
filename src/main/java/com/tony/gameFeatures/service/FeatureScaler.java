package com.tony.gameFeatures.service;

import lombok.Getter;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Arrays;

/**
 * Normalisation colonne par colonne, ajustée sur le train uniquement puis appliquée telle quelle
 * à la validation et au test.
 */
@Getter
public class FeatureScaler {

    private final ScalingMethod method;
    private final double[] center;
    private final double[] scale;

    private FeatureScaler(ScalingMethod method, double[] center, double[] scale) {
        this.method = method;
        this.center = center;
        this.scale = scale;
    }

    public static FeatureScaler fit(double[][] train, int columns, ScalingMethod method) {
        if (method == ScalingMethod.NONE) {
            throw new IllegalArgumentException("Pas de scaler pour la méthode NONE");
        }

        SummaryStatistics[] stats = new SummaryStatistics[columns];
        for (int c = 0; c < columns; c++) stats[c] = new SummaryStatistics();
        for (double[] row : train) {
            for (int c = 0; c < columns; c++) stats[c].addValue(row[c]);
        }

        double[] center = new double[columns];
        double[] scale = new double[columns];
        for (int c = 0; c < columns; c++) {
            if (stats[c].getN() == 0) {
                scale[c] = 0.0;
                continue;
            }
            if (method == ScalingMethod.STANDARD) {
                center[c] = stats[c].getMean();
                scale[c] = Math.sqrt(stats[c].getPopulationVariance());
            } else {
                center[c] = stats[c].getMin();
                scale[c] = stats[c].getMax() - stats[c].getMin();
            }
        }
        return new FeatureScaler(method, center, scale);
    }

    public double[][] transform(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            double[] row = matrix[r];
            double[] scaled = new double[row.length];
            for (int c = 0; c < row.length; c++) {
                // Colonne constante : 0.0 plutôt qu'une division par zéro
                scaled[c] = scale[c] == 0.0 ? 0.0 : (row[c] - center[c]) / scale[c];
            }
            out[r] = scaled;
        }
        return out;
    }

    @Override
    public String toString() {
        return "FeatureScaler{" + method + ", center=" + Arrays.toString(center) + ", scale=" + Arrays.toString(scale) + "}";
    }
}
