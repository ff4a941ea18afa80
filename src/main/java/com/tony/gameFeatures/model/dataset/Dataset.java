package com.tony.gameFeatures.model.dataset;

import com.tony.gameFeatures.service.FeatureScaler;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Matrices prêtes pour l'entraînement (X déjà normalisées si un scaler est présent).
 */
@Value
@Builder
public class Dataset {
    double[][] xTrain;
    double[][] xVal;
    double[][] xTest;

    double[] yTrain;
    double[] yVal;
    double[] yTest;

    List<String> featureNames;
    String targetName;

    // null si pas de normalisation
    FeatureScaler scaler;
}
