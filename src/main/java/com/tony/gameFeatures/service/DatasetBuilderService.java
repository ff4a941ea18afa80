package com.tony.gameFeatures.service;

import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.dataset.Dataset;
import com.tony.gameFeatures.model.dataset.DatasetOptions;
import com.tony.gameFeatures.model.dataset.DatasetReport;
import com.tony.gameFeatures.model.dataset.DatasetSplit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Découpage train / validation / test et préparation des matrices.
 * Le découpage est toujours chronologique pour ne pas entraîner sur le futur.
 */
@Service
@Slf4j
public class DatasetBuilderService {

    public DatasetSplit timeBasedSplit(List<FeatureRecord> records, double trainRatio, double valRatio, double testRatio) {
        if (trainRatio < 0 || valRatio < 0 || testRatio < 0
                || Math.abs(trainRatio + valRatio + testRatio - 1.0) >= 0.01) {
            throw new IllegalArgumentException(String.format(
                    "Les ratios doivent faire 1.0 (train=%.2f, val=%.2f, test=%.2f)", trainRatio, valRatio, testRatio));
        }

        // Les lignes sortent déjà triées de l'assembleur ; on s'appuie sur cet ordre
        int n = records.size();
        // Tolérance de 0.01 sur la somme : un ratio peut dépasser 1 de peu
        int trainEnd = Math.min(n, (int) (n * trainRatio));
        int valEnd = Math.max(trainEnd, Math.min(n, (int) (n * (trainRatio + valRatio))));

        DatasetSplit split = new DatasetSplit(
                List.copyOf(records.subList(0, trainEnd)),
                List.copyOf(records.subList(trainEnd, valEnd)),
                List.copyOf(records.subList(valEnd, n)));

        log.info("Split chronologique : Train={}, Val={}, Test={}",
                split.getTrain().size(), split.getValidation().size(), split.getTest().size());
        logRange("Train", split.getTrain());
        logRange("Val", split.getValidation());
        logRange("Test", split.getTest());
        return split;
    }

    public double[][] toMatrix(List<FeatureRecord> records) {
        double[][] matrix = new double[records.size()][];
        for (int i = 0; i < records.size(); i++) {
            matrix[i] = records.get(i).toFeatureArray();
        }
        return matrix;
    }

    public double[] targets(List<FeatureRecord> records, String target) {
        if (!FeatureRecord.TARGET_COLUMNS.contains(target)) {
            throw new IllegalArgumentException("Cible inconnue : " + target);
        }
        return records.stream().mapToDouble(r -> r.target(target)).toArray();
    }

    public Dataset buildDataset(List<FeatureRecord> records, DatasetOptions options) {
        log.info("Création du dataset (cible={}, scaling={})...", options.getTarget(), options.getScaling());
        DatasetSplit split = timeBasedSplit(records, options.getTrainRatio(), options.getValRatio(), options.getTestRatio());

        double[][] xTrain = toMatrix(split.getTrain());
        double[][] xVal = toMatrix(split.getValidation());
        double[][] xTest = toMatrix(split.getTest());

        FeatureScaler scaler = null;
        if (options.getScaling() != ScalingMethod.NONE) {
            scaler = FeatureScaler.fit(xTrain, FeatureRecord.FEATURE_COLUMNS.size(), options.getScaling());
            xTrain = scaler.transform(xTrain);
            xVal = scaler.transform(xVal);
            xTest = scaler.transform(xTest);
        }

        return Dataset.builder()
                .xTrain(xTrain)
                .xVal(xVal)
                .xTest(xTest)
                .yTrain(targets(split.getTrain(), options.getTarget()))
                .yVal(targets(split.getValidation(), options.getTarget()))
                .yTest(targets(split.getTest(), options.getTarget()))
                .featureNames(FeatureRecord.FEATURE_COLUMNS)
                .targetName(options.getTarget())
                .scaler(scaler)
                .build();
    }

    public DatasetReport report(Dataset dataset) {
        int train = dataset.getXTrain().length;
        int val = dataset.getXVal().length;
        int test = dataset.getXTest().length;
        return DatasetReport.builder()
                .nFeatures(dataset.getFeatureNames().size())
                .trainSamples(train)
                .valSamples(val)
                .testSamples(test)
                .totalSamples(train + val + test)
                .train(summarize(dataset.getYTrain()))
                .validation(summarize(dataset.getYVal()))
                .test(summarize(dataset.getYTest()))
                .featureNames(dataset.getFeatureNames())
                .build();
    }

    private DatasetReport.TargetSummary summarize(double[] values) {
        if (values.length == 0) {
            return DatasetReport.TargetSummary.empty();
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double std = values.length > 1 ? stats.getStandardDeviation() : 0.0;
        return new DatasetReport.TargetSummary(stats.getMean(), std, stats.getMin(), stats.getMax());
    }

    private void logRange(String label, List<FeatureRecord> part) {
        if (part.isEmpty()) return;
        log.info("{} : {} -> {}", label, part.get(0).getTimestamp(), part.get(part.size() - 1).getTimestamp());
    }
}
