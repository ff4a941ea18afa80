package com.tony.gameFeatures.model.dataset;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DatasetReport {
    int nFeatures;
    int trainSamples;
    int valSamples;
    int testSamples;
    int totalSamples;

    TargetSummary train;
    TargetSummary validation;
    TargetSummary test;

    List<String> featureNames;

    @Value
    public static class TargetSummary {
        double mean;
        double std;
        double min;
        double max;

        public static TargetSummary empty() {
            return new TargetSummary(0.0, 0.0, 0.0, 0.0);
        }
    }
}
