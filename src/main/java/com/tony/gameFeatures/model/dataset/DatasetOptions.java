package com.tony.gameFeatures.model.dataset;

import com.tony.gameFeatures.config.FeatureProperties;
import com.tony.gameFeatures.service.ScalingMethod;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DatasetOptions {

    @Builder.Default
    String target = "home_win";

    @Builder.Default
    double trainRatio = 0.7;

    @Builder.Default
    double valRatio = 0.15;

    @Builder.Default
    double testRatio = 0.15;

    @Builder.Default
    ScalingMethod scaling = ScalingMethod.STANDARD;

    public static DatasetOptions from(FeatureProperties.Pipeline pipeline) {
        return DatasetOptions.builder()
                .target(pipeline.getTarget())
                .trainRatio(pipeline.getTrainRatio())
                .valRatio(pipeline.getValRatio())
                .testRatio(pipeline.getTestRatio())
                .scaling(pipeline.getScaling())
                .build();
    }
}
