package com.tony.gameFeatures.model.dataset;

import com.tony.gameFeatures.model.FeatureRecord;
import lombok.Value;

import java.util.List;

/**
 * Découpage chronologique : tout le train précède la validation, qui précède le test.
 */
@Value
public class DatasetSplit {
    List<FeatureRecord> train;
    List<FeatureRecord> validation;
    List<FeatureRecord> test;

    public int total() {
        return train.size() + validation.size() + test.size();
    }
}
