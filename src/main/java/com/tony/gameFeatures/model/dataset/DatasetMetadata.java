package com.tony.gameFeatures.model.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Contenu de metadata.json écrit à côté des fichiers X_* / y_*.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetMetadata {
    private String name;
    private String version;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("feature_names")
    private List<String> featureNames;

    @JsonProperty("target_name")
    private String targetName;

    @JsonProperty("train_samples")
    private int trainSamples;

    @JsonProperty("val_samples")
    private int valSamples;

    @JsonProperty("test_samples")
    private int testSamples;

    @JsonProperty("n_features")
    private int featureCount;
}
