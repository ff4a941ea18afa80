package com.tony.gameFeatures.service;

import com.tony.gameFeatures.GameEventFixtures;
import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.dataset.Dataset;
import com.tony.gameFeatures.model.dataset.DatasetOptions;
import com.tony.gameFeatures.model.dataset.DatasetReport;
import com.tony.gameFeatures.model.dataset.DatasetSplit;
import com.tony.gameFeatures.store.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DatasetBuilderServiceTest {

    private final DatasetBuilderService builder = new DatasetBuilderService();
    private List<FeatureRecord> records;

    @BeforeEach
    void setUp() {
        FeatureAssemblerService assembler = new FeatureAssemblerService(GameEventFixtures.calculator());
        records = assembler.assemble(EventStore.build(GameEventFixtures.randomLog(13, 100, 6)), 0, 10);
    }

    @Test
    @DisplayName("Split chronologique 70/15/15")
    void shouldSplitChronologically() {
        DatasetSplit split = builder.timeBasedSplit(records, 0.7, 0.15, 0.15);

        assertThat(split.getTrain()).hasSize(70);
        assertThat(split.getValidation()).hasSize(15);
        assertThat(split.getTest()).hasSize(15);
        assertThat(split.total()).isEqualTo(records.size());

        FeatureRecord lastTrain = split.getTrain().get(69);
        assertThat(split.getValidation().get(0).getTimestamp()).isAfterOrEqualTo(lastTrain.getTimestamp());
        assertThat(split.getTest().get(0)).isEqualTo(records.get(85));
    }

    @Test
    @DisplayName("Ratios qui ne font pas 1 : refusés")
    void shouldRejectBadRatios() {
        assertThatThrownBy(() -> builder.timeBasedSplit(records, 0.7, 0.2, 0.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ratios");
        assertThatThrownBy(() -> builder.timeBasedSplit(records, 1.2, -0.1, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Ratio train légèrement supérieur à 1 (dans la tolérance) : tout va au train")
    void trainRatioAboveOneShouldBeClamped() {
        DatasetSplit split = builder.timeBasedSplit(records, 1.005, 0.0, 0.0);

        assertThat(split.getTrain()).hasSize(records.size());
        assertThat(split.getValidation()).isEmpty();
        assertThat(split.getTest()).isEmpty();
    }

    @Test
    @DisplayName("Le scaler est ajusté sur le train uniquement")
    void scalerShouldBeFittedOnTrain() {
        Dataset dataset = builder.buildDataset(records, DatasetOptions.builder().build());

        assertThat(dataset.getScaler()).isNotNull();
        assertThat(dataset.getXTrain()).hasNumberOfRows(70);
        assertThat(dataset.getYTest()).hasSize(15);

        // Colonne a_games_played : moyenne nulle sur le train une fois normalisée
        int column = FeatureRecord.FEATURE_COLUMNS.indexOf("a_games_played");
        double mean = 0.0;
        for (double[] row : dataset.getXTrain()) mean += row[column];
        assertThat(mean / 70).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Sans normalisation : les valeurs brutes, pas de scaler")
    void noScalingShouldKeepRawValues() {
        Dataset dataset = builder.buildDataset(records, DatasetOptions.builder()
                .scaling(ScalingMethod.NONE).target("score_a").build());

        assertThat(dataset.getScaler()).isNull();
        assertThat(dataset.getXTrain()[0]).containsExactly(records.get(0).toFeatureArray());
        assertThat(dataset.getYTrain()[0]).isEqualTo(records.get(0).getOutcome().getScoreA());
        assertThat(dataset.getTargetName()).isEqualTo("score_a");
    }

    @Test
    @DisplayName("Cible inconnue ou ligne sans label refusées")
    void shouldRejectUnknownTarget() {
        assertThatThrownBy(() -> builder.targets(records, "spread"))
                .isInstanceOf(IllegalArgumentException.class);

        List<FeatureRecord> unlabeled = List.of(records.get(0).withOutcome(null));
        assertThatThrownBy(() -> builder.targets(unlabeled, "home_win"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Le rapport résume tailles et cible")
    void reportShouldSummarizeDataset() {
        Dataset dataset = builder.buildDataset(records, DatasetOptions.builder().build());

        DatasetReport report = builder.report(dataset);

        assertThat(report.getNFeatures()).isEqualTo(FeatureRecord.FEATURE_COLUMNS.size());
        assertThat(report.getTotalSamples()).isEqualTo(100);
        assertThat(report.getTrain().getMin()).isGreaterThanOrEqualTo(0.0);
        assertThat(report.getTrain().getMax()).isLessThanOrEqualTo(1.0);
    }
}
