package com.tony.gameFeatures.job;

import com.tony.gameFeatures.config.FeatureProperties;
import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.dataset.Dataset;
import com.tony.gameFeatures.model.dataset.DatasetOptions;
import com.tony.gameFeatures.model.dataset.DatasetReport;
import com.tony.gameFeatures.service.AssemblyOptions;
import com.tony.gameFeatures.service.DatasetBuilderService;
import com.tony.gameFeatures.service.DatasetExportService;
import com.tony.gameFeatures.service.EventImportService;
import com.tony.gameFeatures.service.FeatureAssemblerService;
import com.tony.gameFeatures.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Pipeline batch lancé au démarrage : CSV -> EventStore -> features -> dataset sur disque.
 * Ne fait rien si {@code features.pipeline.input} n'est pas renseigné.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeaturePipelineJob implements CommandLineRunner {

    private final FeatureProperties properties;
    private final EventImportService importService;
    private final FeatureAssemblerService assemblerService;
    private final DatasetBuilderService datasetBuilder;
    private final DatasetExportService exportService;

    @Override
    public void run(String... args) {
        FeatureProperties.Pipeline pipeline = properties.getPipeline();
        if (pipeline.getInput() == null || pipeline.getInput().isBlank()) {
            log.info("Aucun fichier d'entrée (features.pipeline.input), pipeline non lancé.");
            return;
        }

        log.info("🚀 Pipeline features : {}", pipeline.getInput());
        try {
            runPipeline(Path.of(pipeline.getInput()), pipeline);
            log.info("✅ Pipeline terminé.");
        } catch (RuntimeException e) {
            log.error("❌ Echec du pipeline features", e);
            throw e;
        }
    }

    Path runPipeline(Path input, FeatureProperties.Pipeline pipeline) {
        EventImportService.ImportReport imported = importService.importEvents(input);

        // Un journal invalide arrête tout ici, avant la moindre construction d'index
        EventStore store = EventStore.build(imported.getEvents());

        List<FeatureRecord> records = assemblerService.assemble(store, AssemblyOptions.from(properties));

        Path outputDir = Path.of(pipeline.getOutputDir());
        exportService.writeFeatureRecords(records,
                outputDir.resolve(pipeline.getDatasetName()).resolve(pipeline.getVersion()).resolve("features.csv"));

        if (records.isEmpty()) {
            log.warn("Aucune ligne de features (historique minimum trop élevé ?), dataset non construit.");
            return null;
        }
        if (!properties.isIncludeOutcome()) {
            log.warn("features.include-outcome=false : pas de cible, dataset non construit.");
            return null;
        }

        Dataset dataset = datasetBuilder.buildDataset(records, DatasetOptions.from(pipeline));
        DatasetReport report = datasetBuilder.report(dataset);
        log.info("Dataset : {} features, train={}, val={}, test={} (moyenne cible train = {})",
                report.getNFeatures(), report.getTrainSamples(), report.getValSamples(), report.getTestSamples(),
                String.format("%.3f", report.getTrain().getMean()));

        return exportService.export(dataset, outputDir, pipeline.getDatasetName(), pipeline.getVersion());
    }
}
