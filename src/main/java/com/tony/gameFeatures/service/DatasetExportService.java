package com.tony.gameFeatures.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.dataset.Dataset;
import com.tony.gameFeatures.model.dataset.DatasetMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Écriture et relecture sur disque : table de features brute, splits X_* / y_* et metadata.json.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatasetExportService {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Écrit le dataset dans {@code outputDir/name/version} et renvoie ce dossier.
     */
    public Path export(Dataset dataset, Path outputDir, String name, String version) {
        Path dir = outputDir.resolve(name).resolve(version);
        try {
            Files.createDirectories(dir);

            String[] featureHeader = dataset.getFeatureNames().toArray(String[]::new);
            writeMatrix(dir.resolve("X_train.csv"), featureHeader, dataset.getXTrain());
            writeMatrix(dir.resolve("X_val.csv"), featureHeader, dataset.getXVal());
            writeMatrix(dir.resolve("X_test.csv"), featureHeader, dataset.getXTest());

            writeTarget(dir.resolve("y_train.csv"), dataset.getYTrain());
            writeTarget(dir.resolve("y_val.csv"), dataset.getYVal());
            writeTarget(dir.resolve("y_test.csv"), dataset.getYTest());

            DatasetMetadata metadata = DatasetMetadata.builder()
                    .name(name)
                    .version(version)
                    .createdAt(LocalDateTime.now(clock).toString())
                    .featureNames(dataset.getFeatureNames())
                    .targetName(dataset.getTargetName())
                    .trainSamples(dataset.getXTrain().length)
                    .valSamples(dataset.getXVal().length)
                    .testSamples(dataset.getXTest().length)
                    .featureCount(dataset.getFeatureNames().size())
                    .build();
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(dir.resolve("metadata.json").toFile(), metadata);
        } catch (IOException e) {
            throw new UncheckedIOException("Export du dataset impossible vers " + dir, e);
        }

        log.info("💾 Dataset {} {} sauvegardé dans {}", name, version, dir);
        return dir;
    }

    /**
     * Relit un dataset écrit par {@link #export}. Le scaler n'est pas sauvegardé : les matrices
     * relues sont déjà normalisées et {@code scaler} vaut null.
     */
    public Dataset load(Path outputDir, String name, String version) {
        Path dir = outputDir.resolve(name).resolve(version);
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Dataset introuvable : " + dir);
        }

        DatasetMetadata metadata = readMetadata(dir);
        try {
            Dataset dataset = Dataset.builder()
                    .xTrain(readMatrix(dir.resolve("X_train.csv")))
                    .xVal(readMatrix(dir.resolve("X_val.csv")))
                    .xTest(readMatrix(dir.resolve("X_test.csv")))
                    .yTrain(readTarget(dir.resolve("y_train.csv")))
                    .yVal(readTarget(dir.resolve("y_val.csv")))
                    .yTest(readTarget(dir.resolve("y_test.csv")))
                    .featureNames(List.copyOf(metadata.getFeatureNames()))
                    .targetName(metadata.getTargetName())
                    .build();
            log.info("📂 Dataset {} {} chargé : train={}, val={}, test={}", name, version,
                    dataset.getXTrain().length, dataset.getXVal().length, dataset.getXTest().length);
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture du dataset impossible dans " + dir, e);
        } catch (CsvException e) {
            throw new IllegalStateException("CSV invalide dans " + dir + " : " + e.getMessage(), e);
        }
    }

    public DatasetMetadata readMetadata(Path datasetDir) {
        try {
            return objectMapper.readValue(datasetDir.resolve("metadata.json").toFile(), DatasetMetadata.class);
        } catch (IOException e) {
            throw new UncheckedIOException("metadata.json illisible dans " + datasetDir, e);
        }
    }

    /**
     * Table complète (une ligne par match), utile pour inspecter les features à la main.
     */
    public void writeFeatureRecords(List<FeatureRecord> records, Path file) {
        boolean withTargets = records.stream().anyMatch(FeatureRecord::hasOutcome);

        List<String> header = new ArrayList<>(List.of("event_id", "date", "participant_a", "participant_b"));
        header.addAll(FeatureRecord.FEATURE_COLUMNS);
        if (withTargets) header.addAll(FeatureRecord.TARGET_COLUMNS);

        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(writer)) {
                csv.writeNext(header.toArray(String[]::new), false);
                for (FeatureRecord r : records) {
                    List<String> line = new ArrayList<>(header.size());
                    line.add(r.getEventId());
                    line.add(r.getTimestamp().toString());
                    line.add(r.getParticipantAId());
                    line.add(r.getParticipantBId());
                    for (Map.Entry<String, Double> e : r.toFeatureVector().entrySet()) {
                        line.add(String.valueOf(e.getValue()));
                    }
                    if (withTargets) {
                        for (String target : FeatureRecord.TARGET_COLUMNS) {
                            line.add(r.hasOutcome() ? String.valueOf(r.target(target)) : "");
                        }
                    }
                    csv.writeNext(line.toArray(String[]::new), false);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture impossible : " + file, e);
        }
        log.info("💾 {} lignes de features écrites dans {}", records.size(), file);
    }

    private void writeMatrix(Path file, String[] header, double[][] matrix) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            csv.writeNext(header, false);
            for (double[] row : matrix) {
                String[] values = new String[row.length];
                for (int i = 0; i < row.length; i++) values[i] = String.valueOf(row[i]);
                csv.writeNext(values, false);
            }
        }
    }

    private double[][] readMatrix(Path file) throws IOException, CsvException {
        List<String[]> lines = readRows(file);
        double[][] matrix = new double[lines.size()][];
        for (int r = 0; r < lines.size(); r++) {
            String[] line = lines.get(r);
            double[] row = new double[line.length];
            for (int c = 0; c < line.length; c++) row[c] = Double.parseDouble(line[c]);
            matrix[r] = row;
        }
        return matrix;
    }

    private double[] readTarget(Path file) throws IOException, CsvException {
        return readRows(file).stream().mapToDouble(line -> Double.parseDouble(line[0])).toArray();
    }

    // Toutes les lignes sauf l'en-tête
    private List<String[]> readRows(Path file) throws IOException, CsvException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            List<String[]> all = csv.readAll();
            return all.isEmpty() ? List.of() : all.subList(1, all.size());
        }
    }

    private void writeTarget(Path file, double[] values) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            csv.writeNext(new String[]{"target"}, false);
            for (double v : values) {
                csv.writeNext(new String[]{String.valueOf(v)}, false);
            }
        }
    }
}
