package com.tony.gameFeatures.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBean;
import com.opencsv.bean.CsvToBeanBuilder;
import com.opencsv.exceptions.CsvException;
import com.tony.gameFeatures.model.GameEvent;
import com.tony.gameFeatures.model.Side;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.input.BOMInputStream;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lecture d'un journal de matchs au format CSV.
 * Colonnes : id, date, participant_a, participant_b, score_a, score_b, home (A ou B, A par défaut).
 * Les lignes illisibles sont ignorées ; la validation métier reste le rôle d'EventStore.build.
 */
@Service
@Slf4j
public class EventImportService {

    private static final DateTimeFormatter FOOTBALL_DATA_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public ImportReport importEvents(Path csvFile) {
        log.info("📥 Import des matchs depuis {}", csvFile);
        // Les exports Excel commencent souvent par un BOM, collé sinon au nom de la première colonne
        try (Reader reader = new InputStreamReader(
                BOMInputStream.builder().setInputStream(Files.newInputStream(csvFile)).get(),
                StandardCharsets.UTF_8)) {
            return importEvents(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture impossible : " + csvFile, e);
        }
    }

    public ImportReport importEvents(Reader reader) {
        CsvToBean<GameEventRow> csvToBean = new CsvToBeanBuilder<GameEventRow>(reader)
                .withType(GameEventRow.class)
                .withSeparator(',')
                .withIgnoreLeadingWhiteSpace(true)
                .withThrowExceptions(false)
                .build();
        List<GameEventRow> rows = csvToBean.parse();

        List<GameEvent> events = new ArrayList<>(rows.size());
        int skipped = 0;

        // Lignes que OpenCSV n'a pas pu mapper (nombre de colonnes incorrect...)
        for (CsvException e : csvToBean.getCapturedExceptions()) {
            skipped++;
            log.warn("Ligne {} ignorée : {}", e.getLineNumber(), e.getMessage());
        }
        for (GameEventRow row : rows) {
            try {
                events.add(toEvent(row));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                skipped++;
                log.warn("Ligne ignorée ({}) : {}", row.getId(), e.getMessage());
            }
        }

        log.info("✅ {} matchs lus, {} lignes ignorées", events.size(), skipped);
        return new ImportReport(List.copyOf(events), skipped);
    }

    private GameEvent toEvent(GameEventRow row) {
        if (isBlank(row.getId())) throw new IllegalArgumentException("id manquant");
        if (isBlank(row.getDate())) throw new IllegalArgumentException("date manquante");

        return GameEvent.builder()
                .id(row.getId().trim())
                .timestamp(parseDate(row.getDate().trim()))
                .participantAId(trimToNull(row.getParticipantA()))
                .participantBId(trimToNull(row.getParticipantB()))
                .scoreA(parseScore(row.getScoreA()))
                .scoreB(parseScore(row.getScoreB()))
                .homeSide(parseSide(row.getHome()))
                .build();
    }

    static LocalDateTime parseDate(String value) {
        if (value.contains("/")) {
            return LocalDate.parse(value, FOOTBALL_DATA_FORMAT).atStartOfDay();
        }
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay();
        }
        return LocalDateTime.parse(value);
    }

    private static double parseScore(String value) {
        if (isBlank(value)) throw new IllegalArgumentException("score manquant");
        return Double.parseDouble(value.trim()); // NumberFormatException est une IllegalArgumentException
    }

    private static Side parseSide(String value) {
        if (isBlank(value)) return Side.A;
        return Side.valueOf(value.trim().toUpperCase());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    @Value
    public static class ImportReport {
        List<GameEvent> events;
        int skipped;
    }

    @Data
    public static class GameEventRow {
        @CsvBindByName(column = "id") private String id;
        @CsvBindByName(column = "date") private String date;
        @CsvBindByName(column = "participant_a") private String participantA;
        @CsvBindByName(column = "participant_b") private String participantB;
        @CsvBindByName(column = "score_a") private String scoreA;
        @CsvBindByName(column = "score_b") private String scoreB;
        @CsvBindByName(column = "home") private String home;
    }
}
