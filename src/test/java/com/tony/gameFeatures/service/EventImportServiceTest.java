package com.tony.gameFeatures.service;

import com.tony.gameFeatures.model.GameEvent;
import com.tony.gameFeatures.model.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventImportServiceTest {

    private final EventImportService importService = new EventImportService();

    @Test
    @DisplayName("Lit le CSV et ignore les lignes illisibles")
    void shouldImportValidRowsAndSkipBrokenOnes() throws Exception {
        Path csv = Path.of(getClass().getResource("/games.csv").toURI());

        EventImportService.ImportReport report = importService.importEvents(csv);

        assertThat(report.getSkipped()).isEqualTo(2);
        assertThat(report.getEvents()).extracting(GameEvent::getId).containsExactly("g1", "g2", "g3", "g6");

        GameEvent first = report.getEvents().get(0);
        assertThat(first.getParticipantAId()).isEqualTo("Lakers");
        assertThat(first.getScoreA()).isEqualTo(110.0);
        assertThat(first.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 10, 1, 0, 0));
    }

    @Test
    @DisplayName("Formats de date et côté domicile")
    void shouldParseDatesAndHomeSide() throws Exception {
        Path csv = Path.of(getClass().getResource("/games.csv").toURI());

        EventImportService.ImportReport report = importService.importEvents(csv);

        GameEvent second = report.getEvents().get(1);
        assertThat(second.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 10, 3, 0, 0));
        assertThat(second.getHomeSide()).isEqualTo(Side.A);

        GameEvent third = report.getEvents().get(2);
        assertThat(third.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 10, 4, 19, 30));
        assertThat(third.getHomeSide()).isEqualTo(Side.B);
        assertThat(third.getParticipantBId()).isEqualTo("Lakers");
    }

    @Test
    @DisplayName("Côté domicile inconnu : ligne ignorée")
    void shouldSkipUnknownHomeSide() {
        String csv = "id,date,participant_a,participant_b,score_a,score_b,home\n"
                + "g1,2024-10-01,X,Y,1,0,Z\n"
                + "g2,2024-10-02,X,Y,1,0,b\n";

        EventImportService.ImportReport report = importService.importEvents(new StringReader(csv));

        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(report.getEvents()).singleElement().extracting(GameEvent::getHomeSide).isEqualTo(Side.B);
    }

    @Test
    @DisplayName("Ligne au nombre de colonnes incorrect : ignorée, le reste est importé")
    void shouldSkipRaggedRow() {
        String csv = "id,date,participant_a,participant_b,score_a,score_b,home\n"
                + "g1,2024-10-01,X,Y,1,0,A\n"
                + "g2,2024-10-02,X,Y,1,0\n"
                + "g3,2024-10-03,Y,X,2,1,A\n";

        EventImportService.ImportReport report = importService.importEvents(new StringReader(csv));

        assertThat(report.getEvents()).extracting(GameEvent::getId).containsExactly("g1", "g3");
        assertThat(report.getSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Fichier avec BOM UTF-8 : l'en-tête id est reconnu")
    void shouldIgnoreUtf8Bom(@TempDir Path dir) throws Exception {
        Path csv = dir.resolve("excel.csv");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = ("id,date,participant_a,participant_b,score_a,score_b,home\n"
                + "g1,2024-10-01,X,Y,1,0,A\n").getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(csv, content);

        EventImportService.ImportReport report = importService.importEvents(csv);

        assertThat(report.getSkipped()).isZero();
        assertThat(report.getEvents()).singleElement().extracting(GameEvent::getId).isEqualTo("g1");
    }

    @Test
    @DisplayName("Fichier absent : UncheckedIOException")
    void missingFileShouldFail() {
        assertThatThrownBy(() -> importService.importEvents(Path.of("does-not-exist.csv")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
