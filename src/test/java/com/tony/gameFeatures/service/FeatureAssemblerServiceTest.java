package com.tony.gameFeatures.service;

import com.tony.gameFeatures.GameEventFixtures;
import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.GameEvent;
import com.tony.gameFeatures.store.EventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.tony.gameFeatures.GameEventFixtures.day;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureAssemblerServiceTest {

    private final FeatureAssemblerService assembler = new FeatureAssemblerService(GameEventFixtures.calculator());
    private final MatchupFeatureService matchups = new MatchupFeatureService(GameEventFixtures.calculator());

    @Test
    @DisplayName("Trois matchs X/Y : chaque ligne ne voit que le passé")
    void shouldAssembleRivalry() {
        List<FeatureRecord> records = assembler.assemble(EventStore.build(GameEventFixtures.threeGameRivalry()), 0, 10);

        assertThat(records).extracting(FeatureRecord::getEventId).containsExactly("g1", "g2", "g3");

        Map<String, Double> first = records.get(0).toFeatureVector();
        assertThat(first.get("a_games_played")).isZero();
        assertThat(first.get("h2h_games")).isZero();
        assertThat(first.get("a_rest_days")).isEqualTo(999.0);

        // g2 : Y (côté A) reçoit X
        Map<String, Double> second = records.get(1).toFeatureVector();
        assertThat(second.get("a_win_pct")).isZero();
        assertThat(second.get("b_win_pct")).isEqualTo(1.0);
        assertThat(second.get("a_streak")).isEqualTo(-1.0);
        assertThat(second.get("b_streak")).isEqualTo(1.0);
        assertThat(second.get("h2h_games")).isEqualTo(1.0);
        assertThat(second.get("a_h2h_win_pct")).isZero();
        assertThat(second.get("a_rest_days")).isEqualTo(2.0);

        FeatureRecord third = records.get(2);
        assertThat(third.getFeaturesA().getForm().getGamesPlayed()).isEqualTo(2);
        assertThat(third.getFeaturesA().getForm().getWinPct()).isEqualTo(0.5);
        assertThat(third.getFeaturesA().getStreak()).isEqualTo(-1);
        assertThat(third.getFeaturesB().getStreak()).isEqualTo(1);
        assertThat(third.getFeaturesA().getRestDays()).isEqualTo(3);
        assertThat(third.getHeadToHead().getGames()).isEqualTo(2);
        assertThat(third.getHeadToHead().getWinsA()).isEqualTo(1);
        assertThat(third.getHeadToHead().getWinsB()).isEqualTo(1);
        assertThat(third.getOutcome().getHomeWin()).isEqualTo(1);
        assertThat(third.target("score_a")).isEqualTo(110.0);
    }

    @Test
    @DisplayName("Les matchs sans historique suffisant sont ignorés")
    void shouldSkipEventsWithoutEnoughHistory() {
        EventStore store = EventStore.build(GameEventFixtures.threeGameRivalry());

        assertThat(assembler.assemble(store, 1, 10)).extracting(FeatureRecord::getEventId).containsExactly("g2", "g3");
        assertThat(assembler.assemble(store, 2, 10)).extracting(FeatureRecord::getEventId).containsExactly("g3");
        assertThat(assembler.assemble(store, 3, 10)).isEmpty();
    }

    @Test
    @DisplayName("Journal vide : aucune ligne")
    void shouldHandleEmptyStore() {
        assertThat(assembler.assemble(EventStore.build(List.of()), 0, 10)).isEmpty();
    }

    @Test
    @DisplayName("Sans résultat demandé, les lignes n'ont pas de label")
    void shouldOmitOutcomeWhenAsked() {
        List<FeatureRecord> records = assembler.assemble(EventStore.build(GameEventFixtures.threeGameRivalry()),
                AssemblyOptions.builder().includeOutcome(false).build());

        assertThat(records).hasSize(3).noneMatch(FeatureRecord::hasOutcome);
    }

    @Test
    @DisplayName("Options invalides refusées")
    void shouldRejectInvalidOptions() {
        EventStore store = EventStore.build(GameEventFixtures.threeGameRivalry());

        assertThatThrownBy(() -> assembler.assemble(store, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> assembler.assemble(store, -1, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Deux passages donnent exactement les mêmes lignes")
    void shouldBeDeterministic() {
        EventStore store = EventStore.build(GameEventFixtures.randomLog(21, 300, 8));

        assertThat(assembler.assemble(store, 3, 10)).isEqualTo(assembler.assemble(store, 3, 10));
    }

    @Test
    @DisplayName("Le mode parallèle produit les mêmes lignes, dans le même ordre")
    void parallelShouldMatchSequential() {
        EventStore store = EventStore.build(GameEventFixtures.randomLog(5, 500, 10));
        AssemblyOptions sequential = AssemblyOptions.builder().windowSize(8).h2hWindowSize(4).minHistoryGames(2).build();
        AssemblyOptions parallel = sequential.toBuilder().parallel(true).build();

        assertThat(assembler.assemble(store, parallel)).isEqualTo(assembler.assemble(store, sequential));
    }

    @Test
    @DisplayName("Les lignes sortent dans l'ordre chronologique du journal")
    void recordsShouldFollowStoreOrder() {
        EventStore store = EventStore.build(GameEventFixtures.randomLog(9, 200, 6));

        List<FeatureRecord> records = assembler.assemble(store, 0, 10);

        assertThat(records).extracting(FeatureRecord::getEventId)
                .containsExactlyElementsOf(store.sortedEvents().stream().map(GameEvent::getId).toList());
    }

    @Test
    @DisplayName("Aucune fuite : chaque ligne se recalcule à l'identique sur le journal tronqué à sa date")
    void shouldNotLeakFutureEvents() {
        List<GameEvent> events = GameEventFixtures.randomLog(42, 150, 5);
        EventStore store = EventStore.build(events);
        AssemblyOptions options = AssemblyOptions.builder().windowSize(5).h2hWindowSize(3).build();

        for (FeatureRecord record : assembler.assemble(store, options)) {
            List<GameEvent> past = events.stream()
                    .filter(e -> e.getTimestamp().isBefore(record.getTimestamp()))
                    .toList();
            FeatureRecord replay = matchups.featuresFor(EventStore.build(past),
                    record.getParticipantAId(), record.getParticipantBId(), record.getHomeSide(),
                    record.getTimestamp(), options);

            assertThat(replay.toFeatureVector())
                    .as("match %s", record.getEventId())
                    .isEqualTo(record.toFeatureVector());
        }
    }

    @Test
    @DisplayName("Le vecteur suit l'ordre des colonnes déclarées")
    void featureVectorShouldFollowColumns() {
        FeatureRecord record = assembler.assemble(EventStore.build(GameEventFixtures.threeGameRivalry()), 0, 10).get(2);

        assertThat(record.toFeatureVector().keySet()).containsExactlyElementsOf(FeatureRecord.FEATURE_COLUMNS);
        assertThat(record.toFeatureArray()).hasSize(FeatureRecord.FEATURE_COLUMNS.size());
        assertThat(record.getTimestamp()).isEqualTo(day(6));
    }
}
