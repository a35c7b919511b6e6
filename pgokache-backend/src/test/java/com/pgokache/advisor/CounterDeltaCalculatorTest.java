package com.pgokache.advisor;

import com.pgokache.model.QueryStat;
import com.pgokache.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CounterDeltaCalculatorTest {

    private final CounterDeltaCalculator calculator = new CounterDeltaCalculator();

    private static QueryStat stat(String id, long calls, double totalTimeMs, long read) {
        return QueryStat.builder()
                .queryId(id)
                .queryNorm("SELECT * FROM t WHERE id = $1")
                .calls(calls)
                .totalTimeMs(totalTimeMs)
                .meanTimeMs(totalTimeMs / calls)
                .rows(calls)
                .sharedBlksRead(read)
                .build();
    }

    private static Snapshot snapshot(long id, QueryStat... stats) {
        return Snapshot.builder()
                .id(id)
                .instanceId(1L)
                .capturedAt(OffsetDateTime.now())
                .queryStats(List.of(stats))
                .build();
    }

    @Test
    void withoutPreviousSnapshotUsesAbsoluteValues() {
        List<EffectiveStat> stats = calculator.effectiveStats(snapshot(1, stat("a", 10, 100, 5)), null);

        assertThat(stats).singleElement().satisfies(s -> {
            assertThat(s.getBasis()).isEqualTo(EffectiveStat.Basis.ABSOLUTE);
            assertThat(s.getStat().getCalls()).isEqualTo(10);
        });
    }

    @Test
    void subtractsPreviousCounters() {
        List<EffectiveStat> stats = calculator.effectiveStats(
                snapshot(2, stat("a", 150, 1600, 900)),
                snapshot(1, stat("a", 100, 1000, 400)));

        assertThat(stats).singleElement().satisfies(s -> {
            assertThat(s.getBasis()).isEqualTo(EffectiveStat.Basis.DELTA);
            assertThat(s.getStat().getCalls()).isEqualTo(50);
            assertThat(s.getStat().getTotalTimeMs()).isEqualTo(600.0);
            assertThat(s.getStat().getMeanTimeMs()).isEqualTo(12.0);
            assertThat(s.getStat().getSharedBlksRead()).isEqualTo(500);
        });
    }

    @Test
    void counterGoingBackwardsMeansResetAndUsesLaterValues() {
        List<EffectiveStat> stats = calculator.effectiveStats(
                snapshot(2, stat("a", 3, 30, 10)),
                snapshot(1, stat("a", 100, 1000, 400)));

        assertThat(stats).singleElement().satisfies(s -> {
            assertThat(s.getBasis()).isEqualTo(EffectiveStat.Basis.RESET);
            assertThat(s.getStat().getCalls()).isEqualTo(3);
            assertThat(s.getStat().getTotalTimeMs()).isEqualTo(30.0);
        });
    }

    @Test
    void idleQueriesAreDroppedAndNewOnesKeptAbsolute() {
        List<EffectiveStat> stats = calculator.effectiveStats(
                snapshot(2, stat("idle", 100, 1000, 400), stat("new", 7, 70, 1)),
                snapshot(1, stat("idle", 100, 1000, 400)));

        assertThat(stats).extracting(s -> s.getStat().getQueryId()).containsExactly("new");
        assertThat(stats.get(0).getBasis()).isEqualTo(EffectiveStat.Basis.ABSOLUTE);
    }

    @Test
    void repeatedQueryIdsAreSummedBeforeSubtracting() {
        // Same statement run by two roles: one entry per user in pg_stat_statements.
        List<EffectiveStat> stats = calculator.effectiveStats(
                snapshot(2, stat("q", 1100, 1100, 50), stat("other", 5, 5, 0), stat("q", 20, 40, 10)),
                snapshot(1, stat("q", 1000, 1000, 40), stat("q", 10, 20, 5)));

        assertThat(stats).extracting(s -> s.getStat().getQueryId()).containsExactly("q", "other");
        assertThat(stats.get(0)).satisfies(s -> {
            assertThat(s.getBasis()).isEqualTo(EffectiveStat.Basis.DELTA);
            assertThat(s.getStat().getCalls()).isEqualTo(110);
            assertThat(s.getStat().getTotalTimeMs()).isEqualTo(120.0);
            assertThat(s.getStat().getSharedBlksRead()).isEqualTo(15);
        });
    }

    @Test
    void emptyLatestSnapshotYieldsNothing() {
        assertThat(calculator.effectiveStats(snapshot(1), null)).isEmpty();
    }
}
