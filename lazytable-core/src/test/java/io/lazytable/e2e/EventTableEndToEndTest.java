package io.lazytable.e2e;

import io.lazytable.core.LazyTableConfiguration;
import io.lazytable.kernel.ColumnSpec;
import io.lazytable.kernel.OutputType;
import io.lazytable.kernel.ValueType;
import io.lazytable.kernel.selection.TimeFrame;
import io.lazytable.kernel.selection.TimeInterval;
import io.lazytable.runtime.ComputerRegistry;
import io.lazytable.runtime.TableAccessor;
import io.lazytable.source.IntervalCapture;
import io.lazytable.source.InMemoryTimeSeriesCatalog;
import io.lazytable.source.RowSources;
import io.lazytable.testutil.EventCountComputer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour periods as rows, spike trains as columns: the table a user browses when
 * checking which neurons fired in which trial.
 */
class EventTableEndToEndTest {

    private static final int TRIALS = 300;

    private InMemoryTimeSeriesCatalog catalog;
    private TableAccessor accessor;

    @BeforeEach
    void setUp() {
        List<TimeInterval> trials = new ArrayList<>();
        for (int i = 0; i < TRIALS; i++) {
            trials.add(new TimeInterval(i * 100L, i * 100L + 50));
        }
        catalog = new InMemoryTimeSeriesCatalog()
                .putTimeFrame("behavior_time", TimeFrame.sequential("behavior_time", TRIALS * 100))
                .putIntervals("BehaviorPeriods", "behavior_time", trials)
                // neuron 1 fires 10 frames into every trial, neuron 2 only in even trials
                .putEvents("Neuron1Spikes", "behavior_time", spikes(1, 10))
                .putEvents("Neuron2Spikes", "behavior_time", spikes(2, 20, 30));

        var events = new EventCountComputer(catalog);
        var registry = new ComputerRegistry()
                .register("Event Presence", events)
                .register("Event Count", events)
                .register("Event Gather", events);

        accessor = new TableAccessor(registry, LazyTableConfiguration.builder().pageSize(32).cacheCapacity(4).build());
        accessor.configure(
                RowSources.resolve("Intervals: BehaviorPeriods", catalog, IntervalCapture.asIs()),
                List.of(
                        new ColumnSpec("Neuron1_Present", "Neuron1Spikes", "Event Presence", OutputType.BOOL),
                        new ColumnSpec("Neuron1_Count", "Neuron1Spikes", "Event Count", OutputType.INT),
                        new ColumnSpec("Neuron2_Present", "Neuron2Spikes", "Event Presence", OutputType.BOOL),
                        new ColumnSpec("Neuron2_Count", "Neuron2Spikes", "Event Count", OutputType.INT),
                        new ColumnSpec("Neuron2_Times", "Neuron2Spikes", "Event Gather",
                                OutputType.vectorOf(ValueType.INT))));
    }

    private static long[] spikes(int everyNthTrial, int... offsets) {
        List<Long> times = new ArrayList<>();
        for (int trial = 0; trial < TRIALS; trial += everyNthTrial) {
            for (int offset : offsets) {
                times.add(trial * 100L + offset);
            }
        }
        return times.stream().mapToLong(Long::longValue).toArray();
    }

    @Test
    void everyTrialIsARow() {
        assertThat(accessor.rowCount()).isEqualTo(TRIALS);
        assertThat(accessor.header(4)).isEqualTo("Neuron2_Times");
        assertThat(accessor.rowDescriptor(3).label()).isEqualTo("[300, 350)");
    }

    @Test
    void cellsReflectSpikesInEachTrial() {
        assertThat(accessor.cell(0, 0)).isEqualTo("true");
        assertThat(accessor.cell(0, 1)).isEqualTo("1");
        assertThat(accessor.cell(0, 3)).isEqualTo("2");
        assertThat(accessor.cell(0, 4)).isEqualTo("20,30");
        assertThat(accessor.cell(299, 2)).isEqualTo("false");
        assertThat(accessor.cell(299, 4)).isEmpty();
        assertThat(accessor.cell(298, 4)).isEqualTo("20,30");
    }

    @Test
    void scrollingThroughTheTableKeepsTheCacheBounded() {
        for (int row = 0; row < TRIALS; row++) {
            assertThat(accessor.cell(row, 1)).isEqualTo("1");
        }

        assertThat(accessor.cachedPageCount()).isEqualTo(4);
        assertThat(accessor.materializedPageCount()).isEqualTo(10);
    }

    @Test
    void unknownSourceOnlyBreaksItsOwnColumnPages() {
        accessor.configure(
                RowSources.resolve("Intervals: BehaviorPeriods", catalog, IntervalCapture.asIs()),
                List.of(new ColumnSpec("Ghost", "Neuron9Spikes", "Event Count", OutputType.INT)));

        assertThat(accessor.cell(0, 0)).isEqualTo(TableAccessor.ERROR_CELL);
        assertThat(accessor.rowCount()).isEqualTo(TRIALS);
    }
}
