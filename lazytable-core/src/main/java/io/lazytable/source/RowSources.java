package io.lazytable.source;

import io.lazytable.core.UnknownRowSourceException;
import io.lazytable.kernel.selection.IntervalSelector;
import io.lazytable.kernel.selection.RowSelector;
import io.lazytable.kernel.selection.TimeFrame;
import io.lazytable.kernel.selection.TimeInterval;
import io.lazytable.kernel.selection.TimestampSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves textual row sources into row selectors.
 * <p>
 * Recognized forms:
 * <ul>
 *   <li>{@code "TimeFrame: <key>"} - one row per frame of the time frame</li>
 *   <li>{@code "Events: <key>"} - one row per event of an event series</li>
 *   <li>{@code "Intervals: <key>"} - one row per interval of an interval series,
 *       shaped by an {@link IntervalCapture}</li>
 * </ul>
 */
public final class RowSources {

    private static final Logger LOG = LoggerFactory.getLogger(RowSources.class);

    public static final String TIME_FRAME_PREFIX = "TimeFrame: ";
    public static final String EVENTS_PREFIX = "Events: ";
    public static final String INTERVALS_PREFIX = "Intervals: ";

    private RowSources() {
    }

    public static RowSelector resolve(String rowSource, TimeSeriesCatalog catalog) {
        return resolve(rowSource, catalog, IntervalCapture.defaults());
    }

    /**
     * Resolve a row source.
     *
     * @param rowSource textual source, e.g. {@code "Events: Neuron1Spikes"}
     * @param catalog   where the named data lives
     * @param capture   how interval rows are shaped; ignored by the other forms
     * @return the selector
     * @throws UnknownRowSourceException if the form is not recognized or the named data is missing
     */
    public static RowSelector resolve(String rowSource, TimeSeriesCatalog catalog, IntervalCapture capture) {
        Objects.requireNonNull(rowSource, "rowSource");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(capture, "capture");

        RowSelector selector;
        if (rowSource.startsWith(TIME_FRAME_PREFIX)) {
            selector = timeFrameRows(rowSource, rowSource.substring(TIME_FRAME_PREFIX.length()), catalog);
        } else if (rowSource.startsWith(EVENTS_PREFIX)) {
            selector = eventRows(rowSource, rowSource.substring(EVENTS_PREFIX.length()), catalog);
        } else if (rowSource.startsWith(INTERVALS_PREFIX)) {
            selector = intervalRows(rowSource, rowSource.substring(INTERVALS_PREFIX.length()), catalog, capture);
        } else {
            throw new UnknownRowSourceException(rowSource, "Unknown row source format");
        }
        LOG.debug("Resolved '{}' to {} rows", rowSource, selector.length());
        return selector;
    }

    private static RowSelector timeFrameRows(String rowSource, String key, TimeSeriesCatalog catalog) {
        TimeFrame timeFrame = catalog.timeFrame(key)
                .orElseThrow(() -> new UnknownRowSourceException(rowSource, "TimeFrame not found"));
        long[] frames = new long[timeFrame.totalFrameCount()];
        for (int i = 0; i < frames.length; i++) {
            frames[i] = i;
        }
        return TimestampSelector.of(timeFrame, frames);
    }

    private static RowSelector eventRows(String rowSource, String key, TimeSeriesCatalog catalog) {
        long[] events = catalog.events(key)
                .orElseThrow(() -> new UnknownRowSourceException(rowSource, "Event series not found"));
        return TimestampSelector.of(timeFrameOf(rowSource, key, catalog), events);
    }

    private static RowSelector intervalRows(String rowSource, String key, TimeSeriesCatalog catalog,
                                            IntervalCapture capture) {
        List<TimeInterval> intervals = catalog.intervals(key)
                .orElseThrow(() -> new UnknownRowSourceException(rowSource, "Interval series not found"));
        TimeFrame timeFrame = timeFrameOf(rowSource, key, catalog);
        if (capture.mode() == IntervalCapture.Mode.AS_IS) {
            return IntervalSelector.of(timeFrame, intervals);
        }

        long lastFrame = timeFrame.totalFrameCount() - 1L;
        List<TimeInterval> rows = new ArrayList<>(intervals.size());
        for (TimeInterval interval : intervals) {
            long anchor = capture.mode() == IntervalCapture.Mode.AROUND_START ? interval.start() : interval.end();
            long start = Math.max(anchor - capture.captureRange(), 0L);
            long end = Math.max(start, Math.min(anchor + capture.captureRange(), lastFrame));
            rows.add(new TimeInterval(start, end));
        }
        return IntervalSelector.of(timeFrame, rows);
    }

    private static TimeFrame timeFrameOf(String rowSource, String dataKey, TimeSeriesCatalog catalog) {
        String timeFrameKey = catalog.timeFrameKeyOf(dataKey)
                .orElseThrow(() -> new UnknownRowSourceException(rowSource, "No time frame recorded for " + dataKey));
        return catalog.timeFrame(timeFrameKey)
                .orElseThrow(() -> new UnknownRowSourceException(rowSource, "TimeFrame not found: " + timeFrameKey));
    }
}
