package io.lazytable.source;

import io.lazytable.kernel.selection.TimeFrame;
import io.lazytable.kernel.selection.TimeInterval;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Map-backed {@link TimeSeriesCatalog}.
 */
public final class InMemoryTimeSeriesCatalog implements TimeSeriesCatalog {

    private final ConcurrentMap<String, TimeFrame> timeFrames = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, long[]> events = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<TimeInterval>> intervals = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> timeFrameKeys = new ConcurrentHashMap<>();

    public InMemoryTimeSeriesCatalog putTimeFrame(String key, TimeFrame timeFrame) {
        timeFrames.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(timeFrame, "timeFrame"));
        return this;
    }

    public InMemoryTimeSeriesCatalog putEvents(String key, String timeFrameKey, long... frameIndices) {
        Objects.requireNonNull(frameIndices, "frameIndices");
        events.put(Objects.requireNonNull(key, "key"), frameIndices.clone());
        timeFrameKeys.put(key, Objects.requireNonNull(timeFrameKey, "timeFrameKey"));
        return this;
    }

    public InMemoryTimeSeriesCatalog putIntervals(String key, String timeFrameKey, List<TimeInterval> series) {
        intervals.put(Objects.requireNonNull(key, "key"), List.copyOf(series));
        timeFrameKeys.put(key, Objects.requireNonNull(timeFrameKey, "timeFrameKey"));
        return this;
    }

    @Override
    public Optional<TimeFrame> timeFrame(String key) {
        return Optional.ofNullable(timeFrames.get(key));
    }

    @Override
    public Optional<long[]> events(String key) {
        long[] series = events.get(key);
        return series == null ? Optional.empty() : Optional.of(series.clone());
    }

    @Override
    public Optional<List<TimeInterval>> intervals(String key) {
        return Optional.ofNullable(intervals.get(key));
    }

    @Override
    public Optional<String> timeFrameKeyOf(String dataKey) {
        return Optional.ofNullable(timeFrameKeys.get(dataKey));
    }
}
