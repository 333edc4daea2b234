package io.lazytable.source;

import io.lazytable.kernel.selection.TimeFrame;
import io.lazytable.kernel.selection.TimeInterval;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the time-indexed data a row source can name.
 */
public interface TimeSeriesCatalog {

    Optional<TimeFrame> timeFrame(String key);

    /**
     * Frame indices of an event series, in order.
     */
    Optional<long[]> events(String key);

    Optional<List<TimeInterval>> intervals(String key);

    /**
     * Key of the time frame a data series is indexed by.
     */
    Optional<String> timeFrameKeyOf(String dataKey);
}
