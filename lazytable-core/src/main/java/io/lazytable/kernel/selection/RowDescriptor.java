package io.lazytable.kernel.selection;

/**
 * What a single row of a selector stands for, used to trace a displayed row
 * back to its source.
 */
public sealed interface RowDescriptor {

    /**
     * Row position within the selector that produced this descriptor.
     */
    int row();

    /**
     * Short human readable label, e.g. {@code "12"}, {@code "t=340"} or {@code "[10, 20)"}.
     */
    String label();

    record Index(int row, int index) implements RowDescriptor {
        @Override
        public String label() {
            return Integer.toString(index);
        }
    }

    record Timestamp(int row, long frameIndex, TimeFrame timeFrame) implements RowDescriptor {
        /**
         * Absolute time of the row's frame.
         */
        public long time() {
            return timeFrame.timeAt(frameIndex);
        }

        @Override
        public String label() {
            return "t=" + frameIndex;
        }
    }

    record Interval(int row, TimeInterval interval, TimeFrame timeFrame) implements RowDescriptor {
        @Override
        public String label() {
            return "[" + interval.start() + ", " + interval.end() + ")";
        }
    }
}
