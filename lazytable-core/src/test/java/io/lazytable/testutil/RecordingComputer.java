package io.lazytable.testutil;

import io.lazytable.kernel.BoolColumn;
import io.lazytable.kernel.ColumnComputer;
import io.lazytable.kernel.ColumnSpec;
import io.lazytable.kernel.ColumnVector;
import io.lazytable.kernel.ComputeResult;
import io.lazytable.kernel.DoubleColumn;
import io.lazytable.kernel.FloatColumn;
import io.lazytable.kernel.IntColumn;
import io.lazytable.kernel.LongColumn;
import io.lazytable.kernel.VectorColumn;
import io.lazytable.kernel.selection.RowDescriptor;
import io.lazytable.kernel.selection.RowSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiPredicate;

/**
 * Deterministic computer that derives every value from the row's addressing value
 * and records each call.
 * <p>
 * For a row keyed {@code k} (index, frame index, or interval start):
 * {@code int -> k}, {@code long -> k}, {@code double/float -> k / 2},
 * {@code bool -> k is even}, vectors {@code -> [k, k + 1]} in the element type,
 * scaled by the column's offset {@link #offset()}.
 */
public final class RecordingComputer implements ColumnComputer {

    public record Call(RowSelector window, ColumnSpec spec) {
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile BiPredicate<RowSelector, ColumnSpec> failWhen = (window, spec) -> false;
    private volatile long offset;

    public static long key(RowDescriptor descriptor) {
        if (descriptor instanceof RowDescriptor.Index index) {
            return index.index();
        }
        if (descriptor instanceof RowDescriptor.Timestamp timestamp) {
            return timestamp.frameIndex();
        }
        return ((RowDescriptor.Interval) descriptor).interval().start();
    }

    public RecordingComputer failWhen(BiPredicate<RowSelector, ColumnSpec> failWhen) {
        this.failWhen = failWhen;
        return this;
    }

    /**
     * Add a constant to every key, simulating a change in the underlying data.
     */
    public RecordingComputer offset(long offset) {
        this.offset = offset;
        return this;
    }

    public long offset() {
        return offset;
    }

    @Override
    public ComputeResult compute(RowSelector window, ColumnSpec spec) {
        calls.add(new Call(window, spec));
        if (failWhen.test(window, spec)) {
            return ComputeResult.failure("scripted failure for " + spec.name());
        }
        return ComputeResult.success(derive(window, spec));
    }

    private ColumnVector derive(RowSelector window, ColumnSpec spec) {
        int size = window.length();
        long[] keys = new long[size];
        for (int row = 0; row < size; row++) {
            keys[row] = key(window.describe(row)) + offset;
        }
        if (spec.outputType().vector()) {
            return deriveVector(keys, spec);
        }
        switch (spec.outputType().elementType()) {
            case INT: {
                int[] values = new int[size];
                for (int i = 0; i < size; i++) {
                    values[i] = (int) keys[i];
                }
                return IntColumn.of(values);
            }
            case LONG:
                return LongColumn.of(keys);
            case FLOAT: {
                float[] values = new float[size];
                for (int i = 0; i < size; i++) {
                    values[i] = keys[i] / 2f;
                }
                return FloatColumn.of(values);
            }
            case DOUBLE: {
                double[] values = new double[size];
                for (int i = 0; i < size; i++) {
                    values[i] = keys[i] / 2.0;
                }
                return DoubleColumn.of(values);
            }
            default: {
                boolean[] values = new boolean[size];
                for (int i = 0; i < size; i++) {
                    values[i] = keys[i] % 2 == 0;
                }
                return BoolColumn.of(values);
            }
        }
    }

    private static ColumnVector deriveVector(long[] keys, ColumnSpec spec) {
        switch (spec.outputType().elementType()) {
            case DOUBLE: {
                List<double[]> rows = new ArrayList<>();
                for (long key : keys) {
                    rows.add(new double[]{key, key + 1});
                }
                return VectorColumn.ofDoubles(rows);
            }
            case INT: {
                List<int[]> rows = new ArrayList<>();
                for (long key : keys) {
                    rows.add(new int[]{(int) key, (int) key + 1});
                }
                return VectorColumn.ofInts(rows);
            }
            default:
                throw new UnsupportedOperationException("vector type not scripted: " + spec.outputType());
        }
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    /**
     * First row key of every window computed for the given column, in call order.
     */
    public List<Long> windowStarts(String columnName) {
        List<Long> starts = new ArrayList<>();
        for (Call call : calls) {
            if (call.spec().name().equals(columnName) && !call.window().isEmpty()) {
                starts.add(key(call.window().describe(0)));
            }
        }
        return starts;
    }

    public void reset() {
        calls.clear();
    }
}
