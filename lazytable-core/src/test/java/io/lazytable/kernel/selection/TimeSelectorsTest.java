package io.lazytable.kernel.selection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeSelectorsTest {

    private final TimeFrame frame = TimeFrame.of("ephys", 0, 10, 20, 30, 40, 50);

    @Test
    void timestampDescriptorResolvesAbsoluteTime() {
        var selector = TimestampSelector.of(frame, 1, 3, 5);
        var descriptor = (RowDescriptor.Timestamp) selector.describe(1);

        assertThat(descriptor.frameIndex()).isEqualTo(3);
        assertThat(descriptor.time()).isEqualTo(30);
        assertThat(descriptor.label()).isEqualTo("t=3");
    }

    @Test
    void timestampSliceExportsOnlyItsWindow() {
        var window = TimestampSelector.of(frame, 1, 3, 5).slice(1, 2);

        assertThat(window.toLongArray()).containsExactly(3L, 5L);
        assertThat(window.frame()).isSameAs(frame);
    }

    @Test
    void intervalAccessorsFollowTheWindow() {
        var selector = IntervalSelector.of(frame,
                new TimeInterval(0, 2), new TimeInterval(2, 4), new TimeInterval(4, 6));
        var window = selector.slice(1, 2);

        assertThat(window.intervalAt(0)).isEqualTo(new TimeInterval(2, 4));
        assertThat(window.startAt(1)).isEqualTo(4);
        assertThat(window.endAt(1)).isEqualTo(6);
        assertThat(window.describe(1).label()).isEqualTo("[4, 6)");
    }

    @Test
    void intervalIsHalfOpen() {
        var interval = new TimeInterval(5, 8);

        assertThat(interval.contains(5)).isTrue();
        assertThat(interval.contains(7)).isTrue();
        assertThat(interval.contains(8)).isFalse();
        assertThat(interval.duration()).isEqualTo(3);
    }

    @Test
    void intervalRejectsReversedBounds() {
        assertThatThrownBy(() -> new TimeInterval(8, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timeFrameRejectsDecreasingTimes() {
        assertThatThrownBy(() -> TimeFrame.of("bad", 0, 10, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("frame 2");
    }

    @Test
    void timeFrameBoundsAreChecked() {
        assertThat(frame.totalFrameCount()).isEqualTo(6);
        assertThatThrownBy(() -> frame.timeAt(6)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void sequentialFrameMapsIndexToItself() {
        var sequential = TimeFrame.sequential("video", 4);

        assertThat(sequential.timeAt(3)).isEqualTo(3);
        assertThat(sequential.name()).isEqualTo("video");
    }
}
