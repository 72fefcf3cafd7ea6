package com.sqlframe.resample;

import com.sqlframe.error.EmptyFrameException;
import com.sqlframe.error.NonMonotonicTimeException;
import com.sqlframe.frame.Field;
import com.sqlframe.frame.FieldType;
import com.sqlframe.frame.Frame;
import com.sqlframe.frame.Notice;
import com.sqlframe.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResamplerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration STEP = Duration.ofSeconds(10);
    private static final TimeRange RANGE = TimeRange.of(T0, T0.plusSeconds(40));

    private static Instant t(long seconds) {
        return T0.plusSeconds(seconds);
    }

    private static Frame frame(List<Instant> times, List<Double> values) {
        Field time = new Field("time", FieldType.TIME, false);
        Field value = new Field("value", FieldType.FLOAT64, true);
        for (int i = 0; i < times.size(); i++) {
            time.append(times.get(i));
            value.append(values.get(i));
        }
        Frame frame = new Frame("A");
        frame.setRefId("A");
        return frame.addField(time).addField(value);
    }

    private static Frame sparse() {
        return frame(List.of(t(0), t(30)), List.of(1.0, 3.0));
    }

    @Test
    public void testPreviousFillCarriesValuesForward() {
        Frame out = Resampler.resample(sparse(), FillPolicy.previous(), RANGE, STEP);

        assertEquals(List.of(t(0), t(10), t(20), t(30), t(40)), out.getField("time").getValues());
        assertEquals(List.of(1.0, 1.0, 1.0, 3.0, 3.0), out.getField("value").getValues());
    }

    @Test
    public void testNullFillLeavesGaps() {
        Frame out = Resampler.resample(sparse(), FillPolicy.nulls(), RANGE, STEP);

        assertEquals(Arrays.asList(1.0, null, null, 3.0, null), out.getField("value").getValues());
    }

    @Test
    public void testNullPolicyDefaultsToNullFill() {
        Frame out = Resampler.resample(sparse(), null, RANGE, STEP);

        assertEquals(Arrays.asList(1.0, null, null, 3.0, null), out.getField("value").getValues());
    }

    @Test
    public void testValueFillIsCoercedToFieldType() {
        Frame out = Resampler.resample(sparse(), FillPolicy.value(0), RANGE, STEP);

        assertEquals(List.of(1.0, 0.0, 0.0, 3.0, 0.0), out.getField("value").getValues());
    }

    @Test
    public void testPerColumnFillValues() {
        Frame in = sparse();
        Field label = new Field("label", FieldType.STRING, true);
        label.append("a");
        label.append("b");
        in.addField(label);

        Frame out = Resampler.resample(in, FillPolicy.values(Map.of("label", "n/a"), -1), RANGE, STEP);

        assertEquals(List.of(1.0, -1.0, -1.0, 3.0, -1.0), out.getField("value").getValues());
        assertEquals(List.of("a", "n/a", "n/a", "b", "n/a"), out.getField("label").getValues());
    }

    @Test
    public void testPreviousFillStartsWithNull() {
        Frame in = frame(List.of(t(20)), List.of(2.0));

        Frame out = Resampler.resample(in, FillPolicy.previous(), RANGE, STEP);

        assertEquals(Arrays.asList(null, null, 2.0, 2.0, 2.0), out.getField("value").getValues());
    }

    @Test
    public void testLastPointInSlotWins() {
        Frame in = frame(List.of(t(0), t(3), t(9), t(10)), List.of(1.0, 2.0, 3.0, 4.0));

        Frame out = Resampler.resample(in, FillPolicy.nulls(), TimeRange.of(T0, t(10)), STEP);

        assertEquals(List.of(3.0, 4.0), out.getField("value").getValues());
    }

    @Test
    public void testPointsOutsideRangeAreIgnored() {
        Frame in = frame(List.of(t(-10), t(5), t(60)), List.of(9.0, 1.0, 9.0));

        Frame out = Resampler.resample(in, FillPolicy.nulls(), TimeRange.of(T0, t(20)), STEP);

        assertEquals(Arrays.asList(1.0, null, null), out.getField("value").getValues());
    }

    @Test
    public void testGridEndsAtLastSlotNotAfterTo() {
        Frame out = Resampler.resample(sparse(), FillPolicy.nulls(), TimeRange.of(T0, t(35)), STEP);

        assertEquals(List.of(t(0), t(10), t(20), t(30)), out.getField("time").getValues());
    }

    @Test
    public void testResamplingIsIdempotentOnItsGrid() {
        Frame once = Resampler.resample(sparse(), FillPolicy.previous(), RANGE, STEP);
        Frame twice = Resampler.resample(once, FillPolicy.previous(), RANGE, STEP);

        assertEquals(once.getField("time").getValues(), twice.getField("time").getValues());
        assertEquals(once.getField("value").getValues(), twice.getField("value").getValues());
    }

    @Test
    public void testOutputKeepsIdentityAndLeavesInputAlone() {
        Frame in = sparse();
        in.getMeta().addNotice(Notice.Severity.WARNING, "truncated");

        Frame out = Resampler.resample(in, FillPolicy.nulls(), RANGE, STEP);

        assertEquals("A", out.getName());
        assertEquals("A", out.getRefId());
        assertEquals(1, out.getMeta().getNotices().size());
        assertNotSame(in.getMeta(), out.getMeta());
        assertEquals(2, in.rowCount());
        assertFalse(out.getField("time").isNullable());
        assertTrue(out.getField("value").isNullable());
    }

    @Test
    public void testRowsWithNullTimeAreSkipped() {
        Field time = new Field("time", FieldType.TIME, true);
        Field value = new Field("value", FieldType.FLOAT64, true);
        time.append(t(0));
        value.append(1.0);
        time.append(null);
        value.append(7.0);
        time.append(t(10));
        value.append(2.0);
        Frame in = new Frame("A").addField(time).addField(value);

        Frame out = Resampler.resample(in, FillPolicy.nulls(), TimeRange.of(T0, t(10)), STEP);

        assertEquals(List.of(1.0, 2.0), out.getField("value").getValues());
    }

    @Test
    public void testRejectsFrameWithoutTimeField() {
        Frame noTime = new Frame("A").addField(new Field("value", FieldType.FLOAT64, true));

        assertThrows(EmptyFrameException.class, () -> Resampler.resample(noTime, FillPolicy.nulls(), RANGE, STEP));
    }

    @Test
    public void testFrameWithoutRowsBecomesFilledGrid() {
        Frame empty = frame(List.of(), List.of());
        List<Double> gaps = Arrays.asList(null, null, null, null, null);

        Frame nulls = Resampler.resample(empty, FillPolicy.nulls(), RANGE, STEP);
        assertEquals(List.of(t(0), t(10), t(20), t(30), t(40)), nulls.getField("time").getValues());
        assertEquals(gaps, nulls.getField("value").getValues());

        Frame previous = Resampler.resample(empty, FillPolicy.previous(), RANGE, STEP);
        assertEquals(gaps, previous.getField("value").getValues());

        Frame fixed = Resampler.resample(empty, FillPolicy.value(7), RANGE, STEP);
        assertEquals(List.of(7.0, 7.0, 7.0, 7.0, 7.0), fixed.getField("value").getValues());
    }

    @Test
    public void testRejectsDecreasingTime() {
        Frame in = frame(List.of(t(0), t(20), t(10)), List.of(1.0, 2.0, 3.0));

        NonMonotonicTimeException e = assertThrows(NonMonotonicTimeException.class,
                () -> Resampler.resample(in, FillPolicy.nulls(), RANGE, STEP));
        assertEquals("NON_MONOTONIC_TIME", e.getCode());
    }

    @Test
    public void testRejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> Resampler.resample(sparse(), FillPolicy.nulls(), RANGE, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> Resampler.resample(sparse(), FillPolicy.nulls(), RANGE, Duration.ofSeconds(-1)));
    }
}
