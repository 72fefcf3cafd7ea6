package com.sqlframe.resample;

import com.sqlframe.error.EmptyFrameException;
import com.sqlframe.error.NonMonotonicTimeException;
import com.sqlframe.frame.Field;
import com.sqlframe.frame.FieldType;
import com.sqlframe.frame.Frame;
import com.sqlframe.model.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites a time-indexed frame onto the grid {@code from, from + interval, ...} up to {@code to}.
 *
 * <p>Within a slot {@code [slot, slot + interval)} the last source point wins. Empty slots are filled
 * per {@link FillPolicy}. Legacy: kept for callers that still rely on server-side gap filling, behavior
 * must not change.
 */
@Slf4j
public final class Resampler {

    private Resampler() {
    }

    /**
     * @param frame frame sorted ascending by its first {@link FieldType#TIME} field
     * @param fillPolicy policy for slots without a point; null means {@link FillPolicy#nulls()}
     * @param range target range, both ends inclusive
     * @param interval slot width, positive
     * @return new frame; the input is not modified
     * @throws EmptyFrameException if the frame has no time field
     * @throws NonMonotonicTimeException if the time field decreases
     */
    public static Frame resample(Frame frame, FillPolicy fillPolicy, TimeRange range, Duration interval) {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(range, "range");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("resample interval must be positive: " + interval);
        }
        FillPolicy fill = fillPolicy != null ? fillPolicy : FillPolicy.nulls();

        int timeIndex = frame.indexOfFirst(FieldType.TIME);
        if (timeIndex < 0) {
            throw new EmptyFrameException("frame '" + frame.getName() + "' has no time field to resample on");
        }
        Field timeField = frame.getField(timeIndex);
        List<Integer> rows = orderedRows(timeField);

        Frame out = new Frame(frame.getName());
        out.setRefId(frame.getRefId());
        out.setMeta(frame.getMeta().copy());
        List<Field> sourceFields = frame.getFields();
        Object[] fillValues = new Object[sourceFields.size()];
        for (int c = 0; c < sourceFields.size(); c++) {
            Field f = sourceFields.get(c);
            out.addField(c == timeIndex ? f.emptyCopy(false) : f.emptyCopy(true));
            if (fill.getMode() == FillMode.VALUE && c != timeIndex) {
                fillValues[c] = f.getType().coerce(fill.valueFor(f.getName()));
            }
        }

        Object[] previous = new Object[sourceFields.size()];
        int p = 0;
        int slots = 0;
        for (Instant slot = range.getFrom(); !slot.isAfter(range.getTo()); slot = slot.plus(interval)) {
            Instant slotEnd = slot.plus(interval);
            while (p < rows.size() && time(timeField, rows.get(p)).isBefore(slot)) {
                p++;
            }
            int last = -1;
            while (p < rows.size() && time(timeField, rows.get(p)).isBefore(slotEnd)) {
                last = rows.get(p);
                p++;
            }

            out.getField(timeIndex).append(slot);
            for (int c = 0; c < sourceFields.size(); c++) {
                if (c == timeIndex) {
                    continue;
                }
                Object value;
                if (last >= 0) {
                    value = sourceFields.get(c).get(last);
                } else {
                    switch (fill.getMode()) {
                        case PREVIOUS:
                            value = previous[c];
                            break;
                        case VALUE:
                            value = fillValues[c];
                            break;
                        case NULL:
                        default:
                            value = null;
                            break;
                    }
                }
                out.getField(c).append(value);
                previous[c] = value;
            }
            slots++;
        }

        log.debug("Resampled frame '{}' from {} rows to {} slots of {} ({})",
                frame.getName(), rows.size(), slots, interval, fill.getMode());
        out.validate();
        return out;
    }

    /**
     * Row indexes with a non-null time, checked to be ascending.
     */
    private static List<Integer> orderedRows(Field timeField) {
        List<Integer> rows = new ArrayList<>(timeField.size());
        Instant prev = null;
        for (int i = 0; i < timeField.size(); i++) {
            Instant t = (Instant) timeField.get(i);
            if (t == null) {
                continue;
            }
            if (prev != null && t.isBefore(prev)) {
                throw new NonMonotonicTimeException(timeField.getName(), i, prev, t);
            }
            rows.add(i);
            prev = t;
        }
        return rows;
    }

    private static Instant time(Field timeField, int row) {
        return (Instant) timeField.get(row);
    }
}
