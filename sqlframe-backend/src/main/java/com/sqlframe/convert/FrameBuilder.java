package com.sqlframe.convert;

import com.sqlframe.error.ConversionException;
import com.sqlframe.frame.Field;
import com.sqlframe.frame.Frame;
import com.sqlframe.frame.Notice;
import com.sqlframe.source.RowSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Materializes result sets into typed {@link Frame}s.
 *
 * <p>A frame is either complete (possibly truncated at the row cap, with a notice) or not returned at
 * all: any conversion or read failure raises a {@link ConversionException}.
 */
@Slf4j
public class FrameBuilder {

    private final ColumnConverterResolver resolver;
    private final DynamicTypeSampler sampler;

    public FrameBuilder(TypeRegistry registry) {
        this(new ColumnConverterResolver(registry), new DynamicTypeSampler());
    }

    public FrameBuilder(ColumnConverterResolver resolver, DynamicTypeSampler sampler) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }

    /**
     * Converts every result set of the source, in order.
     *
     * @param source cursor positioned on the first result set
     * @param rowCap row cap applied to each frame; negative for no limit
     * @param overrides caller converters, may be null
     * @return one frame per result set
     */
    public List<Frame> buildFrames(RowSource source, long rowCap, List<Converter> overrides) {
        List<Frame> frames = new ArrayList<>();
        while (true) {
            frames.add(buildFrame(source, rowCap, overrides));
            try {
                if (!source.nextResultSet()) {
                    return frames;
                }
            } catch (SQLException e) {
                throw new ConversionException(null, null, 0, e);
            }
        }
    }

    /**
     * Converts the current result set of the source.
     *
     * @param source cursor positioned before the first row
     * @param rowCap maximum rows to append; negative for no limit
     * @param overrides caller converters, may be null
     * @return the frame, with a warning notice when rows were dropped at the cap
     */
    public Frame buildFrame(RowSource source, long rowCap, List<Converter> overrides) {
        List<ColumnMetadata> columns;
        try {
            columns = source.columns();
        } catch (SQLException e) {
            throw new ConversionException(null, null, 0, e);
        }

        List<ColumnBinding> bindings = resolver.resolve(columns, overrides);
        SampledRows sampled;
        try {
            sampled = sampler.sample(source, bindings, rowCap);
        } catch (SQLException e) {
            throw new ConversionException(null, null, 0, e);
        }
        bindings = sampled.getBindings();

        Frame frame = new Frame();
        List<NativeKind> scanKinds = new ArrayList<>(bindings.size());
        for (ColumnBinding b : bindings) {
            Converter c = b.getConverter();
            frame.addField(new Field(b.getColumn().getName(), c.getFieldType(), c.isNullable()));
            scanKinds.add(c.getScanKind());
        }

        Iterator<List<NativeValue>> buffered = sampled.getRows().iterator();
        boolean exhausted = sampled.isExhausted();
        long rowIndex = 0;
        boolean truncated = false;
        while (true) {
            List<NativeValue> row;
            if (buffered.hasNext()) {
                row = buffered.next();
            } else {
                try {
                    if (exhausted || !source.next()) {
                        break;
                    }
                    if (rowCap >= 0 && rowIndex >= rowCap) {
                        truncated = true;
                        break;
                    }
                    row = source.read(scanKinds);
                } catch (SQLException e) {
                    throw new ConversionException(null, null, rowIndex, e);
                }
            }
            appendRow(frame, bindings, row, rowIndex);
            rowIndex++;
        }

        if (truncated) {
            log.warn("Result truncated at {} rows", rowCap);
            frame.getMeta().addNotice(Notice.Severity.WARNING,
                    "Results have been limited to " + rowCap + " because the SQL row limit was reached");
        }
        frame.validate();
        return frame;
    }

    private void appendRow(Frame frame, List<ColumnBinding> bindings, List<NativeValue> row, long rowIndex) {
        if (row.size() != bindings.size()) {
            throw new ConversionException(null, null, rowIndex, new IllegalStateException(
                    "row has " + row.size() + " values, expected " + bindings.size()));
        }
        for (ColumnBinding b : bindings) {
            NativeValue cell = row.get(b.getIndex());
            Field field = frame.getField(b.getIndex());
            if (!cell.isPresent()) {
                field.append(null);
                continue;
            }
            ColumnMetadata column = b.getColumn();
            try {
                field.append(b.getConverter().apply(cell.get(), column));
            } catch (Exception e) {
                throw new ConversionException(column.getName(), column.getTypeName(), rowIndex, e);
            }
        }
    }
}
