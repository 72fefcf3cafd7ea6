package com.sqlframe.convert;

import com.sqlframe.error.ConversionException;
import com.sqlframe.error.DuplicateColumnNameException;
import com.sqlframe.frame.Field;
import com.sqlframe.frame.FieldType;
import com.sqlframe.frame.Frame;
import com.sqlframe.frame.Notice;
import com.sqlframe.source.ListRowSource;
import com.sqlframe.source.RowSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.sqlframe.source.ListRowSource.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrameBuilderTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final FrameBuilder builder = new FrameBuilder(TypeRegistry.defaults());

    private static List<ColumnMetadata> metricColumns() {
        return List.of(
                new ColumnMetadata("time", "TIMESTAMP", NativeKind.TEMPORAL),
                new ColumnMetadata("host", "VARCHAR", NativeKind.TEXT),
                new ColumnMetadata("value", "DOUBLE", NativeKind.FLOATING),
                new ColumnMetadata("count", "BIGINT", NativeKind.INTEGER));
    }

    private static List<List<Object>> metricRows(int n) {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(row(T0.plusSeconds(60L * i), "host-" + i, i * 1.5, (long) i));
        }
        return rows;
    }

    @Test
    public void testBuildsTypedColumns() {
        Frame frame = builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(3)), -1, null);

        assertEquals(4, frame.getFields().size());
        assertEquals(3, frame.rowCount());
        assertEquals(FieldType.TIME, frame.getField("time").getType());
        assertEquals(FieldType.STRING, frame.getField("host").getType());
        assertEquals(FieldType.FLOAT64, frame.getField("value").getType());
        assertEquals(FieldType.INT64, frame.getField("count").getType());
        assertEquals(T0.plusSeconds(120), frame.getField("time").get(2));
        assertEquals("host-1", frame.getField("host").get(1));
        assertEquals(3.0, frame.getField("value").get(2));
        assertEquals(2L, frame.getField("count").get(2));
        assertTrue(frame.getMeta().getNotices().isEmpty());
    }

    @Test
    public void testRowCapTruncatesAndAddsNotice() {
        Frame frame = builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(5)), 3, List.of());

        assertEquals(3, frame.rowCount());
        for (Field f : frame.getFields()) {
            assertEquals(3, f.size());
        }
        assertEquals(1, frame.getMeta().getNotices().size());
        Notice notice = frame.getMeta().getNotices().get(0);
        assertEquals(Notice.Severity.WARNING, notice.getSeverity());
        assertTrue(notice.getText().contains("limited to 3"));
    }

    @Test
    public void testNoNoticeWhenRowCountEqualsCap() {
        Frame frame = builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(3)), 3, List.of());

        assertEquals(3, frame.rowCount());
        assertTrue(frame.getMeta().getNotices().isEmpty());
    }

    @Test
    public void testNegativeCapIsUnlimited() {
        Frame frame = builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(50)), -1, List.of());

        assertEquals(50, frame.rowCount());
        assertTrue(frame.getMeta().getNotices().isEmpty());
    }

    @Test
    public void testZeroCapKeepsColumnsButNoRows() {
        Frame frame = builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(2)), 0, List.of());

        assertEquals(4, frame.getFields().size());
        assertEquals(0, frame.rowCount());
        assertEquals(1, frame.getMeta().getNotices().size());
    }

    @Test
    public void testNullValuesNeverReachConversionFunction() {
        Converter exploding = Converter.builder()
                .name("exploding")
                .columnName("v")
                .scanKind(NativeKind.FLOATING)
                .fieldType(FieldType.FLOAT64)
                .conversion(v -> {
                    throw new IllegalStateException("must not be called");
                })
                .build();
        List<ColumnMetadata> columns = List.of(new ColumnMetadata("v", "DOUBLE", NativeKind.FLOATING));
        List<List<Object>> rows = List.of(row((Object) null), row((Object) null), row((Object) null));

        Frame frame = builder.buildFrame(ListRowSource.of(columns, rows), -1, List.of(exploding));

        assertEquals(3, frame.rowCount());
        assertEquals(Arrays.asList(null, null, null), frame.getField("v").getValues());
    }

    @Test
    public void testNullInNonNullableFieldBecomesZeroValue() {
        Converter notNull = Converter.builder()
                .name("not-null")
                .columnName("n")
                .scanKind(NativeKind.INTEGER)
                .fieldType(FieldType.INT64)
                .nullable(false)
                .conversion(TypeRegistry.conversionFor(FieldType.INT64))
                .build();
        List<ColumnMetadata> columns = List.of(new ColumnMetadata("n", "BIGINT", NativeKind.INTEGER));

        Frame frame = builder.buildFrame(ListRowSource.of(columns, List.of(row(7L), row((Object) null))), -1,
                List.of(notNull));

        assertFalse(frame.getField("n").isNullable());
        assertEquals(Arrays.asList(7L, 0L), frame.getField("n").getValues());
    }

    @Test
    public void testColumnAwareConversionIsPreferred() {
        Converter tagged = Converter.builder()
                .name("tagged")
                .typeName("VARCHAR")
                .scanKind(NativeKind.TEXT)
                .fieldType(FieldType.STRING)
                .conversion(v -> "plain")
                .columnConversion((v, column) -> column.getName() + ":" + v)
                .build();

        Frame frame = builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(1)), -1, List.of(tagged));

        assertEquals("host:host-0", frame.getField("host").get(0));
    }

    @Test
    public void testConversionFailureNamesColumnAndRow() {
        Converter strict = StringConverters.forColumn("host", FieldType.INT64);

        ConversionException e = assertThrows(ConversionException.class,
                () -> builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(2)), -1, List.of(strict)));

        assertEquals("host", e.getColumnName());
        assertEquals("VARCHAR", e.getTypeName());
        assertEquals(0, e.getRowIndex());
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertEquals("CONVERSION_FAILED", e.getCode());
    }

    @Test
    public void testWrongJavaTypeFromConverterIsConversionError() {
        Converter liar = Converter.builder()
                .name("liar")
                .columnName("count")
                .scanKind(NativeKind.INTEGER)
                .fieldType(FieldType.INT64)
                .conversion(v -> "not a long")
                .build();

        ConversionException e = assertThrows(ConversionException.class,
                () -> builder.buildFrame(ListRowSource.of(metricColumns(), metricRows(1)), -1, List.of(liar)));
        assertEquals("count", e.getColumnName());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    public void testReadFailureIsConversionError() {
        RowSource failing = new RowSource() {
            private int rows;

            @Override
            public List<ColumnMetadata> columns() {
                return List.of(new ColumnMetadata("n", "INTEGER", NativeKind.INTEGER));
            }

            @Override
            public boolean next() {
                return true;
            }

            @Override
            public List<NativeValue> read(List<NativeKind> scanKinds) throws SQLException {
                if (rows++ == 2) {
                    throw new SQLException("connection reset");
                }
                return List.of(NativeValue.present(NativeKind.INTEGER, 1L));
            }

            @Override
            public boolean nextResultSet() {
                return false;
            }
        };

        ConversionException e = assertThrows(ConversionException.class, () -> builder.buildFrame(failing, -1, null));
        assertNull(e.getColumnName());
        assertEquals(2, e.getRowIndex());
        assertInstanceOf(SQLException.class, e.getCause());
    }

    @Test
    public void testDuplicateColumnsFailBeforeReadingRows() {
        List<ColumnMetadata> columns = List.of(
                new ColumnMetadata("id", "INTEGER", NativeKind.INTEGER),
                new ColumnMetadata("id", "INTEGER", NativeKind.INTEGER));
        ListRowSource source = ListRowSource.of(columns, List.of(row(1L, 2L)));

        assertThrows(DuplicateColumnNameException.class, () -> builder.buildFrame(source, -1, null));
        assertEquals(0, source.getReads());
    }

    @Test
    public void testEachResultSetBecomesAFrame() {
        ListRowSource source = ListRowSource.of(metricColumns(), metricRows(4))
                .andThen(List.of(new ColumnMetadata("name", "VARCHAR", NativeKind.TEXT)), List.of(row("a"), row("b")));

        List<Frame> frames = builder.buildFrames(source, 3, List.of());

        assertEquals(2, frames.size());
        assertEquals(3, frames.get(0).rowCount());
        assertEquals(1, frames.get(0).getMeta().getNotices().size());
        assertEquals(2, frames.get(1).rowCount());
        assertTrue(frames.get(1).getMeta().getNotices().isEmpty());
        assertEquals(Arrays.asList("a", "b"), frames.get(1).getField("name").getValues());
    }

    @Test
    public void testDynamicColumnInfersFloatAfterLeadingNulls() {
        List<ColumnMetadata> columns = List.of(new ColumnMetadata("v", "VARIANT", NativeKind.OTHER));
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(row((Object) null));
        }
        rows.add(row(2.5d));
        rows.add(row(4.0d));
        ListRowSource source = ListRowSource.of(columns, rows);

        Frame frame = builder.buildFrame(source, -1, List.of(Converter.dynamic()));

        Field v = frame.getField("v");
        assertEquals(FieldType.FLOAT64, v.getType());
        assertEquals(12, v.size());
        assertNull(v.get(9));
        assertEquals(2.5d, v.get(10));
        assertEquals(4.0d, v.get(11));
        assertEquals(12, source.getReads());
    }

    @Test
    public void testDynamicSamplingRespectsRowCap() {
        List<ColumnMetadata> columns = List.of(new ColumnMetadata("v", "VARIANT", NativeKind.OTHER));
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            rows.add(row((Object) null));
        }
        rows.add(row(1L));

        Frame frame = builder.buildFrame(ListRowSource.of(columns, rows), 4, List.of(Converter.dynamic()));

        assertEquals(FieldType.STRING, frame.getField("v").getType());
        assertEquals(4, frame.rowCount());
        assertEquals(1, frame.getMeta().getNotices().size());
    }
}
