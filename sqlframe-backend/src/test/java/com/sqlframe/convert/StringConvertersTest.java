package com.sqlframe.convert;

import com.sqlframe.frame.FieldType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StringConvertersTest {

    private static final ColumnMetadata PRICE = new ColumnMetadata("price", "VARCHAR(32)", NativeKind.TEXT);

    @Test
    public void testParsesTextIntoTarget() throws Exception {
        Converter c = StringConverters.forColumn("price", FieldType.FLOAT64);

        assertEquals(NativeKind.TEXT, c.getScanKind());
        assertEquals(FieldType.FLOAT64, c.getFieldType());
        assertTrue(c.matchesColumnName(PRICE));
        assertEquals(12.5d, c.apply("12.5", PRICE));
    }

    @Test
    public void testReplacementsApplyInOrderBeforeParsing() throws Exception {
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put("$", "");
        replacements.put(",", "");
        Converter c = StringConverters.forColumn("price", FieldType.FLOAT64, replacements);

        assertEquals(1234.5d, c.apply("$1,234.5", PRICE));
    }

    @Test
    public void testParseFailureSurfaces() {
        Converter c = StringConverters.forColumn("price", FieldType.INT64);

        assertThrows(NumberFormatException.class, () -> c.apply("twelve", PRICE));
    }

    @Test
    public void testTypeNameAndRegexMatchers() throws Exception {
        Converter exact = StringConverters.forTypeName("VARCHAR(32)", FieldType.TIME);
        Converter regex = StringConverters.forTypeNameRegex("^VARCHAR", FieldType.STRING);

        assertTrue(exact.matchesTypeName(PRICE));
        assertFalse(exact.matchesColumnName(PRICE));
        assertTrue(regex.matchesTypeNameRegex(PRICE));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), exact.apply("2024-01-01T00:00:00Z", PRICE));
    }
}
