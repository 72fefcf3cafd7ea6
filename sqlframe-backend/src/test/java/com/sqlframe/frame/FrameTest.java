package com.sqlframe.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FrameTest {

    private static Frame sample() {
        Field time = new Field("time", FieldType.TIME, false);
        Field value = new Field("value", FieldType.FLOAT64, true);
        time.append(Instant.parse("2024-01-01T00:00:00Z"));
        value.append(1.5);
        Frame frame = new Frame("A");
        frame.setRefId("A");
        return frame.addField(value).addField(time);
    }

    @Test
    public void testLookup() {
        Frame frame = sample();

        assertEquals(1, frame.rowCount());
        assertEquals("value", frame.getField(0).getName());
        assertEquals(FieldType.TIME, frame.getField("time").getType());
        assertNull(frame.getField("missing"));
        assertEquals(1, frame.indexOfFirst(FieldType.TIME));
        assertEquals(-1, frame.indexOfFirst(FieldType.BOOL));
        assertEquals(0, new Frame().rowCount());
    }

    @Test
    public void testValidateRejectsUnequalLengths() {
        Frame frame = sample();
        frame.getField("value").append(2.0);

        assertThrows(IllegalStateException.class, frame::validate);
    }

    @Test
    public void testMetaCopyIsIndependent() {
        FrameMeta meta = new FrameMeta();
        meta.setExecutedQueryString("SELECT 1");
        meta.addNotice(Notice.Severity.INFO, "ok");
        meta.getCustom().put("duration_ms", 3L);

        FrameMeta copy = meta.copy();
        copy.addNotice(Notice.Severity.WARNING, "later");

        assertEquals("SELECT 1", copy.getExecutedQueryString());
        assertEquals(1, meta.getNotices().size());
        assertEquals(2, copy.getNotices().size());
        assertEquals(3L, copy.getCustom().get("duration_ms"));
    }

    @Test
    public void testJsonShape() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Frame frame = sample();
        frame.getMeta().setExecutedQueryString("SELECT 1");

        JsonNode json = mapper.readTree(mapper.writeValueAsString(frame));

        assertEquals("A", json.get("ref_id").asText());
        assertEquals("SELECT 1", json.get("meta").get("executed_query_string").asText());
        assertEquals("FLOAT64", json.get("fields").get(0).get("type").asText());
        assertEquals(1.5, json.get("fields").get(0).get("values").get(0).asDouble());
        assertEquals("2024-01-01T00:00:00Z", json.get("fields").get(1).get("values").get(0).asText());
    }
}
