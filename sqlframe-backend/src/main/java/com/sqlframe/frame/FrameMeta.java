package com.sqlframe.frame;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frame metadata: the SQL that produced the frame, notices for the caller and free-form annotations.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FrameMeta {
    private String executedQueryString;
    private List<Notice> notices = new ArrayList<>();
    private Map<String, Object> custom = new LinkedHashMap<>();

    public void addNotice(Notice.Severity severity, String text) {
        notices.add(new Notice(severity, text));
    }

    public FrameMeta copy() {
        FrameMeta out = new FrameMeta();
        out.setExecutedQueryString(executedQueryString);
        for (Notice n : notices) {
            out.getNotices().add(new Notice(n.getSeverity(), n.getText()));
        }
        out.getCustom().putAll(custom);
        return out;
    }
}
