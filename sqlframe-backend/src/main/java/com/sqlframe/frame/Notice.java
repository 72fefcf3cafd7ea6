package com.sqlframe.frame;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Notice {
    private Severity severity;
    private String text;

    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }
}
