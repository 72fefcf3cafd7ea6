package com.sqlframe.convert;

import lombok.Value;

import java.util.List;

/**
 * Outcome of dynamic sampling: rebound columns and the rows read ahead to decide them.
 */
@Value
public class SampledRows {
    List<ColumnBinding> bindings;
    List<List<NativeValue>> rows;
    /** True if the cursor ran out while sampling. */
    boolean exhausted;
}
