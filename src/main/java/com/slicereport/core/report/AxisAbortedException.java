package com.slicereport.core.report;

import com.slicereport.core.model.Axis;

/**
 * Ends the report for one axis without writing any output. Other axes keep going.
 */
public final class AxisAbortedException extends Exception {
    private final Axis axis;

    public AxisAbortedException(Axis axis, String reason) {
        super(reason);
        this.axis = axis;
    }

    public AxisAbortedException(Axis axis, String reason, Throwable cause) {
        super(reason, cause);
        this.axis = axis;
    }

    public Axis getAxis() {
        return axis;
    }
}
