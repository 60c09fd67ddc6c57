package com.example.tracepipeline.resilience;

public enum CircuitState {
    /** 正常放行 */
    CLOSED("closed"),
    /** 拒绝所有调用 */
    OPEN("open"),
    /** 放行有限的试探调用 */
    HALF_OPEN("half-open");

    private final String label;

    CircuitState(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
