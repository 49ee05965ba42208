package com.fitplan.backend.progress.chart;

public class ChartRenderException extends RuntimeException {
    public ChartRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
