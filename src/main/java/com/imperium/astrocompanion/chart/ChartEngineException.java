package com.imperium.astrocompanion.chart;

public class ChartEngineException extends RuntimeException {

    public ChartEngineException(String message) {
        super(message);
    }

    public ChartEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
