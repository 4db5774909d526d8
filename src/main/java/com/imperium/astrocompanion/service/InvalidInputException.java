package com.imperium.astrocompanion.service;

/**
 * 输入校验失败，在任何外部调用之前抛出。field 为出错字段名，可为 null。
 */
public class InvalidInputException extends RuntimeException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
