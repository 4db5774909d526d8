package com.imperium.astrocompanion.oracle;

/**
 * Oracle 调用失败（超时、服务端错误、空响应）。调用方决定吸收为 fallback 还是向上抛出。
 */
public class ContentOracleException extends RuntimeException {

    private final OracleKind kind;

    public ContentOracleException(OracleKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ContentOracleException(OracleKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public OracleKind getKind() {
        return kind;
    }
}
