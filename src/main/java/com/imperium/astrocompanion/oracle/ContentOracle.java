package com.imperium.astrocompanion.oracle;

/**
 * 外部生成式文本服务。不保证重试，失败时抛出 {@link ContentOracleException}。
 */
public interface ContentOracle {

    /**
     * 生成内容。DAILY_HOROSCOPE 返回 JSON 对象文本，其余类型返回纯文本。
     *
     * @param request 生成请求
     * @return 非空文本
     */
    String generate(OracleRequest request);
}
