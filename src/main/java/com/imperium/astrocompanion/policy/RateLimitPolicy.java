package com.imperium.astrocompanion.policy;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AI 接口限流：按 userId 固定窗口，20 req / 10 min。单进程内存实现。
 */
@Component
public class RateLimitPolicy {

    /** 时间窗口（毫秒）：10 分钟 */
    public static final long WINDOW_MS = 10 * 60 * 1000L;

    /** 窗口内最大请求数 */
    public static final int MAX_REQUESTS_PER_WINDOW = 20;

    private final Map<String, Window> userToWindow = new ConcurrentHashMap<>();

    /**
     * 检查是否允许请求；若允许则记录一次。
     *
     * @param userId 用户 ID
     * @return true 允许，false 应返回 429
     */
    public boolean allow(String userId) {
        return allow(userId, System.currentTimeMillis());
    }

    boolean allow(String userId, long now) {
        String key = userId != null ? userId : "";
        Window w = userToWindow.compute(key, (k, old) -> {
            if (old == null || now - old.startMs >= WINDOW_MS) {
                return new Window(now, 1);
            }
            if (old.count > MAX_REQUESTS_PER_WINDOW) {
                return old;
            }
            return new Window(old.startMs, old.count + 1);
        });
        return w.count <= MAX_REQUESTS_PER_WINDOW;
    }

    private record Window(long startMs, int count) {}
}
