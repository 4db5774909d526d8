package com.imperium.astrocompanion.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前读取工作目录下的 .env（KEY=VALUE），写入系统属性，供 application.yaml 的 ${KEY} 解析。
 * 已存在的同名环境变量或系统属性优先，不会被 .env 覆盖。
 * <p>
 * 运行在 Spring 与日志系统初始化之前，因此直接输出到控制台。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private static final String OPENAI_BASE_URL_KEY = "OPENAI_BASE_URL";
    private static final String CHART_ENGINE_URL_KEY = "CHART_ENGINE_BASE_URL";

    private DotenvLoader() {
    }

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    static void load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] no .env at " + envPath + ", using environment only");
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to read .env: " + e.getMessage());
            return;
        }
        int loaded = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1);
            if (System.getenv(key) != null || System.getProperty(key) != null) {
                continue;
            }
            String value = unquote(matcher.group(2).trim());
            if (OPENAI_BASE_URL_KEY.equals(key)) {
                // Spring AI 会自行拼接 /v1
                value = stripSuffix(trimSlashes(value), "/v1");
            } else if (CHART_ENGINE_URL_KEY.equals(key)) {
                value = trimSlashes(value);
            }
            System.setProperty(key, value);
            loaded++;
            System.out.println("[DotenvLoader] " + key + " = " + mask(key, value));
        }
        System.out.println("[DotenvLoader] loaded " + loaded + " entries from " + envPath);
    }

    static String mask(String key, String value) {
        String upper = key.toUpperCase(Locale.ROOT);
        if (upper.contains("KEY") || upper.contains("PASSWORD") || upper.contains("SECRET")) {
            return "***";
        }
        return value;
    }

    private static String trimSlashes(String value) {
        String v = value.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static String stripSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
