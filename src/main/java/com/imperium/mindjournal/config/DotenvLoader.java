package com.imperium.mindjournal.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前读取工作目录下的 .env，把 KEY=VALUE 写入系统属性，
 * 供 application.yaml 中的 ${OLLAMA_API_URL}、${DB_PASSWORD} 等占位符解析。
 * 已存在的系统属性和环境变量优先，不会被 .env 覆盖。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)\\s*=(.*)$");

    private static final String OLLAMA_API_URL_KEY = "OLLAMA_API_URL";
    private static final Set<String> SECRET_MARKERS = Set.of("SECRET", "PASSWORD", "KEY", "TOKEN");

    private DotenvLoader() {
    }

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    static void load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] No .env at " + envPath + ", using environment only");
            return;
        }
        try {
            int loaded = 0;
            for (String line : Files.readAllLines(envPath, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                Matcher matcher = ENV_LINE.matcher(trimmed);
                if (!matcher.matches()) {
                    continue;
                }
                String key = matcher.group(1);
                if (System.getProperty(key) != null || System.getenv(key) != null) {
                    continue;
                }
                String value = unquote(matcher.group(2).trim());
                if (OLLAMA_API_URL_KEY.equals(key)) {
                    // 业务代码自行拼接 /api/...，末尾斜杠会变成 //api
                    value = stripTrailingSlash(value);
                }
                System.setProperty(key, value);
                loaded++;
                System.out.println("[DotenvLoader] " + key + " = " + (isSecret(key) ? "***" : value));
            }
            System.out.println("[DotenvLoader] Loaded " + loaded + " entries from " + envPath);
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to read " + envPath + ": " + e.getMessage());
        }
    }

    static String stripTrailingSlash(String value) {
        String v = value == null ? "" : value.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static boolean isSecret(String key) {
        for (String marker : SECRET_MARKERS) {
            if (key.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
