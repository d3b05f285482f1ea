package com.carcoverscraper.core.util;

import com.carcoverscraper.core.model.ScrapeConfig;
import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * scrape.yml을 읽어 ScrapeConfig로 변환.
 *
 * 예상 YAML 키:
 * baseUrl: "https://www.olx.in"
 * searchTerm: "car-cover"
 * pages: 2
 * seedUrls: ["https://www.olx.in/item/..."]
 * followPagination: true
 * maxPages: 5
 * concurrency: 4
 * timeoutMs: 10000
 * userAgent: "..."
 * acceptLanguage: "en-US,en;q=0.9"
 * throttle:
 *   minIntervalMs: 1000
 *   jitterMs: 2000
 *   perHost: true
 * retry:
 *   maxAttempts: 3
 *   backoffBaseMs: 500
 *   retryAfterCapMs: 30000
 * output:
 *   dir: "out"
 *   formats: ["csv", "parquet"]
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScrapeConfig loadDefault() throws IOException {
        return load(Path.of("scrape.yml"));
    }

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scrape.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromRoot(newYaml().load(in));
        }
    }

    public static ScrapeConfig parse(String yamlText) {
        try (Reader r = new StringReader(yamlText == null ? "" : yamlText)) {
            return fromRoot(newYaml().load(r));
        } catch (IOException e) {
            throw new IllegalStateException("StringReader close failed", e);
        }
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static ScrapeConfig fromRoot(Object root) {
        ScrapeConfig cfg = ScrapeConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "baseUrl", cfg::setBaseUrl);
        setString(map, "searchTerm", cfg::setSearchTerm);
        setInt(map, "pages", cfg::setPages);
        setStringList(map, "seedUrls", cfg::setSeedUrls);
        setBoolean(map, "followPagination", cfg::setFollowPagination);
        setInt(map, "maxPages", cfg::setMaxPages);
        setInt(map, "concurrency", cfg::setConcurrency);
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeout(Duration.ofMillis(ms)); });
        setString(map, "userAgent", cfg::setUserAgent);
        setString(map, "acceptLanguage", cfg::setAcceptLanguage);

        // 2) throttle.*
        Map<String, Object> th = getMap(map, "throttle");
        if (th != null) {
            var t = cfg.getThrottle();
            setLong(th, "minIntervalMs", t::setMinIntervalMs);
            setLong(th, "jitterMs", t::setJitterMs);
            setBoolean(th, "perHost", t::setPerHost);
        }

        // 3) retry.*
        Map<String, Object> rt = getMap(map, "retry");
        if (rt != null) {
            var r = cfg.getRetry();
            setInt(rt, "maxAttempts", r::setMaxAttempts);
            setLong(rt, "backoffBaseMs", r::setBackoffBaseMs);
            setLong(rt, "retryAfterCapMs", r::setRetryAfterCapMs);
        }

        // 4) output.dir / output.formats
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setStringList(output, "formats", list -> {
                Set<OutputFormat> fmts = EnumSet.noneOf(OutputFormat.class);
                for (String s : list) parseEnum(OutputFormat.class, s).ifPresent(fmts::add);
                if (!fmts.isEmpty()) cfg.setOutputFormats(fmts);
            });
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        out.removeIf(String::isEmpty);
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static <E extends Enum<E>> Optional<E> parseEnum(Class<E> type, String s) {
        if (s == null) return Optional.empty();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s.trim())) return Optional.of(e);
        }
        return Optional.empty(); // 오타는 무시(기본값 유지)
    }
}
