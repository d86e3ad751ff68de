package com.codehealth.core.util;

import com.codehealth.core.model.AuditConfig;
import com.codehealth.core.model.AuditConfig.UnknownValuePolicy;
import com.codehealth.core.model.Detector;
import com.codehealth.core.model.Tier;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * audit.yml을 읽어 AuditConfig로 변환.
 *
 * 예상 YAML 키:
 * unknownValues: reject | fail | lenient
 * isolateParseErrors: true
 * nextLimit: 10
 * quickWinTiers: [T3, T4]
 * cosmeticDetectors: [naming_consistency, debug_logging_leftovers]
 * output:
 *   pretty: true
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "audit.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 audit.yml. 없으면 기본값 */
    public static AuditConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        if (!Files.exists(p)) {
            AuditConfig cfg = AuditConfig.defaults();
            cfg.validate();
            return cfg;
        }
        return load(p);
    }

    public static AuditConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("audit config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root;
            try {
                root = yaml.load(in);
            } catch (RuntimeException e) {
                // snakeyaml 파서 예외(YAMLException)는 unchecked: 설정 오류로 올린다
                throw new IOException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
            }

            AuditConfig cfg = AuditConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            // 1) 평면 키
            setEnum(map, "unknownValues", UnknownValuePolicy.class, cfg::setUnknownValues);
            setBoolean(map, "isolateParseErrors", cfg::setIsolateParseErrors);
            setInt(map, "nextLimit", cfg::setNextLimit);

            // 2) wire name 목록
            setWireList(map, "quickWinTiers", Tier::fromWire, cfg::setQuickWinTiers);
            setWireList(map, "cosmeticDetectors", Detector::fromWire, cfg::setCosmeticDetectors);

            // 3) output.*
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setBoolean(output, "pretty", cfg.getOutput()::setPretty);
            }

            cfg.validate();
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    /** 목록 또는 "a,b,c" 문자열. 모르는 이름은 건너뛴다. 명시적 빈 목록은 빈 집합으로 반영 */
    private static <E> void setWireList(Map<?, ?> map, String key,
                                        Function<String, Optional<E>> parser,
                                        Consumer<List<E>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> raw = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) raw.add(String.valueOf(o));
        } else {
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) raw.add(p);
        }
        List<E> out = new ArrayList<>();
        for (String s : raw) parser.apply(s).ifPresent(out::add);
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + v, e);
            }
        }
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        // 오타면 기본값 유지
    }
}
