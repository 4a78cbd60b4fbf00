package com.raditha.codetwin.config;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads comparison configuration from Settings (codetwin.yml) with CLI
 * overrides.
 *
 * Configuration priority: CLI arguments > codetwin.yml > preset defaults
 */
public class ComparisonSettings {

    static final String CONFIG_KEY = "similarity_detector";

    private ComparisonSettings() {
    }

    /**
     * Build the run configuration.
     *
     * @param shingleSizeCLI CLI shingle size (null = use YAML/preset)
     * @param threadsCLI     CLI thread count (null = use YAML/preset)
     * @param presetCLI      CLI preset name (null = use YAML/standard)
     * @return validated configuration
     * @throws IllegalArgumentException if any value is invalid
     */
    public static ComparisonConfig loadConfig(Integer shingleSizeCLI, Integer threadsCLI, String presetCLI) {
        Map<String, Object> config = section();

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        ComparisonConfig base = ComparisonConfig.preset(preset);

        int shingleSize = shingleSizeCLI != null ? shingleSizeCLI : getInt(config, "shingle_size", base.shingleSize());
        int threads = threadsCLI != null ? threadsCLI : getInt(config, "threads", base.threads());

        GrammarRegistry grammars = base.grammars();
        List<String> extensions = getListString(config, "extensions");
        if (!extensions.isEmpty()) {
            grammars = grammars.restrictTo(extensions);
        }

        Set<String> excluded = base.excludedDirectories();
        if (config.containsKey("exclude_dirs")) {
            excluded = Set.copyOf(getListString(config, "exclude_dirs"));
        }

        return new ComparisonConfig(
                shingleSize,
                buildKeywords(config, base.keywords()),
                grammars,
                excluded,
                threads,
                getLong(config, "max_file_bytes", base.maxFileBytes()),
                getInt(config, "max_tokens_per_file", base.maxTokensPerFile()),
                getInt(config, "preview_tokens", base.previewTokens()),
                getLong(config, "timeout_seconds", base.timeoutSeconds()));
    }

    /**
     * A {@code keywords} list replaces the built-in set entirely;
     * {@code extra_keywords} extends it.
     */
    private static Set<String> buildKeywords(Map<String, Object> config, Set<String> defaults) {
        Set<String> keywords = new HashSet<>(
                config.containsKey("keywords") ? getListString(config, "keywords") : defaults);
        keywords.addAll(getListString(config, "extra_keywords"));
        return keywords;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section() {
        Object raw = Settings.getProperty(CONFIG_KEY);
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            return Integer.parseInt(value.toString().trim());
        }
        return defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            return Long.parseLong(value.toString().trim());
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        return List.of();
    }
}
