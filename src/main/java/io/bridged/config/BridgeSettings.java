package io.bridged.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import io.bridged.model.HandleKind;
import io.bridged.security.InputLimits;
import io.bridged.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record BridgeSettings(
        int maxConnections,
        long maxRequestBytes,
        long requestReadTimeoutMs,
        long handlerTimeoutMs,
        long reaperIntervalMs,
        long idleThresholdMs,
        Map<HandleKind, Long> idleThresholdsMs,
        int maxHandles,
        int metricsWindowSize,
        int maxStringLength,
        int maxCollectionLength,
        int maxDepth,
        int maxParamCount,
        List<String> disabledCapabilities,
        boolean allowRemoteShutdown,
        double errorRateWarn,
        double errorRateFail,
        double poolWarnRatio
) {
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final long DEFAULT_MAX_REQUEST_BYTES = 10L * 1024L * 1024L;
    public static final long DEFAULT_REQUEST_READ_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_HANDLER_TIMEOUT_MS = 1_800_000L;
    public static final long DEFAULT_REAPER_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_IDLE_THRESHOLD_MS = 300_000L;
    public static final int DEFAULT_MAX_HANDLES = 1000;
    public static final int DEFAULT_METRICS_WINDOW_SIZE = 1000;

    public static BridgeSettings defaults() {
        return new BridgeSettings(
                DEFAULT_MAX_CONNECTIONS,
                DEFAULT_MAX_REQUEST_BYTES,
                DEFAULT_REQUEST_READ_TIMEOUT_MS,
                DEFAULT_HANDLER_TIMEOUT_MS,
                DEFAULT_REAPER_INTERVAL_MS,
                DEFAULT_IDLE_THRESHOLD_MS,
                Map.of(),
                DEFAULT_MAX_HANDLES,
                DEFAULT_METRICS_WINDOW_SIZE,
                1_048_576,
                10_000,
                32,
                100_000,
                List.of(),
                false,
                0.05d,
                0.25d,
                0.8d
        );
    }

    public static BridgeSettings load(Path file) {
        BridgeSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper()
                    .readerFor(SettingsFile.class)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(Files.readString(file));
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public static BridgeSettings fromFile(SettingsFile file, BridgeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        double warn = sanitizeRatio(file.errorRateWarn(), defaults.errorRateWarn());
        double fail = sanitizeRatio(file.errorRateFail(), defaults.errorRateFail());
        if (fail < warn) {
            fail = warn;
        }
        Map<HandleKind, Long> perKind = new EnumMap<>(HandleKind.class);
        if (file.idleThresholdsMs() != null) {
            for (Map.Entry<String, Long> e : file.idleThresholdsMs().entrySet()) {
                HandleKind kind = HandleKind.fromString(e.getKey());
                perKind.put(kind, sanitizeLong(e.getValue(), defaults.idleThresholdMs(), 100L));
            }
        }
        List<String> disabled = new ArrayList<>();
        if (file.disabledCapabilities() != null) {
            for (String pattern : file.disabledCapabilities()) {
                if (pattern != null && !pattern.isBlank()) {
                    disabled.add(pattern.trim());
                }
            }
        }
        return new BridgeSettings(
                sanitizeInt(file.maxConnections(), defaults.maxConnections(), 1),
                sanitizeLong(file.maxRequestBytes(), defaults.maxRequestBytes(), 1_024L),
                sanitizeLong(file.requestReadTimeoutMs(), defaults.requestReadTimeoutMs(), 100L),
                sanitizeLong(file.handlerTimeoutMs(), defaults.handlerTimeoutMs(), 100L),
                sanitizeLong(file.reaperIntervalMs(), defaults.reaperIntervalMs(), 50L),
                sanitizeLong(file.idleThresholdMs(), defaults.idleThresholdMs(), 100L),
                Map.copyOf(perKind),
                sanitizeInt(file.maxHandles(), defaults.maxHandles(), 1),
                sanitizeInt(file.metricsWindowSize(), defaults.metricsWindowSize(), 10),
                sanitizeInt(file.maxStringLength(), defaults.maxStringLength(), 1),
                sanitizeInt(file.maxCollectionLength(), defaults.maxCollectionLength(), 1),
                sanitizeInt(file.maxDepth(), defaults.maxDepth(), 1),
                sanitizeInt(file.maxParamCount(), defaults.maxParamCount(), 1),
                List.copyOf(disabled),
                sanitizeBoolean(file.allowRemoteShutdown(), defaults.allowRemoteShutdown()),
                warn,
                fail,
                sanitizeRatio(file.poolWarnRatio(), defaults.poolWarnRatio())
        );
    }

    public long idleThresholdMs(HandleKind kind) {
        Long override = idleThresholdsMs.get(kind);
        return override == null ? idleThresholdMs : override;
    }

    public InputLimits limits() {
        return new InputLimits(maxStringLength, maxCollectionLength, maxDepth, maxParamCount);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static double sanitizeRatio(Double raw, double fallback) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(0.0d, Math.min(1.0d, raw));
    }

    public record SettingsFile(
            Integer maxConnections,
            Long maxRequestBytes,
            Long requestReadTimeoutMs,
            Long handlerTimeoutMs,
            Long reaperIntervalMs,
            Long idleThresholdMs,
            Map<String, Long> idleThresholdsMs,
            Integer maxHandles,
            Integer metricsWindowSize,
            Integer maxStringLength,
            Integer maxCollectionLength,
            Integer maxDepth,
            Integer maxParamCount,
            List<String> disabledCapabilities,
            Boolean allowRemoteShutdown,
            Double errorRateWarn,
            Double errorRateFail,
            Double poolWarnRatio
    ) {
    }
}
