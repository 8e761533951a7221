package com.kernos.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for bootstrapping a kernel, loaded from environment variables.
 * <p>
 * Executor: KERNOS_EXECUTOR_LABEL. Ledger: KERNOS_LEDGER, KERNOS_LEDGER_FILE. Metrics: KERNOS_METRICS.
 * Provider discovery: KERNOS_DISCOVER_PROVIDERS.
 */
public final class KernelConfig {

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    static final String ENV_EXECUTOR_LABEL = "KERNOS_EXECUTOR_LABEL";
    static final String ENV_LEDGER = "KERNOS_LEDGER";
    static final String ENV_LEDGER_FILE = "KERNOS_LEDGER_FILE";
    static final String ENV_METRICS = "KERNOS_METRICS";
    static final String ENV_DISCOVER_PROVIDERS = "KERNOS_DISCOVER_PROVIDERS";

    private static final String DEFAULT_EXECUTOR_LABEL = "executor";
    /** Default true; set false to skip recording kernel events. */
    private static final boolean DEFAULT_LEDGER = true;
    private static final boolean DEFAULT_METRICS = true;
    private static final boolean DEFAULT_DISCOVER_PROVIDERS = true;

    private final String executorLabel;
    private final boolean ledgerEnabled;
    private final Path ledgerFile;
    private final boolean metricsEnabled;
    private final boolean discoverProviders;

    private KernelConfig(Builder b) {
        this.executorLabel = b.executorLabel;
        this.ledgerEnabled = b.ledgerEnabled;
        this.ledgerFile = b.ledgerFile;
        this.metricsEnabled = b.metricsEnabled;
        this.discoverProviders = b.discoverProviders;
    }

    /** Label of the executor address created at bootstrap (KERNOS_EXECUTOR_LABEL). Default {@code executor}. */
    public String getExecutorLabel() {
        return executorLabel;
    }

    /** Whether kernel events are recorded (KERNOS_LEDGER). Default true. */
    public boolean isLedgerEnabled() {
        return ledgerEnabled;
    }

    /** JSON-lines ledger file (KERNOS_LEDGER_FILE). Empty means events are only logged. */
    public Optional<Path> getLedgerFile() {
        return Optional.ofNullable(ledgerFile);
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /** Whether module and policy providers are discovered with ServiceLoader (KERNOS_DISCOVER_PROVIDERS). */
    public boolean isDiscoverProviders() {
        return discoverProviders;
    }

    public static KernelConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from {@code env}; unset or blank values take defaults. */
    public static KernelConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String ledgerFile = get(env, ENV_LEDGER_FILE, null);
        return builder()
                .executorLabel(get(env, ENV_EXECUTOR_LABEL, DEFAULT_EXECUTOR_LABEL))
                .ledgerEnabled(parseBoolean(ENV_LEDGER, env.get(ENV_LEDGER), DEFAULT_LEDGER))
                .ledgerFile(ledgerFile != null ? Path.of(ledgerFile) : null)
                .metricsEnabled(parseBoolean(ENV_METRICS, env.get(ENV_METRICS), DEFAULT_METRICS))
                .discoverProviders(parseBoolean(ENV_DISCOVER_PROVIDERS, env.get(ENV_DISCOVER_PROVIDERS),
                        DEFAULT_DISCOVER_PROVIDERS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String key, String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        log.warn("Ignoring unrecognized value '{}' for {}; using default {}", v, key, defaultValue);
        return defaultValue;
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "KernelConfig{executorLabel=" + executorLabel
                + ", ledgerEnabled=" + ledgerEnabled
                + ", ledgerFile=" + ledgerFile
                + ", metricsEnabled=" + metricsEnabled
                + ", discoverProviders=" + discoverProviders + "}";
    }

    public static final class Builder {
        private String executorLabel = DEFAULT_EXECUTOR_LABEL;
        private boolean ledgerEnabled = DEFAULT_LEDGER;
        private Path ledgerFile;
        private boolean metricsEnabled = DEFAULT_METRICS;
        private boolean discoverProviders = DEFAULT_DISCOVER_PROVIDERS;

        public Builder executorLabel(String executorLabel) {
            this.executorLabel = executorLabel != null && !executorLabel.isBlank()
                    ? executorLabel.trim() : DEFAULT_EXECUTOR_LABEL;
            return this;
        }

        public Builder ledgerEnabled(boolean ledgerEnabled) {
            this.ledgerEnabled = ledgerEnabled;
            return this;
        }

        public Builder ledgerFile(Path ledgerFile) {
            this.ledgerFile = ledgerFile;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder discoverProviders(boolean discoverProviders) {
            this.discoverProviders = discoverProviders;
            return this;
        }

        public KernelConfig build() {
            return new KernelConfig(this);
        }
    }
}
