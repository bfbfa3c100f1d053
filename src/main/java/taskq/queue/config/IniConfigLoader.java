package taskq.queue.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Applies overrides from an optional INI file.
 * Supports sections [database], [scheduler], [resources]; unknown keys are ignored.
 *
 * <pre>
 * [scheduler]
 * batch_size = 5
 * release_stagger_ms = 500
 * poll_interval_ms = 1000
 * max_idle_backoff_s = 60
 * overload_cooldown_s = 30
 * max_workers = 8
 *
 * [resources]
 * cpu_threshold = 80
 * memory_threshold = 75
 * </pre>
 */
public final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private IniConfigLoader() {
    }

    /**
     * Apply the file to the config if it exists.
     *
     * @return true if a file was read
     */
    public static boolean applyIfPresent(Path file, QueueConfig config) {
        if (!Files.isRegularFile(file)) {
            return false;
        }
        try {
            apply(new Ini(file.toFile()), config);
            log.info("Loaded configuration overrides from {}", file);
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read config file: " + file, e);
        }
    }

    static void apply(Ini ini, QueueConfig config) {
        Profile.Section db = ini.get("database");
        Profile.Section scheduler = ini.get("scheduler");
        Profile.Section resources = ini.get("resources");

        if (db != null) {
            String url = opt(db, "url");
            if (url != null) config.withDatabaseUrl(url);
            Integer pool = intOpt(db, "pool_size");
            if (pool != null) config.withDatabasePoolSize(pool);
        }

        if (scheduler != null) {
            Integer batch = intOpt(scheduler, "batch_size");
            if (batch != null) config.withBatchSize(batch);
            Integer stagger = intOpt(scheduler, "release_stagger_ms");
            if (stagger != null) config.withReleaseStagger(Duration.ofMillis(stagger));
            Integer poll = intOpt(scheduler, "poll_interval_ms");
            if (poll != null) config.withPollInterval(Duration.ofMillis(poll));
            Integer backoff = intOpt(scheduler, "max_idle_backoff_s");
            if (backoff != null) config.withMaxIdleBackoff(Duration.ofSeconds(backoff));
            Integer cooldown = intOpt(scheduler, "overload_cooldown_s");
            if (cooldown != null) config.withOverloadCooldown(Duration.ofSeconds(cooldown));
            Integer workers = intOpt(scheduler, "max_workers");
            if (workers != null) config.withMaxWorkers(workers);
            Integer reduced = intOpt(scheduler, "reduced_workers");
            if (reduced != null) config.withReducedWorkers(reduced);
        }

        if (resources != null) {
            Double cpu = doubleOpt(resources, "cpu_threshold");
            Double mem = doubleOpt(resources, "memory_threshold");
            config.withThresholds(
                    cpu != null ? cpu : config.cpuThreshold(),
                    mem != null ? mem : config.memoryThreshold());
            Double margin = doubleOpt(resources, "load_margin");
            if (margin != null) config.withLoadMargin(margin);
        }
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static Integer intOpt(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) return null;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for [" + s.getName() + "] " + key + ": " + v);
        }
    }

    private static Double doubleOpt(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) return null;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for [" + s.getName() + "] " + key + ": " + v);
        }
    }
}
