package com.wordwatch.bot.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public record MonitorConfig(
        String discordToken,
        String modLogChannelId,
        String staffRoleId,
        UpstreamSettings upstream,
        RateLimitSettings rateLimit,
        CacheSettings cache,
        RetrySettings retry,
        PoolSettings pool,
        BanRules banRules,
        String databasePath,
        List<String> forbiddenWords,
        boolean localCheckEnabled,
        boolean autoBanEnabled,
        boolean deleteEnabled,
        List<String> exemptRoles,
        List<String> groupWhitelist,
        boolean userCooldownEnabled,
        Duration userCooldown,
        boolean statisticsEnabled,
        int workerThreads
) {
    public record UpstreamSettings(String endpoint, Duration timeout) {}

    public record RateLimitSettings(int maxPerMinute, int maxPerHour, Duration failureCooldown, Duration maxWait) {}

    public record CacheSettings(Duration ttl, int maxEntries) {}

    public record RetrySettings(int maxRetries, Duration baseDelay, Duration maxDelay) {}

    public record PoolSettings(int initialSize, int maxSize, Duration acquireTimeout) {}

    public record BanRules(
            long firstBanSeconds,
            long secondBanSeconds,
            long thirdBanSeconds,
            int resetHour,
            int retentionDays
    ) {}

    private static final Pattern ENV_KEY_PATTERN = Pattern.compile("[A-Z0-9_]+");
    private static final String DEFAULT_ENDPOINT = "https://uapis.cn/api/v1/text/profanitycheck";
    private static final String DEFAULT_DB_PATH = "data/wordwatch/violations.db";

    public static MonitorConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        return fromLookup(key -> {
            String value = dotenv.get(key);
            if (value == null || value.isBlank()) {
                return System.getenv(key);
            }
            return value;
        });
    }

    /**
     * Builds the configuration from an arbitrary key lookup. Present but unparsable
     * values fail here, never later at call time.
     *
     * @throws IllegalStateException naming the offending key
     */
    public static MonitorConfig fromLookup(Function<String, String> lookup) {
        Reader env = new Reader(lookup);
        int initialPool = env.intValue("MOD_POOL_INITIAL", 5, 0, 100);
        int maxPool = env.intValue("MOD_POOL_MAX", 10, 1, 100);
        if (maxPool < initialPool) {
            throw new IllegalStateException("MOD_POOL_MAX must not be smaller than MOD_POOL_INITIAL");
        }
        long retryBase = env.longValue("MOD_RETRY_BASE_DELAY_MS", 1000, 0, 600_000);
        long retryMax = env.longValue("MOD_RETRY_MAX_DELAY_MS", 10_000, 0, 600_000);
        if (retryMax < retryBase) {
            throw new IllegalStateException("MOD_RETRY_MAX_DELAY_MS must not be smaller than MOD_RETRY_BASE_DELAY_MS");
        }

        return new MonitorConfig(
                env.optional("DISCORD_TOKEN"),
                env.optional("MOD_LOG_CHANNEL_ID"),
                env.optional("STAFF_ROLE_ID"),
                new UpstreamSettings(
                        env.stringValue("MOD_API_ENDPOINT", DEFAULT_ENDPOINT),
                        Duration.ofSeconds(env.longValue("MOD_API_TIMEOUT_SECONDS", 10, 1, 300))
                ),
                new RateLimitSettings(
                        env.intValue("MOD_RATE_PER_MINUTE", 30, 1, 100_000),
                        env.intValue("MOD_RATE_PER_HOUR", 500, 1, 1_000_000),
                        Duration.ofSeconds(env.longValue("MOD_FAILURE_COOLDOWN_SECONDS", 30, 0, 86_400)),
                        Duration.ofSeconds(env.longValue("MOD_RATE_MAX_WAIT_SECONDS", 5, 0, 300))
                ),
                new CacheSettings(
                        Duration.ofSeconds(env.longValue("MOD_CACHE_TTL_SECONDS", 3600, 1, 7 * 86_400)),
                        env.intValue("MOD_CACHE_MAX_ENTRIES", 1000, 1, 1_000_000)
                ),
                new RetrySettings(
                        env.intValue("MOD_RETRY_MAX", 3, 0, 20),
                        Duration.ofMillis(retryBase),
                        Duration.ofMillis(retryMax)
                ),
                new PoolSettings(
                        initialPool,
                        maxPool,
                        Duration.ofMillis(env.longValue("MOD_POOL_ACQUIRE_TIMEOUT_MS", 5000, 1, 600_000))
                ),
                new BanRules(
                        env.longValue("MOD_BAN_FIRST_SECONDS", 60, 0, Long.MAX_VALUE),
                        env.longValue("MOD_BAN_SECOND_SECONDS", 600, 0, Long.MAX_VALUE),
                        env.longValue("MOD_BAN_THIRD_SECONDS", 86_400, 0, Long.MAX_VALUE),
                        env.intValue("MOD_RESET_HOUR", 4, 0, 23),
                        env.intValue("MOD_RETENTION_DAYS", 30, 1, 36_500)
                ),
                env.stringValue("MOD_DB_PATH", DEFAULT_DB_PATH),
                parseList(env.optional("MOD_FORBIDDEN_WORDS")),
                env.booleanValue("MOD_LOCAL_CHECK_ENABLED", true),
                env.booleanValue("MOD_AUTO_BAN_ENABLED", true),
                env.booleanValue("MOD_DELETE_ENABLED", true),
                parseListOrDefault(env.optional("MOD_EXEMPT_ROLES"), List.of("owner", "admin")),
                parseList(env.optional("MOD_GROUP_WHITELIST")),
                env.booleanValue("MOD_USER_COOLDOWN_ENABLED", false),
                Duration.ofSeconds(env.longValue("MOD_USER_COOLDOWN_SECONDS", 60, 0, 86_400)),
                env.booleanValue("MOD_STATISTICS_ENABLED", true),
                env.intValue("MOD_WORKER_THREADS", 4, 1, 256)
        );
    }

    public String requireDiscordToken() {
        if (discordToken == null || discordToken.isBlank()) {
            throw new IllegalStateException("DISCORD_TOKEN must be set in the environment");
        }
        return discordToken;
    }

    private static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private static List<String> parseListOrDefault(String value, List<String> fallback) {
        List<String> parsed = parseList(value);
        return parsed.isEmpty() ? fallback : parsed;
    }

    private static final class Reader {
        private final Function<String, String> lookup;

        private Reader(Function<String, String> lookup) {
            this.lookup = lookup;
        }

        String optional(String key) {
            String value = lookup.apply(key);
            return value == null || value.isBlank() ? null : value.trim();
        }

        String stringValue(String key, String defaultValue) {
            String value = optional(key);
            return value == null ? defaultValue : value;
        }

        int intValue(String key, int defaultValue, int min, int max) {
            return (int) longValue(key, defaultValue, min, max);
        }

        long longValue(String key, long defaultValue, long min, long max) {
            String value = optional(key);
            if (value == null) {
                return defaultValue;
            }
            long parsed;
            try {
                parsed = Long.parseLong(value);
            } catch (NumberFormatException error) {
                throw invalid(key, "is not a number");
            }
            if (parsed < min || parsed > max) {
                throw invalid(key, "must be between " + min + " and " + max);
            }
            return parsed;
        }

        boolean booleanValue(String key, boolean defaultValue) {
            String value = optional(key);
            if (value == null) {
                return defaultValue;
            }
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "true", "yes", "1", "on" -> true;
                case "false", "no", "0", "off" -> false;
                default -> throw invalid(key, "is not a boolean");
            };
        }

        private static IllegalStateException invalid(String key, String problem) {
            String safeKey = ENV_KEY_PATTERN.matcher(key).matches() ? key : "configuration value";
            return new IllegalStateException(safeKey + " " + problem);
        }
    }
}
