package fr.imt.jobdaemon.jobdaemon.business.cron;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed cron expressions keyed by their text, kept in a small least-recently-used cache.
 * Each scheduler component owns its instance.
 */
public class CronMatcher {

    public static final int DEFAULT_CAPACITY = 256;

    private final Map<String, CronExpression> cache;

    public CronMatcher() {
        this(DEFAULT_CAPACITY);
    }

    public CronMatcher(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cron cache capacity must be positive, got " + capacity);
        }
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CronExpression> eldest) {
                return size() > capacity;
            }
        };
    }

    public CronExpression compile(String expression) {
        synchronized (cache) {
            return cache.computeIfAbsent(expression.trim(), CronExpression::parse);
        }
    }

    public boolean matches(String expression, Instant instant, ZoneId zone) {
        return compile(expression).matches(instant.atZone(zone));
    }

    public Optional<Instant> nextAfter(String expression, Instant instant, ZoneId zone) {
        return compile(expression).nextAfter(instant.atZone(zone)).map(time -> time.toInstant());
    }

    int cachedExpressions() {
        synchronized (cache) {
            return cache.size();
        }
    }
}
