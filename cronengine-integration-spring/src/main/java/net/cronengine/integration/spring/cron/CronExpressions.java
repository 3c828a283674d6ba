package net.cronengine.integration.spring.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Five-field UNIX cron parsing with a small LRU cache of {@link ExecutionTime}s (no Guava). */
public final class CronExpressions {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    static final int CACHE_SIZE = 256;
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(CACHE_SIZE);

    private CronExpressions() {}

    /**
     * @throws IllegalArgumentException if the expression is blank or does not parse
     */
    public static Cron parse(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) throw new IllegalArgumentException("Cron expression is empty");
        Cron cron = PARSER.parse(cronExpr.trim());
        cron.validate();
        return cron;
    }

    public static ExecutionTime executionTime(String cronExpr) {
        Objects.requireNonNull(cronExpr, "cronExpr");
        synchronized (CACHE) {
            ExecutionTime et = CACHE.get(cronExpr);
            if (et == null) {
                et = ExecutionTime.forCron(parse(cronExpr));
                CACHE.put(cronExpr, et);
            }
            return et;
        }
    }

    public static void invalidate(String expr) { synchronized (CACHE) { CACHE.remove(expr); } }
    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    static int cacheSize() { synchronized (CACHE) { return CACHE.size(); } }

    // --- LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
