package net.leasehold.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** cron-utils 파서 + 파싱 결과 LRU 캐시 (6필드 Spring 문법) */
public final class CronExpressions {
    private static final Logger log = LoggerFactory.getLogger(CronExpressions.class);

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    static final int CACHE_SIZE = 256;
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(CACHE_SIZE);

    private CronExpressions() {}

    /** 파싱 실패면 empty */
    public static Optional<ExecutionTime> parse(String expr) {
        Objects.requireNonNull(expr, "expr");
        String key = expr.trim();
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(key);
            if (cached != null) return Optional.of(cached);
        }
        ExecutionTime et;
        try {
            et = ExecutionTime.forCron(PARSER.parse(key));
        } catch (IllegalArgumentException e) {
            log.debug("cron expression [{}] rejected: {}", key, e.getMessage());
            return Optional.empty();
        }
        synchronized (CACHE) {
            CACHE.put(key, et);
        }
        return Optional.of(et);
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    static int cachedCount() { synchronized (CACHE) { return CACHE.size(); } }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
