package net.leasehold.core.executor;

import net.leasehold.core.error.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** kind -> 실행기. 기동 시 스토어에 있는 모든 kind 를 검증한다. */
public final class ExecutorRegistry {
    private final Map<String, JobExecutor> byKind = new LinkedHashMap<>();

    public ExecutorRegistry(Collection<? extends JobExecutor> executors) {
        for (JobExecutor e : executors) {
            String kind = e.kind();
            if (kind == null || kind.isBlank()) {
                throw new ConfigurationException("executor " + e.getClass().getName() + " declares no kind");
            }
            JobExecutor prev = byKind.putIfAbsent(kind, e);
            if (prev != null) {
                throw new ConfigurationException("duplicate executor for kind '" + kind + "': "
                        + prev.getClass().getName() + ", " + e.getClass().getName());
            }
        }
    }

    public JobExecutor require(String kind) {
        JobExecutor e = byKind.get(kind);
        if (e == null) throw new ConfigurationException("no executor registered for kind '" + kind + "'");
        return e;
    }

    public boolean supports(String kind) {
        return byKind.containsKey(kind);
    }

    public void validate(Collection<String> kinds) {
        Set<String> missing = new TreeSet<>();
        for (String k : kinds) {
            if (!byKind.containsKey(k)) missing.add(k);
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("unregistered job kinds: " + missing
                    + " (registered: " + byKind.keySet() + ")");
        }
    }

    public Set<String> kinds() {
        return Collections.unmodifiableSet(byKind.keySet());
    }
}
