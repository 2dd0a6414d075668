package net.leasehold.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("leasehold")
public class LeaseholdProperties {
    private Catalog catalog = new Catalog();
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    /** 설정 파일로 선언하는 잡. 이름 기준으로 upsert 된다. */
    public static class JobDef {
        private String name;
        private String description;
        private String kind;
        private String schedule;
        private Map<String, Object> parameters = new LinkedHashMap<>(); // ← 가변
        private int priority;
        private int maxRetries = 3;
        private Duration timeout;
        private List<String> tags = new ArrayList<>();
        private Map<String, String> metadata = new LinkedHashMap<>();
        private Boolean enabled;    // null = 새 잡은 활성, 기존 잡은 저장된 값 유지

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public Map<String, Object> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, Object> parameters) {
            this.parameters = parameters;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public Map<String, String> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, String> metadata) {
            this.metadata = metadata;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", kind='" + kind + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", priority=" + priority +
                    ", enabled=" + enabled +
                    '}';
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private boolean enableDistributedLocking = true;
        private long lockLeaseSeconds = 360;
        private int historyRetentionDays = 30;
        private long pollIntervalMs = 5000;
        private long lockSweepIntervalMs = 60000;
        private long retentionSweepIntervalMs = 3600000;
        private int maxConcurrentJobs = 10;
        private Duration defaultTimeout = Duration.ofSeconds(300);
        private Duration retryBackoff = Duration.ofSeconds(1);
        private Duration maxRetryBackoff = Duration.ofSeconds(60);
        private Duration maxJitter = Duration.ZERO;
        private int candidateBatchSize = 50;
        private Duration leaseRenewalInterval = Duration.ZERO;
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private String instanceId;

        public Duration lease() {
            return Duration.ofSeconds(lockLeaseSeconds);
        }

        public Duration historyRetention() {
            return Duration.ofDays(historyRetentionDays);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isEnableDistributedLocking() {
            return enableDistributedLocking;
        }

        public void setEnableDistributedLocking(boolean enableDistributedLocking) {
            this.enableDistributedLocking = enableDistributedLocking;
        }

        public long getLockLeaseSeconds() {
            return lockLeaseSeconds;
        }

        public void setLockLeaseSeconds(long lockLeaseSeconds) {
            this.lockLeaseSeconds = lockLeaseSeconds;
        }

        public int getHistoryRetentionDays() {
            return historyRetentionDays;
        }

        public void setHistoryRetentionDays(int historyRetentionDays) {
            this.historyRetentionDays = historyRetentionDays;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getLockSweepIntervalMs() {
            return lockSweepIntervalMs;
        }

        public void setLockSweepIntervalMs(long lockSweepIntervalMs) {
            this.lockSweepIntervalMs = lockSweepIntervalMs;
        }

        public long getRetentionSweepIntervalMs() {
            return retentionSweepIntervalMs;
        }

        public void setRetentionSweepIntervalMs(long retentionSweepIntervalMs) {
            this.retentionSweepIntervalMs = retentionSweepIntervalMs;
        }

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getMaxRetryBackoff() {
            return maxRetryBackoff;
        }

        public void setMaxRetryBackoff(Duration maxRetryBackoff) {
            this.maxRetryBackoff = maxRetryBackoff;
        }

        public Duration getMaxJitter() {
            return maxJitter;
        }

        public void setMaxJitter(Duration maxJitter) {
            this.maxJitter = maxJitter;
        }

        public int getCandidateBatchSize() {
            return candidateBatchSize;
        }

        public void setCandidateBatchSize(int candidateBatchSize) {
            this.candidateBatchSize = candidateBatchSize;
        }

        public Duration getLeaseRenewalInterval() {
            return leaseRenewalInterval;
        }

        public void setLeaseRenewalInterval(Duration leaseRenewalInterval) {
            this.leaseRenewalInterval = leaseRenewalInterval;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public String getInstanceId() {
            return instanceId;
        }

        public void setInstanceId(String instanceId) {
            this.instanceId = instanceId;
        }
    }
}
