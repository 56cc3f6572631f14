package com.scout.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "scout-pipeline/0.1 (+contact)";
    private static final long MAX_FILE_BYTES_DEFAULT = 200L * 1024 * 1024;

    private String workerId;
    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private Queue queue = new Queue();
    private Admission admission = new Admission();
    private Retry retry = new Retry();
    private Recrawl recrawl = new Recrawl();
    private Daemon daemon = new Daemon();
    private Intake intake = new Intake();
    private Transform transform = new Transform();
    private Scheduling scheduling = new Scheduling();
    private Cli cli = new Cli();

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId == null || workerId.isBlank() ? null : workerId.trim();
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Admission getAdmission() {
        return admission;
    }

    public void setAdmission(Admission admission) {
        this.admission = admission;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Recrawl getRecrawl() {
        return recrawl;
    }

    public void setRecrawl(Recrawl recrawl) {
        this.recrawl = recrawl;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public Intake getIntake() {
        return intake;
    }

    public void setIntake(Intake intake) {
        this.intake = intake;
    }

    public Transform getTransform() {
        return transform;
    }

    public void setTransform(Transform transform) {
        this.transform = transform;
    }

    public Scheduling getScheduling() {
        return scheduling;
    }

    public void setScheduling(Scheduling scheduling) {
        this.scheduling = scheduling;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    static int clampPriority(int priority) {
        return Math.max(1, Math.min(9, priority));
    }

    public static class Queue {
        private int defaultPriority = 5;
        private int seedPriority = 3;
        private int discoveredPriority = 6;
        private int recrawlPriority = 6;
        private int maxDepth = 3;
        private int claimScanLimit = 50;
        private int staleLeaseMinutes = 120;
        private int retentionDays = 30;

        public int getDefaultPriority() {
            return defaultPriority;
        }

        public void setDefaultPriority(int defaultPriority) {
            this.defaultPriority = clampPriority(defaultPriority);
        }

        public int getSeedPriority() {
            return seedPriority;
        }

        public void setSeedPriority(int seedPriority) {
            this.seedPriority = clampPriority(seedPriority);
        }

        public int getDiscoveredPriority() {
            return discoveredPriority;
        }

        public void setDiscoveredPriority(int discoveredPriority) {
            this.discoveredPriority = clampPriority(discoveredPriority);
        }

        public int getRecrawlPriority() {
            return recrawlPriority;
        }

        public void setRecrawlPriority(int recrawlPriority) {
            this.recrawlPriority = clampPriority(recrawlPriority);
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public int getClaimScanLimit() {
            return claimScanLimit;
        }

        public void setClaimScanLimit(int claimScanLimit) {
            this.claimScanLimit = Math.max(1, claimScanLimit);
        }

        public int getStaleLeaseMinutes() {
            return staleLeaseMinutes;
        }

        public void setStaleLeaseMinutes(int staleLeaseMinutes) {
            this.staleLeaseMinutes = Math.max(1, staleLeaseMinutes);
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = Math.max(1, retentionDays);
        }
    }

    public static class Admission {
        private long defaultMinSpacingMs = 1500;
        private long emergencySpacingMs = 3_600_000;

        public long getDefaultMinSpacingMs() {
            return defaultMinSpacingMs;
        }

        public void setDefaultMinSpacingMs(long defaultMinSpacingMs) {
            this.defaultMinSpacingMs = Math.max(0, defaultMinSpacingMs);
        }

        public long getEmergencySpacingMs() {
            return emergencySpacingMs;
        }

        public void setEmergencySpacingMs(long emergencySpacingMs) {
            this.emergencySpacingMs = Math.max(0, emergencySpacingMs);
        }
    }

    public static class Retry {
        private long baseDelaySeconds = 60;
        private int maxDoublings = 6;
        private int quarantineThreshold = 6;

        public long getBaseDelaySeconds() {
            return baseDelaySeconds;
        }

        public void setBaseDelaySeconds(long baseDelaySeconds) {
            this.baseDelaySeconds = Math.max(1, baseDelaySeconds);
        }

        public int getMaxDoublings() {
            return maxDoublings;
        }

        public void setMaxDoublings(int maxDoublings) {
            this.maxDoublings = Math.max(0, Math.min(20, maxDoublings));
        }

        public int getQuarantineThreshold() {
            return quarantineThreshold;
        }

        public void setQuarantineThreshold(int quarantineThreshold) {
            this.quarantineThreshold = Math.max(1, quarantineThreshold);
        }
    }

    public static class Recrawl {
        private int successTtlHours = 24;
        private int failureTtlHours = 168;
        private int batchSize = 500;

        public int getSuccessTtlHours() {
            return successTtlHours;
        }

        public void setSuccessTtlHours(int successTtlHours) {
            this.successTtlHours = Math.max(1, successTtlHours);
        }

        public int getFailureTtlHours() {
            return failureTtlHours;
        }

        public void setFailureTtlHours(int failureTtlHours) {
            this.failureTtlHours = Math.max(1, failureTtlHours);
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }
    }

    public static class Daemon {
        private boolean enabled = false;
        private int workerCount = 2;
        private int pollIntervalMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }
    }

    public static class Intake {
        private long maxFileBytes = MAX_FILE_BYTES_DEFAULT;
        private int manualPriority = 2;
        private int triggerPriority = 5;
        private String bucket = "scout-ingest";
        private List<String> acceptedPrefixes = new ArrayList<>(List.of("edge-inbox/", "email-attachments/"));
        private String storageRoot = "./data/objects";
        private boolean workerEnabled = false;
        private int workerCount = 1;
        private int pollIntervalMs = 2000;

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = Math.max(1, maxFileBytes);
        }

        public int getManualPriority() {
            return manualPriority;
        }

        public void setManualPriority(int manualPriority) {
            this.manualPriority = clampPriority(manualPriority);
        }

        public int getTriggerPriority() {
            return triggerPriority;
        }

        public void setTriggerPriority(int triggerPriority) {
            this.triggerPriority = clampPriority(triggerPriority);
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket == null ? "" : bucket.trim();
        }

        public List<String> getAcceptedPrefixes() {
            return acceptedPrefixes;
        }

        public void setAcceptedPrefixes(List<String> acceptedPrefixes) {
            this.acceptedPrefixes = acceptedPrefixes == null ? new ArrayList<>() : new ArrayList<>(acceptedPrefixes);
        }

        public String getStorageRoot() {
            return storageRoot;
        }

        public void setStorageRoot(String storageRoot) {
            this.storageRoot = storageRoot;
        }

        public boolean isWorkerEnabled() {
            return workerEnabled;
        }

        public void setWorkerEnabled(boolean workerEnabled) {
            this.workerEnabled = workerEnabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }
    }

    public static class Transform {
        private int promoteBatchSize = 500;
        private String refreshLockName = "gold-refresh";
        private long refreshLockTtlSeconds = 600;

        public int getPromoteBatchSize() {
            return promoteBatchSize;
        }

        public void setPromoteBatchSize(int promoteBatchSize) {
            this.promoteBatchSize = Math.max(1, promoteBatchSize);
        }

        public String getRefreshLockName() {
            return refreshLockName;
        }

        public void setRefreshLockName(String refreshLockName) {
            this.refreshLockName = refreshLockName == null || refreshLockName.isBlank()
                ? "gold-refresh"
                : refreshLockName.trim();
        }

        public long getRefreshLockTtlSeconds() {
            return refreshLockTtlSeconds;
        }

        public void setRefreshLockTtlSeconds(long refreshLockTtlSeconds) {
            this.refreshLockTtlSeconds = Math.max(1, refreshLockTtlSeconds);
        }
    }

    public static class Scheduling {
        private boolean enabled = false;
        private long sweepIntervalMs = 300_000;
        private long recrawlIntervalMs = 900_000;
        private long transformIntervalMs = 120_000;
        private long retentionIntervalMs = 86_400_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = Math.max(1000, sweepIntervalMs);
        }

        public long getRecrawlIntervalMs() {
            return recrawlIntervalMs;
        }

        public void setRecrawlIntervalMs(long recrawlIntervalMs) {
            this.recrawlIntervalMs = Math.max(1000, recrawlIntervalMs);
        }

        public long getTransformIntervalMs() {
            return transformIntervalMs;
        }

        public void setTransformIntervalMs(long transformIntervalMs) {
            this.transformIntervalMs = Math.max(1000, transformIntervalMs);
        }

        public long getRetentionIntervalMs() {
            return retentionIntervalMs;
        }

        public void setRetentionIntervalMs(long retentionIntervalMs) {
            this.retentionIntervalMs = Math.max(1000, retentionIntervalMs);
        }
    }

    public static class Cli {
        private String seedSource = "";
        private String seedUrls = "";

        public String getSeedSource() {
            return seedSource;
        }

        public void setSeedSource(String seedSource) {
            this.seedSource = seedSource == null ? "" : seedSource.trim();
        }

        public String getSeedUrls() {
            return seedUrls;
        }

        public void setSeedUrls(String seedUrls) {
            this.seedUrls = seedUrls == null ? "" : seedUrls;
        }
    }
}
