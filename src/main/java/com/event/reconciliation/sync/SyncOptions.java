package com.event.reconciliation.sync;

import java.util.Objects;

/**
 * Configuration for {@link EventRequestSyncService}.
 */
public class SyncOptions {

    public static final String DEFAULT_ACTOR_ID = "intake_sync";
    public static final String DEFAULT_LOCK_KEY = "event-request-sync";
    public static final MergePolicy DEFAULT_MERGE_POLICY = MergePolicy.OVERWRITE_NON_BLANK;
    public static final boolean DEFAULT_APPEND_CREATED_TO_SNAPSHOT = true;
    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final String actorId;
    private final String lockKey;
    private final MergePolicy mergePolicy;
    private final boolean appendCreatedToSnapshot;
    private final int progressInterval;

    private SyncOptions(Builder builder) {
        this.actorId = builder.actorId;
        this.lockKey = builder.lockKey;
        this.mergePolicy = builder.mergePolicy;
        this.appendCreatedToSnapshot = builder.appendCreatedToSnapshot;
        this.progressInterval = builder.progressInterval;
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Identity recorded as {@code createdBy} and in audit entries.
     */
    public String getActorId() {
        return actorId;
    }

    /**
     * Lock key guaranteeing that only one pass runs at a time.
     */
    public String getLockKey() {
        return lockKey;
    }

    public MergePolicy getMergePolicy() {
        return mergePolicy;
    }

    /**
     * Whether a record created by a row is visible to later rows of the same pass.
     * When false, two rows of one pass that match only each other both create records.
     */
    public boolean isAppendCreatedToSnapshot() {
        return appendCreatedToSnapshot;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public static class Builder {
        private String actorId = DEFAULT_ACTOR_ID;
        private String lockKey = DEFAULT_LOCK_KEY;
        private MergePolicy mergePolicy = DEFAULT_MERGE_POLICY;
        private boolean appendCreatedToSnapshot = DEFAULT_APPEND_CREATED_TO_SNAPSHOT;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder actorId(String actorId) {
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalArgumentException("actorId must not be blank");
            }
            this.actorId = actorId;
            return this;
        }

        public Builder lockKey(String lockKey) {
            if (lockKey == null || lockKey.isBlank()) {
                throw new IllegalArgumentException("lockKey must not be blank");
            }
            this.lockKey = lockKey;
            return this;
        }

        public Builder mergePolicy(MergePolicy mergePolicy) {
            this.mergePolicy = Objects.requireNonNull(mergePolicy, "mergePolicy is required");
            return this;
        }

        public Builder appendCreatedToSnapshot(boolean appendCreatedToSnapshot) {
            this.appendCreatedToSnapshot = appendCreatedToSnapshot;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be at least 1");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }
    }
}
