package org.policybot.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 同步任务审计记录。状态只能 PENDING -> RUNNING -> COMPLETED|FAILED，终态不可再变。
 */
@Data
@Entity
@Table(name = "sync_jobs", indexes = {
        @Index(name = "idx_repo_created", columnList = "repo_id, created_at")
})
public class SyncJob {

    public enum TriggerType {
        INCREMENTAL, FULL
    }

    public enum Status {
        PENDING, RUNNING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    @Id
    @Column(name = "job_id", length = 64)
    private String jobId;

    @Column(name = "repo_id", nullable = false, length = 128)
    private String repoId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 16)
    private TriggerType triggerType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Column(length = 64)
    private String revision;

    @Column(length = 128)
    private String branch;

    private boolean force;

    private int filesTotal;
    private int filesProcessed;
    private int filesFailed;
    private int filesAdded;
    private int filesModified;
    private int filesDeleted;
    private int chunksCreated;
    private int chunksUpdated;
    private int chunksDeleted;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public void markRunning() {
        if (status != Status.PENDING) {
            throw new IllegalStateException("任务 " + jobId + " 状态为 " + status + "，不能开始运行");
        }
        status = Status.RUNNING;
        startedAt = LocalDateTime.now();
    }

    public void markCompleted() {
        if (status != Status.RUNNING) {
            throw new IllegalStateException("任务 " + jobId + " 状态为 " + status + "，不能标记完成");
        }
        status = Status.COMPLETED;
        completedAt = LocalDateTime.now();
    }

    /**
     * 非终态都可以直接失败（包括还没开始运行的任务）
     */
    public void markFailed(String message) {
        if (status.isTerminal()) {
            throw new IllegalStateException("任务 " + jobId + " 已结束（" + status + "）");
        }
        status = Status.FAILED;
        errorMessage = message;
        completedAt = LocalDateTime.now();
    }

    public void addChunkCounts(int created, int updated, int deleted) {
        chunksCreated += created;
        chunksUpdated += updated;
        chunksDeleted += deleted;
    }
}
