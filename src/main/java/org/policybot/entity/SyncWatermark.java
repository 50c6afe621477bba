package org.policybot.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 仓库级同步水位，只在全量同步的批处理循环结束后更新
 */
@Data
@Entity
@Table(name = "sync_watermarks")
public class SyncWatermark {

    @Id
    @Column(name = "repo_id", length = 128)
    private String repoId;

    @Column(name = "last_sync_commit", length = 64)
    private String lastSyncCommit;

    @Column(name = "last_sync_at")
    private LocalDateTime lastSyncAt;

    private int filesTotal;

    private int filesProcessed;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
