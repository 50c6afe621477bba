package org.policybot.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 已索引的规章文档，ID 由仓库和路径稳定派生
 */
@Data
@Entity
@Table(name = "policy_documents", indexes = {
        @Index(name = "idx_repo_path", columnList = "repo_id, file_path"),
        @Index(name = "idx_repo_active", columnList = "repo_id, active")
})
public class PolicyDocument {

    @Id
    @Column(length = 160)
    private String id; // {repoKey}_{md5(path)}

    @Column(name = "repo_id", nullable = false, length = 128)
    private String repoId;

    @Column(name = "file_path", nullable = false, length = 512)
    private String filePath;

    @Column(name = "file_name")
    private String fileName;

    @Column(length = 64)
    private String revision; // 最后一次处理时的提交

    @Column(name = "content_hash", length = 64)
    private String contentHash; // sha256

    private Long size;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private Language lang;

    @Column(length = 512)
    private String title;

    @Column(name = "chunk_count")
    private Integer chunkCount = 0;

    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
