package org.policybot.entity;

import jakarta.persistence.*;
import lombok.Data;

/**
 * 文本分块，ID 为 {documentId}_{seq}，与向量索引中的点一一对应
 */
@Data
@Entity
@Table(name = "document_chunks", indexes = {
        @Index(name = "idx_document_seq", columnList = "document_id, seq")
})
public class DocumentChunk {

    @Id
    @Column(length = 180)
    private String id;

    @Column(name = "document_id", nullable = false, length = 160)
    private String documentId;

    @Column(nullable = false)
    private Integer seq;

    @Lob
    @Column(name = "text_content", columnDefinition = "TEXT")
    private String textContent;

    @Column(name = "text_hash", length = 64)
    private String textHash;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private Language lang;

    @Column(length = 512)
    private String title;

    @Column(length = 64)
    private String revision;

    @Column(name = "file_path", length = 512)
    private String filePath;

    public static String idOf(String documentId, int seq) {
        return documentId + "_" + seq;
    }
}
