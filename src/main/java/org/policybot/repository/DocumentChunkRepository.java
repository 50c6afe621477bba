package org.policybot.repository;

import org.policybot.entity.DocumentChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, String> {

    List<DocumentChunk> findByDocumentIdOrderBySeqAsc(String documentId);

    long countByDocumentId(String documentId);

    /**
     * 删除文档中序号 >= fromSeq 的分块；fromSeq 为 0 时删除全部
     *
     * @return 删除行数
     */
    @Transactional
    @Modifying
    @Query(value = "DELETE FROM document_chunks WHERE document_id = ?1 AND seq >= ?2", nativeQuery = true)
    int deleteFromSeq(String documentId, int fromSeq);
}
