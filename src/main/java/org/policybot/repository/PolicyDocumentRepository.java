package org.policybot.repository;

import org.policybot.entity.PolicyDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PolicyDocumentRepository extends JpaRepository<PolicyDocument, String> {

    /**
     * 查询仓库下所有仍然有效的文档，用于全量同步后清理已删除的路径。
     *
     * @param repoId 仓库标识 owner/repo
     * @return 有效文档列表
     */
    List<PolicyDocument> findByRepoIdAndActiveTrue(String repoId);

    long countByRepoIdAndActiveTrue(String repoId);
}
