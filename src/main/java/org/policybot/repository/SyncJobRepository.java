package org.policybot.repository;

import org.policybot.entity.SyncJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SyncJobRepository extends JpaRepository<SyncJob, String> {

    List<SyncJob> findTop10ByRepoIdOrderByCreatedAtDesc(String repoId);
}
