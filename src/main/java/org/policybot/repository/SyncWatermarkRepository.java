package org.policybot.repository;

import org.policybot.entity.SyncWatermark;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncWatermarkRepository extends JpaRepository<SyncWatermark, String> {
}
