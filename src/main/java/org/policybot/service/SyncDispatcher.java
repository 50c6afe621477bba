package org.policybot.service;

import org.policybot.DTO.ChangeSet;
import org.policybot.utils.LogUtils;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * 把同步运行放到后台线程。调用方拿到 jobId 后只能轮询状态。
 */
@Service
public class SyncDispatcher {

    private final DocumentSyncService documentSyncService;

    public SyncDispatcher(DocumentSyncService documentSyncService) {
        this.documentSyncService = documentSyncService;
    }

    @Async("syncTaskExecutor")
    public void dispatchIncremental(String jobId, ChangeSet changeSet) {
        try {
            documentSyncService.runIncremental(jobId, changeSet);
        } catch (Exception e) {
            LogUtils.logBusinessError("SYNC_INCREMENTAL", jobId, "增量同步运行失败", e);
        }
    }

    @Async("syncTaskExecutor")
    public void dispatchFull(String jobId) {
        try {
            documentSyncService.runFull(jobId);
        } catch (Exception e) {
            LogUtils.logBusinessError("SYNC_FULL", jobId, "全量同步运行失败", e);
        }
    }
}
