package org.policybot.service;

import org.policybot.DTO.ChangeSet;
import org.policybot.config.SyncProperties;
import org.policybot.entity.SyncJob;
import org.policybot.repository.RedisRepository;
import org.policybot.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 同步入口：创建任务记录后交给后台执行，立即返回任务。
 * 同一 revision + 变更集的重复投递只执行一次。
 */
@Service
public class SyncTriggerService {

    private static final Logger logger = LoggerFactory.getLogger(SyncTriggerService.class);

    private static final String DEDUPE_KEY_PREFIX = "webhook:push:";

    private final SyncJobService jobService;
    private final SyncDispatcher dispatcher;
    private final ChangeClassificationService classificationService;
    private final RedisRepository redisRepository;
    private final SyncProperties syncProperties;

    public SyncTriggerService(SyncJobService jobService, SyncDispatcher dispatcher,
                              ChangeClassificationService classificationService,
                              RedisRepository redisRepository, SyncProperties syncProperties) {
        this.jobService = jobService;
        this.dispatcher = dispatcher;
        this.classificationService = classificationService;
        this.redisRepository = redisRepository;
        this.syncProperties = syncProperties;
    }

    /**
     * 重复投递返回 null
     */
    public SyncJob submitIncremental(ChangeSet changeSet) {
        String key = DEDUPE_KEY_PREFIX + classificationService.fingerprint(changeSet);
        Duration ttl = Duration.ofHours(syncProperties.getDedupeTtlHours());
        if (!redisRepository.markIfAbsent(key, changeSet.getRevision(), ttl)) {
            logger.info("重复的 push 通知，忽略 => revision: {}", changeSet.getRevision());
            return null;
        }
        SyncJob job;
        try {
            job = jobService.createJob(SyncJob.TriggerType.INCREMENTAL, changeSet.getRevision(), changeSet.getBranch(), false);
        } catch (RuntimeException e) {
            // 任务没建成，允许重投递再试
            redisRepository.delete(key);
            throw e;
        }
        try {
            dispatcher.dispatchIncremental(job.getJobId(), changeSet);
        } catch (RuntimeException e) {
            // 线程池拒绝时任务不会再执行，标记失败并放开去重，让重投递重新触发
            jobService.fail(job, "任务分发失败: " + e.getMessage());
            redisRepository.delete(key);
            throw e;
        }
        return job;
    }

    public SyncJob submitFull(String branch, boolean force) {
        String target = branch == null || branch.isBlank() ? syncProperties.getDefaultBranch() : branch;
        SyncJob job = jobService.createJob(SyncJob.TriggerType.FULL, null, target, force);
        LogUtils.logBusiness("SYNC_FULL_SUBMIT", job.getJobId(), "提交全量同步, 分支: %s, 强制: %s", target, force);
        try {
            dispatcher.dispatchFull(job.getJobId());
        } catch (RuntimeException e) {
            jobService.fail(job, "任务分发失败: " + e.getMessage());
            throw e;
        }
        return job;
    }
}
