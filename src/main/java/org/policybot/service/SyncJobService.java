package org.policybot.service;

import org.policybot.config.SyncProperties;
import org.policybot.entity.SyncJob;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.repository.SyncJobRepository;
import org.policybot.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * 同步任务记录的创建与状态流转。记录写不进去属于 JOB_SETUP 错误。
 */
@Service
public class SyncJobService {

    private static final Logger logger = LoggerFactory.getLogger(SyncJobService.class);

    private final SyncJobRepository jobRepository;
    private final SyncProperties syncProperties;

    public SyncJobService(SyncJobRepository jobRepository, SyncProperties syncProperties) {
        this.jobRepository = jobRepository;
        this.syncProperties = syncProperties;
    }

    public SyncJob createJob(SyncJob.TriggerType triggerType, String revision, String branch, boolean force) {
        SyncJob job = new SyncJob();
        job.setJobId(UUID.randomUUID().toString());
        job.setRepoId(syncProperties.getRepoId());
        job.setTriggerType(triggerType);
        job.setRevision(revision);
        job.setBranch(branch);
        job.setForce(force);
        SyncJob saved = save(job);
        LogUtils.logBusiness("SYNC_JOB_CREATE", saved.getJobId(), "创建同步任务, 类型: %s, 分支: %s, 提交: %s",
                triggerType, branch, revision);
        return saved;
    }

    public SyncJob start(String jobId) {
        SyncJob job = get(jobId);
        job.markRunning();
        return save(job);
    }

    /**
     * 进度检查点，只更新计数，不改变状态
     */
    public SyncJob checkpoint(SyncJob job) {
        SyncJob saved = save(job);
        LogUtils.logSync(job.getJobId(), "PROGRESS", job.getFilesProcessed(), job.getFilesTotal(),
                "失败: " + job.getFilesFailed());
        return saved;
    }

    public SyncJob complete(SyncJob job) {
        job.markCompleted();
        SyncJob saved = save(job);
        LogUtils.logSync(job.getJobId(), "COMPLETED", job.getFilesProcessed(), job.getFilesTotal(),
                String.format("新增块: %d, 更新块: %d, 删除块: %d, 失败文件: %d",
                        job.getChunksCreated(), job.getChunksUpdated(), job.getChunksDeleted(), job.getFilesFailed()));
        return saved;
    }

    /**
     * 标记失败。失败状态本身写不进去时只记录日志，原始错误已由调用方处理。
     */
    public void fail(SyncJob job, String message) {
        if (job.getStatus().isTerminal()) {
            logger.warn("任务 {} 已结束（{}），忽略失败标记: {}", job.getJobId(), job.getStatus(), message);
            return;
        }
        job.markFailed(message);
        try {
            jobRepository.save(job);
        } catch (Exception e) {
            logger.error("任务 {} 失败状态写入失败", job.getJobId(), e);
        }
        LogUtils.logSync(job.getJobId(), "FAILED", job.getFilesProcessed(), job.getFilesTotal(), message);
    }

    public SyncJob get(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> CustomException.notFound("同步任务不存在: " + jobId));
    }

    public List<SyncJob> recentJobs() {
        return jobRepository.findTop10ByRepoIdOrderByCreatedAtDesc(syncProperties.getRepoId());
    }

    private SyncJob save(SyncJob job) {
        try {
            return jobRepository.save(job);
        } catch (Exception e) {
            throw new CustomException("同步任务记录写入失败: " + e.getMessage(), ErrorKind.JOB_SETUP,
                    HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }
}
