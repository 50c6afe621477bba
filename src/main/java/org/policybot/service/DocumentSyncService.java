package org.policybot.service;

import org.policybot.DTO.ChangeSet;
import org.policybot.DTO.FileChange;
import org.policybot.DTO.FileSyncOutcome;
import org.policybot.client.ContentFetcher;
import org.policybot.config.SyncProperties;
import org.policybot.entity.PolicyDocument;
import org.policybot.entity.SyncJob;
import org.policybot.entity.SyncWatermark;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.repository.PolicyDocumentRepository;
import org.policybot.repository.SyncWatermarkRepository;
import org.policybot.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 文档同步引擎：增量同步和全量同步。
 * 文件按固定大小分批并发处理，批与批之间串行；单文件失败只计数，不中断任务。
 * 只有任务记录本身或全量列表这类共享前置步骤失败，才让整次运行失败。
 */
@Service
public class DocumentSyncService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSyncService.class);

    private final SyncJobService jobService;
    private final FileProcessingService fileProcessingService;
    private final ChangeClassificationService classificationService;
    private final ContentFetcher contentFetcher;
    private final PolicyDocumentRepository documentRepository;
    private final SyncWatermarkRepository watermarkRepository;
    private final SyncProperties syncProperties;
    private final Executor workerExecutor;

    public DocumentSyncService(SyncJobService jobService,
                               FileProcessingService fileProcessingService,
                               ChangeClassificationService classificationService,
                               ContentFetcher contentFetcher,
                               PolicyDocumentRepository documentRepository,
                               SyncWatermarkRepository watermarkRepository,
                               SyncProperties syncProperties,
                               @Qualifier("syncWorkerExecutor") Executor workerExecutor) {
        this.jobService = jobService;
        this.fileProcessingService = fileProcessingService;
        this.classificationService = classificationService;
        this.contentFetcher = contentFetcher;
        this.documentRepository = documentRepository;
        this.watermarkRepository = watermarkRepository;
        this.syncProperties = syncProperties;
        this.workerExecutor = workerExecutor;
    }

    /**
     * 增量同步：变更集已经过滤，删除的路径清理文档，新增和修改的路径重建分块
     */
    public SyncJob runIncremental(String jobId, ChangeSet changeSet) {
        LogUtils.setRequestContext(null, null, jobId);
        SyncJob job = jobService.start(jobId);
        try {
            String revision = changeSet.getRevision();
            job.setRevision(revision);
            job.setFilesTotal(changeSet.getChanges().size());
            job.setFilesAdded((int) changeSet.count(FileChange.Status.ADDED));
            job.setFilesModified((int) changeSet.count(FileChange.Status.MODIFIED));
            job.setFilesDeleted((int) changeSet.count(FileChange.Status.REMOVED));
            jobService.checkpoint(job);
            LogUtils.logSync(jobId, "INCREMENTAL_START", 0, job.getFilesTotal(), "提交: " + revision);

            List<FileTask> tasks = new ArrayList<>();
            for (FileChange change : changeSet.getChanges()) {
                String path = change.getPath();
                if (change.getStatus() == FileChange.Status.REMOVED) {
                    tasks.add(new FileTask(path, () -> fileProcessingService.remove(path)));
                } else {
                    tasks.add(new FileTask(path, () -> fileProcessingService.upsert(path, revision, false, false)));
                }
            }
            runBatches(job, tasks);
            return jobService.complete(job);
        } catch (RuntimeException e) {
            jobService.fail(job, e.getMessage());
            throw e;
        } finally {
            LogUtils.clearRequestContext();
        }
    }

    /**
     * 全量同步：列出分支头提交下的全部文档逐个处理。
     * 非强制时跳过已在同一提交处理过的文档，同一提交重复执行不会重复处理。
     * 批处理结束后清理列表中已不存在的文档，并更新仓库水位。
     */
    public SyncJob runFull(String jobId) {
        LogUtils.setRequestContext(null, null, jobId);
        SyncJob job = jobService.start(jobId);
        try {
            String branch = job.getBranch() != null ? job.getBranch() : syncProperties.getDefaultBranch();
            String revision = contentFetcher.resolveRevision(branch);
            job.setRevision(revision);

            List<String> paths = classificationService.classifyListing(contentFetcher.listFiles(revision));
            job.setFilesTotal(paths.size());
            jobService.checkpoint(job);
            LogUtils.logSync(jobId, "FULL_START", 0, paths.size(), "分支: " + branch + ", 提交: " + revision + ", 强制: " + job.isForce());

            boolean force = job.isForce();
            List<FileTask> tasks = new ArrayList<>();
            for (String path : paths) {
                tasks.add(new FileTask(path, () -> fileProcessingService.upsert(path, revision, true, force)));
            }
            runBatches(job, tasks);

            deactivateMissing(job, new HashSet<>(paths));
            updateWatermark(job);
            return jobService.complete(job);
        } catch (RuntimeException e) {
            jobService.fail(job, e.getMessage());
            throw e;
        } finally {
            LogUtils.clearRequestContext();
        }
    }

    private void runBatches(SyncJob job, List<FileTask> tasks) {
        int batchSize = Math.max(1, syncProperties.getConcurrency());
        int interval = Math.max(1, syncProperties.getProgressInterval());
        int sinceCheckpoint = 0;
        String jobId = job.getJobId();

        for (int i = 0; i < tasks.size(); i += batchSize) {
            List<FileTask> batch = tasks.subList(i, Math.min(i + batchSize, tasks.size()));
            List<CompletableFuture<FileSyncOutcome>> futures = new ArrayList<>(batch.size());
            for (FileTask task : batch) {
                futures.add(submit(jobId, task));
            }
            for (int j = 0; j < batch.size(); j++) {
                FileSyncOutcome outcome = await(futures.get(j), batch.get(j).path);
                if (apply(job, outcome)) {
                    sinceCheckpoint++;
                }
            }
            if (sinceCheckpoint >= interval) {
                jobService.checkpoint(job);
                sinceCheckpoint = 0;
            }
        }
        if (sinceCheckpoint > 0) {
            jobService.checkpoint(job);
        }
    }

    private CompletableFuture<FileSyncOutcome> submit(String jobId, FileTask task) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                MDC.put(LogUtils.JOB_ID, jobId);
                try {
                    return task.work.get();
                } finally {
                    MDC.remove(LogUtils.JOB_ID);
                }
            }, workerExecutor);
        } catch (RuntimeException e) {
            // 线程池拒绝
            return CompletableFuture.completedFuture(
                    FileSyncOutcome.failed(task.path, null, ErrorKind.INDEX, "提交处理任务失败: " + e.getMessage()));
        }
    }

    private FileSyncOutcome await(CompletableFuture<FileSyncOutcome> future, String path) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            logger.error("文件处理异常 => path: {}", path, e);
            return FileSyncOutcome.failed(path, null, ErrorKind.INDEX, e.getMessage());
        }
    }

    /**
     * 计入任务计数，返回是否算作一次进度（成功或失败）
     */
    private boolean apply(SyncJob job, FileSyncOutcome outcome) {
        if (outcome.isFailed()) {
            job.setFilesFailed(job.getFilesFailed() + 1);
            return true;
        }
        if (outcome.isProcessed()) {
            job.setFilesProcessed(job.getFilesProcessed() + 1);
            job.addChunkCounts(outcome.getChunks().getCreated(), outcome.getChunks().getUpdated(),
                    outcome.getChunks().getDeleted());
            return true;
        }
        return false;
    }

    private void deactivateMissing(SyncJob job, Set<String> listedPaths) {
        int deactivated = 0;
        for (PolicyDocument document : documentRepository.findByRepoIdAndActiveTrue(syncProperties.getRepoId())) {
            if (listedPaths.contains(document.getFilePath())) {
                continue;
            }
            FileSyncOutcome outcome = fileProcessingService.deactivate(document);
            if (outcome.isFailed()) {
                job.setFilesFailed(job.getFilesFailed() + 1);
            } else {
                job.setFilesDeleted(job.getFilesDeleted() + 1);
                job.addChunkCounts(0, 0, outcome.getChunks().getDeleted());
                deactivated++;
            }
        }
        if (deactivated > 0) {
            logger.info("已失效的文档数: {}", deactivated);
        }
    }

    private void updateWatermark(SyncJob job) {
        try {
            SyncWatermark watermark = watermarkRepository.findById(job.getRepoId()).orElseGet(SyncWatermark::new);
            watermark.setRepoId(job.getRepoId());
            watermark.setLastSyncCommit(job.getRevision());
            watermark.setLastSyncAt(LocalDateTime.now());
            watermark.setFilesTotal(job.getFilesTotal());
            watermark.setFilesProcessed(job.getFilesProcessed());
            watermarkRepository.save(watermark);
        } catch (Exception e) {
            throw new CustomException("仓库水位写入失败: " + e.getMessage(), ErrorKind.JOB_SETUP,
                    HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    private static class FileTask {
        private final String path;
        private final Supplier<FileSyncOutcome> work;

        FileTask(String path, Supplier<FileSyncOutcome> work) {
            this.path = path;
            this.work = work;
        }
    }
}
