package org.policybot.controller;

import org.policybot.DTO.ManualSyncRequest;
import org.policybot.annotation.LogAction;
import org.policybot.config.SyncProperties;
import org.policybot.entity.SyncJob;
import org.policybot.repository.SyncWatermarkRepository;
import org.policybot.service.SyncJobService;
import org.policybot.service.SyncTriggerService;
import org.policybot.utils.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final SyncTriggerService syncTriggerService;
    private final SyncJobService syncJobService;
    private final SyncWatermarkRepository watermarkRepository;
    private final SyncProperties syncProperties;

    public SyncController(SyncTriggerService syncTriggerService, SyncJobService syncJobService,
                          SyncWatermarkRepository watermarkRepository, SyncProperties syncProperties) {
        this.syncTriggerService = syncTriggerService;
        this.syncJobService = syncJobService;
        this.watermarkRepository = watermarkRepository;
        this.syncProperties = syncProperties;
    }

    /**
     * 手动触发全量同步
     */
    @PostMapping("/manual")
    @LogAction(value = "同步", action = "MANUAL_SYNC")
    public ResponseEntity<Result<Map<String, Object>>> manualSync(@RequestBody(required = false) ManualSyncRequest request) {
        ManualSyncRequest req = request != null ? request : new ManualSyncRequest();
        SyncJob job = syncTriggerService.submitFull(req.getBranch(), req.isForce());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getJobId());
        data.put("branch", job.getBranch());
        data.put("force", job.isForce());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.success("全量同步已开始", data));
    }

    @GetMapping("/status")
    @LogAction(value = "同步", action = "SYNC_STATUS", logArgs = false)
    public ResponseEntity<Result<Map<String, Object>>> status() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("repoId", syncProperties.getRepoId());
        data.put("watermark", watermarkRepository.findById(syncProperties.getRepoId()).orElse(null));
        data.put("recentJobs", syncJobService.recentJobs());
        return ResponseEntity.ok(Result.success(data));
    }

    @GetMapping("/jobs/{jobId}")
    @LogAction(value = "同步", action = "SYNC_JOB")
    public ResponseEntity<Result<SyncJob>> job(@PathVariable String jobId) {
        return ResponseEntity.ok(Result.success(syncJobService.get(jobId)));
    }
}
