package org.policybot.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.policybot.DTO.ChangeSet;
import org.policybot.annotation.LogAction;
import org.policybot.config.SyncProperties;
import org.policybot.entity.SyncJob;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.service.ChangeClassificationService;
import org.policybot.service.SyncTriggerService;
import org.policybot.service.WebhookSignatureVerifier;
import org.policybot.utils.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GitHub push webhook：校验签名后立即应答，同步在后台执行
 */
@RestController
@RequestMapping("/github")
public class GitHubWebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final ChangeClassificationService classificationService;
    private final SyncTriggerService syncTriggerService;
    private final SyncProperties syncProperties;
    private final ObjectMapper objectMapper;

    public GitHubWebhookController(WebhookSignatureVerifier signatureVerifier,
                                   ChangeClassificationService classificationService,
                                   SyncTriggerService syncTriggerService,
                                   SyncProperties syncProperties,
                                   ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.classificationService = classificationService;
        this.syncTriggerService = syncTriggerService;
        this.syncProperties = syncProperties;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/webhook")
    @LogAction(value = "GitHub Webhook", action = "PUSH", logArgs = false)
    public ResponseEntity<Result<Map<String, Object>>> onEvent(
            @RequestHeader(value = "X-GitHub-Event", required = false) String event,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody byte[] body) {

        signatureVerifier.verify(body, signature);

        if (!"push".equals(event)) {
            return ResponseEntity.ok(Result.success("事件已忽略", status("ignored", "event: " + event)));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CustomException("webhook 载荷不是合法 JSON", ErrorKind.CLASSIFICATION, HttpStatus.BAD_REQUEST, e);
        }
        ChangeSet changeSet = classificationService.parsePush(payload);

        if (!syncProperties.getDefaultBranch().equals(changeSet.getBranch())) {
            return ResponseEntity.ok(Result.success("非默认分支，已忽略", status("ignored", "branch: " + changeSet.getBranch())));
        }
        if (changeSet.isEmpty()) {
            return ResponseEntity.ok(Result.success("没有需要同步的文件", status("no_relevant_files", null)));
        }

        SyncJob job = syncTriggerService.submitIncremental(changeSet);
        if (job == null) {
            return ResponseEntity.ok(Result.success("重复投递，已忽略", status("duplicate", changeSet.getRevision())));
        }
        Map<String, Object> data = status("accepted", null);
        data.put("jobId", job.getJobId());
        data.put("revision", changeSet.getRevision());
        data.put("files", changeSet.getChanges().size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.success("同步任务已创建", data));
    }

    private static Map<String, Object> status(String status, String detail) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        if (detail != null) {
            data.put("detail", detail);
        }
        return data;
    }
}
