package org.policybot.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.codec.digest.DigestUtils;
import org.policybot.DTO.ChangeSet;
import org.policybot.DTO.FileChange;
import org.policybot.config.SyncProperties;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 变更分类：解析 push 通知，过滤出需要同步的文档路径
 */
@Service
public class ChangeClassificationService {

    private static final Logger logger = LoggerFactory.getLogger(ChangeClassificationService.class);

    private static final String BRANCH_REF_PREFIX = "refs/heads/";

    private final SyncProperties syncProperties;

    public ChangeClassificationService(SyncProperties syncProperties) {
        this.syncProperties = syncProperties;
    }

    /**
     * 解析 GitHub push 载荷。所有提交的 added / modified / removed 按顺序合并，同一路径以最后一次为准；
     * 没有 commits 时退回 head_commit。
     *
     * @throws CustomException CLASSIFICATION，载荷缺少 ref / after / commits
     */
    public ChangeSet parsePush(JsonNode payload) {
        if (payload == null || !payload.hasNonNull("ref") || !payload.hasNonNull("after") || !payload.has("commits")) {
            throw new CustomException("push 载荷缺少 ref / after / commits", ErrorKind.CLASSIFICATION, HttpStatus.BAD_REQUEST);
        }
        JsonNode commits = payload.get("commits");
        if (!commits.isArray()) {
            throw new CustomException("push 载荷 commits 不是数组", ErrorKind.CLASSIFICATION, HttpStatus.BAD_REQUEST);
        }

        String ref = payload.get("ref").asText();
        String branch = ref.startsWith(BRANCH_REF_PREFIX) ? ref.substring(BRANCH_REF_PREFIX.length()) : ref;
        String revision = payload.get("after").asText();

        List<FileChange> raw = new ArrayList<>();
        if (commits.size() > 0) {
            for (JsonNode commit : commits) {
                collect(commit, raw);
            }
        } else if (payload.hasNonNull("head_commit")) {
            collect(payload.get("head_commit"), raw);
        }

        // 分支被删除时 after 为全 0，没有可同步的内容
        if (payload.path("deleted").asBoolean(false)) {
            raw.clear();
        }

        List<FileChange> changes = classify(raw);
        logger.debug("push 解析完成 => branch: {}, revision: {}, 原始变更: {}, 保留: {}", branch, revision, raw.size(), changes.size());
        return new ChangeSet(revision, branch, changes);
    }

    private void collect(JsonNode commit, List<FileChange> into) {
        addAll(commit.path("added"), FileChange.Status.ADDED, into);
        addAll(commit.path("modified"), FileChange.Status.MODIFIED, into);
        addAll(commit.path("removed"), FileChange.Status.REMOVED, into);
    }

    private void addAll(JsonNode paths, FileChange.Status status, List<FileChange> into) {
        if (paths == null || !paths.isArray()) {
            return;
        }
        for (JsonNode path : paths) {
            into.add(new FileChange(path.asText(), status));
        }
    }

    /**
     * 过滤并按路径去重，最后出现的状态生效
     */
    public List<FileChange> classify(List<FileChange> changes) {
        Map<String, FileChange> byPath = new LinkedHashMap<>();
        for (FileChange change : changes) {
            if (change.getPath() == null || !isTracked(change.getPath())) {
                continue;
            }
            byPath.remove(change.getPath());
            byPath.put(change.getPath(), change);
        }
        return new ArrayList<>(byPath.values());
    }

    /**
     * 全量同步的文件列表过滤
     */
    public List<String> classifyListing(List<String> paths) {
        return paths.stream()
                .filter(this::isTracked)
                .distinct()
                .collect(Collectors.toList());
    }

    public boolean isTracked(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        boolean trackedExtension = syncProperties.getTrackedExtensions().stream()
                .anyMatch(ext -> lower.endsWith(ext.toLowerCase(Locale.ROOT)));
        if (!trackedExtension) {
            return false;
        }
        for (String fragment : syncProperties.getDeniedFragments()) {
            if (lower.contains(fragment.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        // 隐藏目录
        if (lower.startsWith(".") || lower.contains("/.")) {
            return false;
        }
        for (String prefix : syncProperties.getExcludedPrefixes()) {
            String p = prefix.toLowerCase(Locale.ROOT);
            if (lower.startsWith(p) || lower.contains("/" + p)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 变更集指纹：revision + 排序后的 状态:路径，用于 webhook 重投递去重
     */
    public String fingerprint(ChangeSet changeSet) {
        String body = changeSet.getChanges().stream()
                .map(c -> c.getStatus() + ":" + c.getPath())
                .sorted()
                .collect(Collectors.joining("\n"));
        return DigestUtils.sha256Hex(changeSet.getRevision() + "\n" + body);
    }
}
