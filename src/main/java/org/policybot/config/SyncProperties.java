package org.policybot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 文档同步配置
 */
@Component
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncProperties {
    /** owner/repo */
    private String repoId;
    private String defaultBranch = "main";
    /** 为空时跳过签名校验 */
    private String webhookSecret;
    private List<String> trackedExtensions = new ArrayList<>(List.of(".md", ".markdown"));
    /** 路径中包含即排除（不区分大小写） */
    private List<String> deniedFragments = new ArrayList<>(List.of("readme"));
    /** 目录前缀排除，另外任何以 . 开头的目录都排除 */
    private List<String> excludedPrefixes = new ArrayList<>(List.of(
            "node_modules/", ".git/", ".github/", "dist/", "build/", "docs/", ".docs/"));
    private int concurrency = 5;
    private int progressInterval = 5;
    private int chunkSize = 800;
    private int chunkOverlap = 80;
    private int langDetectPrefix = 1000;
    private double langDetectRatio = 0.1;
    private long dedupeTtlHours = 24;

    /** 文档 ID 前缀：owner/repo -> owner_repo */
    public String repoKey() {
        return repoId == null ? "" : repoId.replace('/', '_');
    }
}
