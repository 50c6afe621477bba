package org.policybot.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.policybot.config.SyncProperties;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

// GitHub REST API 客户端：读取文件内容、文件树和分支头
@Component
public class GitHubClient implements ContentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(GitHubClient.class);

    private static final String RAW_MEDIA_TYPE = "application/vnd.github.raw+json";
    private static final String JSON_MEDIA_TYPE = "application/vnd.github+json";

    private final WebClient webClient;
    private final SyncProperties syncProperties;

    public GitHubClient(WebClient githubWebClient, SyncProperties syncProperties) {
        this.webClient = githubWebClient;
        this.syncProperties = syncProperties;
    }

    @Override
    public String fetch(String path, String revision) {
        try {
            String content = webClient.get()
                    .uri(b -> b.pathSegment("repos", owner(), repo(), "contents")
                            .pathSegment(path.split("/"))
                            .queryParam("ref", revision)
                            .build())
                    .header("Accept", RAW_MEDIA_TYPE)
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(transientRetry())
                    .block(Duration.ofSeconds(30));
            return content == null ? "" : content;
        } catch (Exception e) {
            throw new CustomException("读取文件失败: " + path + "@" + revision + " - " + e.getMessage(),
                    ErrorKind.FETCH, HttpStatus.BAD_GATEWAY, e);
        }
    }

    @Override
    public List<String> listFiles(String revision) {
        try {
            JsonNode tree = webClient.get()
                    .uri("/repos/{owner}/{repo}/git/trees/{sha}?recursive=1", owner(), repo(), revision)
                    .header("Accept", JSON_MEDIA_TYPE)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(transientRetry())
                    .block(Duration.ofSeconds(60));
            if (tree == null || !tree.has("tree")) {
                throw new IllegalStateException("文件树响应为空");
            }
            if (tree.path("truncated").asBoolean(false)) {
                logger.warn("仓库 {} 的文件树被截断，部分文件不会同步", syncProperties.getRepoId());
            }
            List<String> paths = new ArrayList<>();
            for (JsonNode item : tree.get("tree")) {
                if ("blob".equals(item.path("type").asText())) {
                    paths.add(item.path("path").asText());
                }
            }
            return paths;
        } catch (Exception e) {
            throw new CustomException("读取文件树失败: " + e.getMessage(), ErrorKind.FETCH, HttpStatus.BAD_GATEWAY, e);
        }
    }

    @Override
    public String resolveRevision(String branch) {
        try {
            JsonNode commit = webClient.get()
                    .uri("/repos/{owner}/{repo}/commits/{ref}", owner(), repo(), branch)
                    .header("Accept", JSON_MEDIA_TYPE)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(transientRetry())
                    .block(Duration.ofSeconds(30));
            String sha = commit == null ? null : commit.path("sha").asText(null);
            if (sha == null || sha.isEmpty()) {
                throw new IllegalStateException("分支 " + branch + " 没有返回提交");
            }
            return sha;
        } catch (Exception e) {
            throw new CustomException("解析分支失败: " + branch + " - " + e.getMessage(), ErrorKind.FETCH, HttpStatus.BAD_GATEWAY, e);
        }
    }

    private Retry transientRetry() {
        return Retry.backoff(2, Duration.ofSeconds(1))
                .filter(e -> e instanceof WebClientResponseException
                        && ((WebClientResponseException) e).getStatusCode().is5xxServerError());
    }

    private String owner() {
        return syncProperties.getRepoId().split("/", 2)[0];
    }

    private String repo() {
        return syncProperties.getRepoId().split("/", 2)[1];
    }
}
