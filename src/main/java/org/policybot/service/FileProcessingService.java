package org.policybot.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.policybot.DTO.ChunkDelta;
import org.policybot.DTO.FileSyncOutcome;
import org.policybot.client.ContentFetcher;
import org.policybot.config.SyncProperties;
import org.policybot.entity.Language;
import org.policybot.entity.PolicyDocument;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.repository.PolicyDocumentRepository;
import org.policybot.utils.TextUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 单文件同步：拉取、清洗、分块、向量化、落库。
 * 单文件的失败以 FileSyncOutcome 返回，不向上抛出。
 */
@Service
@Slf4j
public class FileProcessingService {

    private final ContentFetcher contentFetcher;
    private final ParseService parseService;
    private final VectorizationService vectorizationService;
    private final PolicyDocumentRepository documentRepository;
    private final SyncProperties syncProperties;

    public FileProcessingService(ContentFetcher contentFetcher, ParseService parseService,
                                 VectorizationService vectorizationService,
                                 PolicyDocumentRepository documentRepository, SyncProperties syncProperties) {
        this.contentFetcher = contentFetcher;
        this.parseService = parseService;
        this.vectorizationService = vectorizationService;
        this.documentRepository = documentRepository;
        this.syncProperties = syncProperties;
    }

    public String documentId(String path) {
        return syncProperties.repoKey() + "_" + DigestUtils.md5Hex(path);
    }

    public String sourceUrl(String revision, String path) {
        return "https://github.com/" + syncProperties.getRepoId() + "/blob/" + revision + "/" + path;
    }

    /**
     * 新增或修改的文件
     *
     * @param skipSameRevision 全量同步时，已在同一提交处理过的文档直接跳过
     * @param force            忽略内容哈希和提交，强制重建
     */
    public FileSyncOutcome upsert(String path, String revision, boolean skipSameRevision, boolean force) {
        String documentId = documentId(path);
        try {
            PolicyDocument existing = documentRepository.findById(documentId).orElse(null);
            if (!force && skipSameRevision && existing != null && existing.isActive()
                    && revision.equals(existing.getRevision())) {
                log.debug("同一提交已处理，跳过 => path: {}, revision: {}", path, revision);
                return FileSyncOutcome.skipped(path, documentId);
            }

            String raw = contentFetcher.fetch(path, revision);
            String content = parseService.cleanText(raw);
            String contentHash = DigestUtils.sha256Hex(content);

            // 内容没变只更新提交号，不重新向量化
            if (!force && existing != null && existing.isActive() && contentHash.equals(existing.getContentHash())) {
                existing.setRevision(revision);
                documentRepository.save(existing);
                log.debug("内容未变化，仅更新提交 => path: {}", path);
                return FileSyncOutcome.unchanged(path, documentId);
            }

            PolicyDocument document = existing != null ? existing : new PolicyDocument();
            document.setId(documentId);
            document.setRepoId(syncProperties.getRepoId());
            document.setFilePath(path);
            document.setFileName(fileName(path));
            document.setRevision(revision);
            document.setContentHash(contentHash);
            document.setSize((long) raw.getBytes(StandardCharsets.UTF_8).length);
            Language lang = TextUtils.detectLanguage(content, path,
                    syncProperties.getLangDetectPrefix(), syncProperties.getLangDetectRatio());
            document.setLang(lang);
            document.setTitle(parseService.extractTitle(content, document.getFileName()));

            List<String> chunks = parseService.chunk(content);
            ChunkDelta delta = vectorizationService.replaceDocument(document, chunks, sourceUrl(revision, path));

            document.setChunkCount(chunks.size());
            document.setActive(true);
            documentRepository.save(document);

            log.info("文件同步完成 => path: {}, lang: {}, 块数: {}", path, lang.code(), chunks.size());
            return FileSyncOutcome.processed(path, documentId, delta);
        } catch (CustomException e) {
            log.error("文件同步失败 => path: {}, kind: {}, error: {}", path, e.getKind(), e.getMessage());
            return FileSyncOutcome.failed(path, documentId, e.getKind(), e.getMessage());
        } catch (Exception e) {
            log.error("文件同步失败 => path: {}", path, e);
            return FileSyncOutcome.failed(path, documentId, ErrorKind.INDEX, e.getMessage());
        }
    }

    /**
     * 删除的文件：清理分块、向量点和文档记录
     */
    public FileSyncOutcome remove(String path) {
        String documentId = documentId(path);
        try {
            ChunkDelta delta = vectorizationService.removeDocument(documentId);
            documentRepository.deleteById(documentId);
            log.info("文件已删除 => path: {}, 分块: {}", path, delta.getDeleted());
            return FileSyncOutcome.deleted(path, documentId, delta);
        } catch (CustomException e) {
            log.error("文件删除失败 => path: {}, kind: {}, error: {}", path, e.getKind(), e.getMessage());
            return FileSyncOutcome.failed(path, documentId, e.getKind(), e.getMessage());
        } catch (Exception e) {
            log.error("文件删除失败 => path: {}", path, e);
            return FileSyncOutcome.failed(path, documentId, ErrorKind.INDEX, e.getMessage());
        }
    }

    /**
     * 全量同步中已不存在的文档：清理分块并标记为无效，记录保留
     */
    public FileSyncOutcome deactivate(PolicyDocument document) {
        try {
            ChunkDelta delta = vectorizationService.removeDocument(document.getId());
            document.setActive(false);
            document.setChunkCount(0);
            documentRepository.save(document);
            log.info("文档已失效 => path: {}", document.getFilePath());
            return FileSyncOutcome.deleted(document.getFilePath(), document.getId(), delta);
        } catch (Exception e) {
            log.error("文档失效处理失败 => path: {}", document.getFilePath(), e);
            ErrorKind kind = e instanceof CustomException ? ((CustomException) e).getKind() : ErrorKind.INDEX;
            return FileSyncOutcome.failed(document.getFilePath(), document.getId(), kind, e.getMessage());
        }
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
