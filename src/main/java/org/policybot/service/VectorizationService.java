package org.policybot.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.policybot.DTO.ChunkDelta;
import org.policybot.DTO.ChunkPoint;
import org.policybot.client.Embedder;
import org.policybot.entity.DocumentChunk;
import org.policybot.entity.PolicyDocument;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.repository.DocumentChunkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 分块与向量点的生命周期。
 * 点 ID 为 {documentId}_{seq}：新分块按序号覆盖旧点，再删除序号 >= 新块数的旧点，
 * 文档重建后不会残留旧分块。
 */
@Service
public class VectorizationService {

    private static final Logger logger = LoggerFactory.getLogger(VectorizationService.class);

    private final Embedder embedder;
    private final VectorIndex vectorIndex;
    private final DocumentChunkRepository chunkRepository;

    public VectorizationService(Embedder embedder, VectorIndex vectorIndex, DocumentChunkRepository chunkRepository) {
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.chunkRepository = chunkRepository;
    }

    /**
     * 用新的分块集合替换文档现有分块
     *
     * @param document 已填好 revision / lang / title / contentHash 的文档
     * @param texts    新分块文本，按序号排列
     * @param url      源文件链接
     * @return 分块增删改数量
     */
    public ChunkDelta replaceDocument(PolicyDocument document, List<String> texts, String url) {
        String documentId = document.getId();
        int previous = (int) chunkRepository.countByDocumentId(documentId);

        List<float[]> vectors = texts.isEmpty() ? List.of() : embedder.embed(texts);
        if (vectors.size() != texts.size()) {
            throw new CustomException("向量数量与分块数量不一致: " + vectors.size() + " != " + texts.size(),
                    ErrorKind.EMBEDDING, HttpStatus.BAD_GATEWAY);
        }

        List<DocumentChunk> chunks = new ArrayList<>(texts.size());
        List<ChunkPoint> points = new ArrayList<>(texts.size());
        for (int seq = 0; seq < texts.size(); seq++) {
            DocumentChunk chunk = buildChunk(document, seq, texts.get(seq));
            chunks.add(chunk);
            points.add(buildPoint(document, chunk, vectors.get(seq), url));
        }

        // 先覆盖，再删多余的旧序号
        vectorIndex.upsert(points);
        long stalePoints = vectorIndex.delete(documentId, texts.size());
        chunkRepository.saveAll(chunks);
        int staleRows = chunkRepository.deleteFromSeq(documentId, texts.size());

        ChunkDelta delta = ChunkDelta.of(previous, texts.size());
        logger.info("文档分块已重建 => documentId: {}, 旧块数: {}, 新块数: {}, 清理旧点: {}, 清理旧行: {}",
                documentId, previous, texts.size(), stalePoints, staleRows);
        return delta;
    }

    /**
     * 删除文档的全部分块和向量点
     */
    public ChunkDelta removeDocument(String documentId) {
        int previous = (int) chunkRepository.countByDocumentId(documentId);
        long points = vectorIndex.delete(documentId, 0);
        chunkRepository.deleteFromSeq(documentId, 0);
        logger.info("文档分块已删除 => documentId: {}, 分块: {}, 向量点: {}", documentId, previous, points);
        return new ChunkDelta(0, 0, previous);
    }

    private DocumentChunk buildChunk(PolicyDocument document, int seq, String text) {
        DocumentChunk chunk = new DocumentChunk();
        chunk.setId(DocumentChunk.idOf(document.getId(), seq));
        chunk.setDocumentId(document.getId());
        chunk.setSeq(seq);
        chunk.setTextContent(text);
        chunk.setTextHash(DigestUtils.sha256Hex(text));
        chunk.setLang(document.getLang());
        chunk.setTitle(document.getTitle());
        chunk.setRevision(document.getRevision());
        chunk.setFilePath(document.getFilePath());
        return chunk;
    }

    private ChunkPoint buildPoint(PolicyDocument document, DocumentChunk chunk, float[] vector, String url) {
        ChunkPoint point = new ChunkPoint();
        point.setId(chunk.getId());
        point.setDocumentId(document.getId());
        point.setRepoId(document.getRepoId());
        point.setFilePath(document.getFilePath());
        point.setRevision(document.getRevision());
        point.setLang(document.getLang() == null ? null : document.getLang().code());
        point.setHash(document.getContentHash());
        point.setSeq(chunk.getSeq());
        point.setTitle(document.getTitle());
        point.setTextContent(chunk.getTextContent());
        point.setUrl(url);
        point.setVector(vector);
        return point;
    }
}
