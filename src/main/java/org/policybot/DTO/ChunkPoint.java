package org.policybot.DTO;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 向量索引中的一个点：分块向量加上用于过滤和溯源的冗余字段
 */
@Data
@NoArgsConstructor
public class ChunkPoint {

    private String id;             // {documentId}_{seq}
    private String documentId;
    private String repoId;
    private String filePath;
    private String revision;
    private String lang;
    private String hash;           // 文档内容 sha256
    private Integer seq;
    private String title;
    private String textContent;
    private String url;            // 源文件链接
    private float[] vector;
}
