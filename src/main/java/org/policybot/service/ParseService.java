package org.policybot.service;

import org.policybot.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

// 文档文本清洗、标题提取与分块
@Service
public class ParseService {

    private static final Logger logger = LoggerFactory.getLogger(ParseService.class);

    private static final Pattern EXTRA_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern INLINE_SPACES = Pattern.compile("[ \\t]+");

    private final SyncProperties syncProperties;

    public ParseService(SyncProperties syncProperties) {
        this.syncProperties = syncProperties;
    }

    public List<String> chunk(String text) {
        return chunk(text, syncProperties.getChunkSize(), syncProperties.getChunkOverlap());
    }

    /**
     * 按自然边界切分文本。
     * 从 start + maxSize 往回找切分点，优先段落（空行），其次句号，再次换行，找不到就硬切；
     * 切分点必须落在 start + overlap 之后，否则下一段会反复命中同一个靠前的边界。
     * 下一段从 max(start + 1, end - overlap) 开始，start 每轮严格递增，保证终止。
     *
     * @param text    原文
     * @param maxSize 每块最大字符数
     * @param overlap 相邻块重叠字符数，需小于 maxSize
     * @return 去首尾空白后的非空分块
     */
    public List<String> chunk(String text, int maxSize, int overlap) {
        List<String> chunks = new ArrayList<>();
        if (text == null) {
            return chunks;
        }
        if (maxSize <= 0 || overlap < 0 || overlap >= maxSize) {
            throw new IllegalArgumentException("分块参数不合法: maxSize=" + maxSize + ", overlap=" + overlap);
        }
        if (text.length() <= maxSize) {
            String trimmed = text.trim();
            if (!trimmed.isEmpty()) {
                chunks.add(trimmed);
            }
            return chunks;
        }

        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + maxSize, length);
            if (end < length) {
                end = findBoundary(text, start + overlap, end);
            }
            String piece = text.substring(start, end).trim();
            if (!piece.isEmpty()) {
                chunks.add(piece);
            }
            if (end >= length) {
                break;
            }
            start = Math.max(start + 1, end - overlap);
        }
        logger.debug("文本分块完成，长度: {}, 块数: {}", length, chunks.size());
        return chunks;
    }

    private int findBoundary(String text, int floor, int end) {
        int paragraph = text.lastIndexOf("\n\n", end - 2);
        if (paragraph > floor) {
            return paragraph;
        }
        int sentence = text.lastIndexOf(". ", end - 2);
        if (sentence > floor) {
            return sentence + 1;
        }
        int line = text.lastIndexOf('\n', end - 1);
        if (line > floor) {
            return line;
        }
        return end;
    }

    /**
     * 统一换行，压缩多余空行和行内空白
     */
    public String cleanText(String content) {
        if (content == null) {
            return "";
        }
        String text = content.replace("\r\n", "\n").replace('\r', '\n');
        text = EXTRA_NEWLINES.matcher(text).replaceAll("\n\n");
        text = INLINE_SPACES.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * 取第一个一级标题，没有则用去掉扩展名的文件名
     */
    public String extractTitle(String content, String fileName) {
        if (content != null) {
            for (String line : content.split("\n")) {
                String trimmed = line.trim();
                if (trimmed.startsWith("# ")) {
                    String title = trimmed.substring(2).trim();
                    if (!title.isEmpty()) {
                        return title;
                    }
                }
            }
        }
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
