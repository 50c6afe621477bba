package org.policybot.client;

import java.util.List;

/**
 * 文档仓库读取能力
 */
public interface ContentFetcher {

    /**
     * 读取指定提交下的文件原文
     */
    String fetch(String path, String revision);

    /**
     * 列出指定提交下的全部文件路径（递归）
     */
    List<String> listFiles(String revision);

    /**
     * 分支名解析为提交 SHA
     */
    String resolveRevision(String branch);
}
