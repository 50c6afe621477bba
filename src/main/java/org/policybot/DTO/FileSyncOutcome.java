package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.policybot.exception.ErrorKind;

/**
 * 单文件同步结果。单文件失败通过结果返回，不抛异常，任务继续处理后续文件。
 */
@Data
@AllArgsConstructor
public class FileSyncOutcome {

    public enum Status {
        PROCESSED, UNCHANGED, DELETED, SKIPPED, FAILED
    }

    private String path;
    private String documentId;
    private Status status;
    private ErrorKind errorKind;
    private String message;
    private ChunkDelta chunks;

    public static FileSyncOutcome processed(String path, String documentId, ChunkDelta chunks) {
        return new FileSyncOutcome(path, documentId, Status.PROCESSED, null, null, chunks);
    }

    public static FileSyncOutcome unchanged(String path, String documentId) {
        return new FileSyncOutcome(path, documentId, Status.UNCHANGED, null, null, ChunkDelta.NONE);
    }

    public static FileSyncOutcome deleted(String path, String documentId, ChunkDelta chunks) {
        return new FileSyncOutcome(path, documentId, Status.DELETED, null, null, chunks);
    }

    public static FileSyncOutcome skipped(String path, String documentId) {
        return new FileSyncOutcome(path, documentId, Status.SKIPPED, null, null, ChunkDelta.NONE);
    }

    public static FileSyncOutcome failed(String path, String documentId, ErrorKind kind, String message) {
        return new FileSyncOutcome(path, documentId, Status.FAILED, kind, message, ChunkDelta.NONE);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * 实际写入或删除过的文件才计入已处理
     */
    public boolean isProcessed() {
        return status == Status.PROCESSED || status == Status.UNCHANGED || status == Status.DELETED;
    }
}
