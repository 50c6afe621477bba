package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// 单个文件的变更
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileChange {

    public enum Status {
        ADDED, MODIFIED, REMOVED
    }

    private String path;
    private Status status;
}
