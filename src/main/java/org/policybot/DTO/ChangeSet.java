package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次 push 通知解析并过滤后的结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSet {
    private String revision;
    private String branch;
    private List<FileChange> changes = new ArrayList<>();

    public boolean isEmpty() {
        return changes == null || changes.isEmpty();
    }

    public long count(FileChange.Status status) {
        return changes.stream().filter(c -> c.getStatus() == status).count();
    }
}
