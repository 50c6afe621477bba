package org.policybot.DTO;

import lombok.Data;

@Data
public class ManualSyncRequest {
    private String branch;
    private boolean force;
}
