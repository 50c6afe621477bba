package org.policybot.DTO;

import lombok.Data;

@Data
public class RagSearchRequest {
    private String query;
    private String lang;
    private Integer k;
    private Double minScore;
}
