package org.policybot.DTO;

import lombok.Data;

@Data
public class RagQueryRequest {
    private String chatId;
    private String question;
    private String lang;
}
