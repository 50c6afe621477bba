package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

/**
 * 单次调用的上下文，显式向下传递
 */
@Data
@AllArgsConstructor
public class RequestContext {
    private String requestId;
    private String chatId;
    private String channel; // telegram / api

    public static RequestContext of(String chatId, String channel) {
        return new RequestContext(UUID.randomUUID().toString(), chatId, channel);
    }
}
