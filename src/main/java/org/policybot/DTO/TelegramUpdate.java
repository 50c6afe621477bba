package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

// 解析后的 Telegram 消息
@Data
@AllArgsConstructor
public class TelegramUpdate {
    private String chatId;
    private String text;
    private boolean command;
    private String commandName;     // 小写，不含 @bot 后缀
    private List<String> commandArgs;
}
