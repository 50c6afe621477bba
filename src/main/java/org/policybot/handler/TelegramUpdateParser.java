package org.policybot.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.policybot.DTO.TelegramUpdate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

// Telegram update -> {chatId, text, isCommand, commandName, commandArgs}
@Component
public class TelegramUpdateParser {

    /**
     * 非文本消息返回空
     */
    public Optional<TelegramUpdate> parse(JsonNode update) {
        if (update == null) {
            return Optional.empty();
        }
        JsonNode message = update.hasNonNull("message") ? update.get("message") : update.path("edited_message");
        JsonNode textNode = message.path("text");
        JsonNode chatIdNode = message.path("chat").path("id");
        if (!textNode.isTextual() || chatIdNode.isMissingNode() || chatIdNode.isNull()) {
            return Optional.empty();
        }

        String chatId = chatIdNode.asText();
        String text = textNode.asText().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (!text.startsWith("/")) {
            return Optional.of(new TelegramUpdate(chatId, text, false, null, List.of()));
        }

        String[] tokens = text.split("\\s+");
        String name = tokens[0].substring(1).toLowerCase(Locale.ROOT);
        // 群聊里的 /help@SomeBot
        int at = name.indexOf('@');
        if (at >= 0) {
            name = name.substring(0, at);
        }
        List<String> args = Arrays.asList(tokens).subList(1, tokens.length);
        return Optional.of(new TelegramUpdate(chatId, text, true, name, List.copyOf(args)));
    }
}
