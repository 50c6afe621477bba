package org.policybot.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// Telegram Bot API sendMessage
@Component
public class TelegramClient implements ChatTransport {

    private static final Logger logger = LoggerFactory.getLogger(TelegramClient.class);

    // Telegram 单条消息上限 4096 字符
    static final int MAX_MESSAGE_LENGTH = 4000;

    private final WebClient webClient;
    private final String token;

    public TelegramClient(WebClient telegramWebClient, @Value("${telegram.bot.token:}") String token) {
        this.webClient = telegramWebClient;
        this.token = token;
    }

    @Override
    public void send(String chatId, String text) {
        if (token == null || token.isBlank()) {
            logger.warn("未配置 telegram.bot.token，消息未发送 => chatId: {}", chatId);
            return;
        }
        for (String part : split(text)) {
            webClient.post()
                    .uri("/bot{token}/sendMessage", token)
                    .bodyValue(Map.of("chat_id", chatId, "text", part, "disable_web_page_preview", true))
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofSeconds(15));
        }
        logger.debug("消息已发送 => chatId: {}, 长度: {}", chatId, text.length());
    }

    static List<String> split(String text) {
        List<String> parts = new ArrayList<>();
        String rest = text;
        while (rest.length() > MAX_MESSAGE_LENGTH) {
            int cut = rest.lastIndexOf('\n', MAX_MESSAGE_LENGTH);
            if (cut <= 0) {
                cut = MAX_MESSAGE_LENGTH;
            }
            parts.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) {
            parts.add(rest);
        }
        return parts;
    }
}
