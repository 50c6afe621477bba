package org.policybot.client;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramClientTest {

    @Test
    void shortTextIsSentAsOneMessage() {
        assertThat(TelegramClient.split("hello")).containsExactly("hello");
    }

    @Test
    void longTextIsSplitAtLineBreaks() {
        String line = "x".repeat(99) + "\n";
        String text = line.repeat(60);

        List<String> parts = TelegramClient.split(text);

        assertThat(parts).hasSizeGreaterThan(1);
        assertThat(parts).allSatisfy(p -> assertThat(p.length()).isLessThanOrEqualTo(TelegramClient.MAX_MESSAGE_LENGTH));
        assertThat(String.join("\n", parts).replace("\n", "")).isEqualTo(text.replace("\n", ""));
    }

    @Test
    void textWithoutLineBreaksIsHardCut() {
        List<String> parts = TelegramClient.split("y".repeat(9000));

        assertThat(parts).extracting(String::length).containsExactly(4000, 4000, 1000);
    }
}
