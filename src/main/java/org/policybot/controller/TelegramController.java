package org.policybot.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.policybot.annotation.LogAction;
import org.policybot.handler.TelegramUpdateHandler;
import org.policybot.handler.TelegramUpdateParser;
import org.policybot.utils.Result;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/telegram")
public class TelegramController {

    private final TelegramUpdateParser parser;
    private final TelegramUpdateHandler updateHandler;

    public TelegramController(TelegramUpdateParser parser, TelegramUpdateHandler updateHandler) {
        this.parser = parser;
        this.updateHandler = updateHandler;
    }

    /**
     * 总是返回 200，否则 Telegram 会反复重投
     */
    @PostMapping("/webhook")
    @LogAction(value = "Telegram", action = "UPDATE", logArgs = false)
    public ResponseEntity<Result<String>> onUpdate(@RequestBody JsonNode update) {
        parser.parse(update).ifPresent(updateHandler::handle);
        return ResponseEntity.ok(Result.success("ok"));
    }
}
