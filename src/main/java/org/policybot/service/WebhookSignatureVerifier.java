package org.policybot.service;

import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.policybot.config.SyncProperties;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * X-Hub-Signature-256 校验：对原始请求体做 HMAC-SHA256，常量时间比较
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    private static final String PREFIX = "sha256=";

    private final SyncProperties syncProperties;

    public WebhookSignatureVerifier(SyncProperties syncProperties) {
        this.syncProperties = syncProperties;
        if (!isEnabled()) {
            logger.warn("未配置 sync.webhook-secret，GitHub webhook 不做签名校验");
        }
    }

    public boolean isEnabled() {
        String secret = syncProperties.getWebhookSecret();
        return secret != null && !secret.isBlank();
    }

    /**
     * @throws CustomException SIGNATURE / 401，签名缺失或不匹配
     */
    public void verify(byte[] body, String signatureHeader) {
        if (!isEnabled()) {
            return;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            throw new CustomException("缺少 webhook 签名", ErrorKind.SIGNATURE, HttpStatus.UNAUTHORIZED);
        }
        String expected = PREFIX + new HmacUtils(HmacAlgorithms.HMAC_SHA_256, syncProperties.getWebhookSecret()).hmacHex(body);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signatureHeader.trim().getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            throw new CustomException("webhook 签名不匹配", ErrorKind.SIGNATURE, HttpStatus.UNAUTHORIZED);
        }
    }
}
