package org.policybot.config;

import lombok.Data;
import org.policybot.entity.Language;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局 AI 相关配置，包含 Prompt 模板和生成参数。
 */
@Component
@ConfigurationProperties(prefix = "ai")
@Data
public class AiProperties {

    private Prompt prompt = new Prompt();
    private Generation generation = new Generation();
    private Generation summary = new Generation(0.2, 400, 0.9);

    /**
     * 无证据时的固定回复，按语言取，缺省回退到韩文
     */
    public String noEvidenceText(Language lang) {
        String text = prompt.getNoEvidence().get(lang.code());
        return text != null ? text : prompt.getNoEvidence().getOrDefault(Language.KO.code(), Prompt.DEFAULT_NO_EVIDENCE);
    }

    @Data
    public static class Prompt {
        static final String DEFAULT_NO_EVIDENCE = "규정에 해당 내용이 없습니다.";

        /** 规则文案 */
        private String rules;
        /** 证据块开始分隔符 */
        private String evidenceStart = "<<EVIDENCE>>";
        /** 证据块结束分隔符 */
        private String evidenceEnd = "<<END>>";
        /** 结尾重申的约束 */
        private String closing;
        /** 无证据固定回复，key 为语言代码 */
        private Map<String, String> noEvidence = new HashMap<>(Map.of(
                "ko", DEFAULT_NO_EVIDENCE,
                "en", "The regulations do not contain information on this topic."));
    }

    @Data
    public static class Generation {
        /** 采样温度 */
        private Double temperature = 0.1;
        /** 最大输出 tokens */
        private Integer maxTokens = 1200;
        /** nucleus top-p */
        private Double topP = 0.9;

        public Generation() {
        }

        public Generation(Double temperature, Integer maxTokens, Double topP) {
            this.temperature = temperature;
            this.maxTokens = maxTokens;
            this.topP = topP;
        }
    }
}
