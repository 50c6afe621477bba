package org.policybot.entity;

import java.util.Locale;
import java.util.Optional;

public enum Language {
    KO("ko"),
    EN("en");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * 解析语言参数，接受代码、英文名和本地名（ko / korean / 한국어，en / english / 영어）
     */
    public static Optional<Language> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ko":
            case "korean":
            case "한국어":
                return Optional.of(KO);
            case "en":
            case "english":
            case "영어":
                return Optional.of(EN);
            default:
                return Optional.empty();
        }
    }
}
