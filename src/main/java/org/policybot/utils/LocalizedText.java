package org.policybot.utils;

import org.policybot.entity.Language;

/**
 * 面向聊天用户的固定文案
 */
public final class LocalizedText {

    private LocalizedText() {
    }

    public static String apology(Language lang) {
        return lang == Language.EN
                ? "Sorry, something went wrong while processing your question. Please try again in a moment."
                : "죄송합니다. 질문을 처리하는 중 오류가 발생했습니다. 잠시 후 다시 시도해 주세요.";
    }

    public static String help(Language lang) {
        return lang == Language.EN
                ? "Ask me anything about the company regulations.\n\n"
                + "/reset - start a new conversation\n"
                + "/lang ko|en - change the answer language\n"
                + "/help - show this message"
                : "회사 규정에 대해 무엇이든 물어보세요.\n\n"
                + "/reset - 새 대화 시작\n"
                + "/lang ko|en - 답변 언어 변경\n"
                + "/help - 도움말 보기";
    }

    public static String resetDone(Language lang) {
        return lang == Language.EN ? "The conversation has been reset." : "대화가 초기화되었습니다.";
    }

    public static String languageChanged(Language lang) {
        return lang == Language.EN ? "Answer language set to English." : "답변 언어가 한국어로 설정되었습니다.";
    }

    public static String languageUsage(Language lang) {
        return lang == Language.EN ? "Usage: /lang ko or /lang en" : "사용법: /lang ko 또는 /lang en";
    }

    public static String unknownCommand(Language lang) {
        return lang == Language.EN
                ? "Unknown command. Type /help to see what I can do."
                : "알 수 없는 명령어입니다. /help 를 입력해 사용법을 확인하세요.";
    }

    public static String sourcesHeader(Language lang) {
        return lang == Language.EN ? "Sources:" : "참고 규정:";
    }

    public static String languageName(Language lang) {
        return lang == Language.EN ? "English" : "Korean";
    }
}
