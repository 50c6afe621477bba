package org.policybot.utils;

import org.policybot.entity.Language;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 文本工具：语言检测、token 估算、截断和相似度
 */
public final class TextUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
    }

    /**
     * 按路径和韩文字符占比判断文档语言。
     * 路径含 /en/ 或 /english/ 直接判为英文；否则取前 prefixLength 个字符，
     * 韩文字符占非空白字符的比例超过 ratio 判为韩文。
     */
    public static Language detectLanguage(String text, String path, int prefixLength, double ratio) {
        if (path != null) {
            String lower = path.toLowerCase(Locale.ROOT);
            if (lower.contains("/en/") || lower.contains("/english/") || lower.startsWith("en/") || lower.startsWith("english/")) {
                return Language.EN;
            }
        }
        return detectLanguage(text, prefixLength, ratio);
    }

    public static Language detectLanguage(String text, int prefixLength, double ratio) {
        if (text == null || text.isEmpty()) {
            return Language.EN;
        }
        String sample = text.length() > prefixLength ? text.substring(0, prefixLength) : text;
        int hangul = 0;
        int counted = 0;
        for (int i = 0; i < sample.length(); i++) {
            char c = sample.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            counted++;
            if (isHangul(c)) {
                hangul++;
            }
        }
        if (counted == 0) {
            return Language.EN;
        }
        return (double) hangul / counted > ratio ? Language.KO : Language.EN;
    }

    private static boolean isHangul(char c) {
        return (c >= '가' && c <= '힣')
                || (c >= 'ᄀ' && c <= 'ᇿ')
                || (c >= '㄰' && c <= '㆏');
    }

    /**
     * 粗略估算 token 数：每 4 个字符约 1 个 token，向上取整
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }

    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    /**
     * 小写空白分词后的 Jaccard 相似度，两边都为空时记为 0
     */
    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        int inter = (int) left.stream().filter(right::contains).count();
        int union = left.size() + right.size() - inter;
        return union == 0 ? 0.0 : (double) inter / union;
    }

    private static Set<String> tokens(String text) {
        String normalized = normalizeWhitespace(text).toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return new HashSet<>();
        }
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
