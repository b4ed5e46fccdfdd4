package org.buaa.datastd.common.toolkit;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 词条文本处理工具
 */
public final class TermTextUtils {

    /**
     * LIKE 转义符，与 SQL 中的 ESCAPE '!' 对应
     */
    public static final char LIKE_ESCAPE = '!';

    private TermTextUtils() {
    }

    /**
     * 规范化同义词字符串
     * 中英文逗号替换为空格，折叠连续空白，首尾去空
     *
     * @param terms 原始同义词
     * @return 规范化后的同义词，输入为 null 时返回 null
     */
    public static String normalizeTerms(String terms) {
        if (terms == null) {
            return null;
        }
        String replaced = terms.replace(',', ' ').replace('，', ' ');
        return Arrays.stream(replaced.trim().split("\\s+"))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.joining(" "));
    }

    /**
     * 拼接向量化文本，跳过空值，单空格分隔
     */
    public static String joinForEmbedding(String... parts) {
        return Arrays.stream(parts)
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(part -> !part.isEmpty())
            .collect(Collectors.joining(" "));
    }

    /**
     * 转义 LIKE 通配符，使用户输入按字面匹配
     *
     * @param value 原始输入
     * @return 转义后的文本，输入为 null 时返回 null
     */
    public static String escapeLike(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder escaped = new StringBuilder(value.length() + 4);
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
