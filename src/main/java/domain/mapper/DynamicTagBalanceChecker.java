package domain.mapper;

import domain.format.DynamicTags;
import domain.model.FormatContext;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.WarningCode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 포맷 전/후 MyBatis 동적 태그(<if>, <foreach> 등)가 유실/훼손되지 않았는지
 * 문자열 기반으로 검증한다.
 *
 * <p>The formatter reproduces tags from its tree, so a difference here means a bug or an input
 * the parser read differently than MyBatis would. The caller then keeps the original text.</p>
 */
public final class DynamicTagBalanceChecker {

    private static final Pattern TAG_PATTERN = Pattern.compile(
            "<\\s*(/)?\\s*(" + String.join("|", DynamicTags.NAMES) + ")\\b((?:\"[^\"]*\"|'[^']*'|[^'\">/])*)(/)?\\s*>",
            Pattern.CASE_INSENSITIVE
    );

    // 태그 경계에서 콤마가 밖으로 빠지는 흔한 훼손 패턴
    private static final Pattern SUSPICIOUS_BOUNDARY = Pattern.compile(
            "</\\s*(if|foreach|when|otherwise|trim|where|set)\\s*>\\s*,",
            Pattern.CASE_INSENSITIVE
    );

    /** open (non self-closing + self-closing) tag counts by lower-case name */
    static Map<String, Integer> countOpenTags(String sql) {
        Map<String, Integer> m = new TreeMap<>();
        Matcher matcher = TAG_PATTERN.matcher(sql);
        while (matcher.find()) {
            if (matcher.group(1) != null) continue;
            String tag = matcher.group(2).toLowerCase(Locale.ROOT);
            m.merge(tag, 1, Integer::sum);
        }
        return m;
    }

    /**
     * 단순 스택으로 열림/닫힘 균형 체크.
     *
     * @return imbalance message or null
     */
    static String checkBalance(String sql) {
        Deque<String> stack = new ArrayDeque<>();
        Matcher matcher = TAG_PATTERN.matcher(sql);
        while (matcher.find()) {
            boolean closing = matcher.group(1) != null;
            boolean selfClosing = matcher.group(4) != null;
            String tag = matcher.group(2).toLowerCase(Locale.ROOT);

            if (selfClosing && !closing) continue;
            if (!closing) {
                stack.push(tag);
                continue;
            }
            if (stack.isEmpty()) {
                return "closing tag without opening: </" + tag + ">";
            }
            String top = stack.pop();
            if (!top.equals(tag)) {
                return "tag mismatch: expected </" + top + "> but got </" + tag + ">";
            }
        }
        if (!stack.isEmpty()) {
            return "unclosed tags: " + stack;
        }
        return null;
    }

    private static String snippetAround(String s, int pos, int maxLen) {
        int start = Math.max(0, pos - maxLen / 2);
        int end = Math.min(s.length(), start + maxLen);
        return (start > 0 ? "..." : "") + s.substring(start, end) + (end < s.length() ? "..." : "");
    }

    /**
     * @return false if the formatted text must not replace the original (tag lost or unbalanced)
     */
    public boolean verify(String original,
                          String formatted,
                          FormatContext ctx,
                          FormatWarningSink warningSink) {
        if (original == null || formatted == null) return true;
        FormatWarningSink sink = warningSink == null ? FormatWarningSink.none() : warningSink;
        boolean ok = true;

        // 1) 유실 탐지
        Map<String, Integer> origOpen = countOpenTags(original);
        Map<String, Integer> outOpen = countOpenTags(formatted);
        if (!origOpen.equals(outOpen)) {
            List<String> lost = new ArrayList<>();
            for (Map.Entry<String, Integer> e : origOpen.entrySet()) {
                int t = outOpen.getOrDefault(e.getKey(), 0);
                if (t != e.getValue()) {
                    lost.add(e.getKey() + "(orig=" + e.getValue() + ", out=" + t + ")");
                }
            }
            sink.warn(FormatWarning.of(
                    WarningCode.MYBATIS_TAG_LOST,
                    ctx,
                    "MyBatis dynamic tag lost: " + String.join(", ", lost),
                    "origOpen=" + origOpen + ", outOpen=" + outOpen
            ));
            ok = false;
        }

        // 2) 균형 검증 (원문이 이미 깨져 있으면 포맷 탓이 아님)
        String imbalance = checkBalance(formatted);
        if (imbalance != null && checkBalance(original) == null) {
            sink.warn(FormatWarning.of(
                    WarningCode.MYBATIS_TAG_UNBALANCED,
                    ctx,
                    "MyBatis dynamic tag unbalanced: " + imbalance,
                    "outOpen=" + outOpen
            ));
            ok = false;
        }

        // 3) 경계 훼손 의심 (warning only)
        Matcher m = SUSPICIOUS_BOUNDARY.matcher(formatted);
        if (m.find() && !SUSPICIOUS_BOUNDARY.matcher(original).find()) {
            sink.warn(FormatWarning.of(
                    WarningCode.MYBATIS_TAG_BOUNDARY_SUSPICIOUS,
                    ctx,
                    "Suspicious MyBatis tag boundary (comma after closing tag)",
                    snippetAround(formatted, m.start(), 120)
            ));
        }
        return ok;
    }
}
