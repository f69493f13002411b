package com.queryguard.rule.checker;

import com.queryguard.model.QueryLanguage;
import com.queryguard.model.RejectionReason;
import com.queryguard.parser.LiteralMasker;

/**
 * 结构检查，JQL 与 GraphQL 共用：引号配对、括号配对、最大嵌套深度。
 * <p>
 * 不建语法树。引号先按原始文本中双引号的个数判断奇偶，再逐个确认字面量都已闭合；
 * 括号配对与深度在屏蔽字面量后的文本上计算，字符串里的括号不参与计数。
 */
public class StructuralChecker implements QueryChecker {

    private final QueryLanguage language;
    private final boolean checkQuotes;
    private final char open;
    private final char close;
    private final int maxDepth;

    public StructuralChecker(QueryLanguage language, boolean checkQuotes, char open, char close, int maxDepth) {
        this.language = language;
        this.checkQuotes = checkQuotes;
        this.open = open;
        this.close = close;
        this.maxDepth = maxDepth;
    }

    /** JQL：引号 + 圆括号 */
    public static StructuralChecker forJql(int maxDepth) {
        return new StructuralChecker(QueryLanguage.JQL, true, '(', ')', maxDepth);
    }

    /** GraphQL：只检查花括号 */
    public static StructuralChecker forGraphQl(int maxDepth) {
        return new StructuralChecker(QueryLanguage.GRAPHQL, false, '{', '}', maxDepth);
    }

    @Override
    public String name() {
        return "STRUCTURE";
    }

    @Override
    public CheckResult check(String query) {
        if (checkQuotes) {
            long doubleQuotes = query.chars().filter(c -> c == '"').count();
            if (doubleQuotes % 2 != 0) {
                return CheckResult.fail(RejectionReason.UNBALANCED_QUOTES,
                        language.displayName() + " 查询引号不匹配（双引号共 " + doubleQuotes + " 个）", "\"");
            }
            int unterminated = findUnterminatedQuote(query);
            if (unterminated >= 0) {
                return CheckResult.fail(RejectionReason.UNBALANCED_QUOTES,
                        language.displayName() + " 查询引号不匹配（位置 " + unterminated + " 的引号未闭合）",
                        String.valueOf(query.charAt(unterminated)));
            }
        }

        String masked = LiteralMasker.mask(language, query);
        int opens = 0;
        int closes = 0;
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                opens++;
                depth++;
            } else if (c == close) {
                closes++;
                depth--;
                if (depth < 0) {
                    return CheckResult.fail(RejectionReason.UNBALANCED_DELIMITERS,
                            language.displayName() + " 查询括号不匹配：'" + close + "' 出现在对应的 '" + open + "' 之前",
                            String.valueOf(close));
                }
            }
        }
        if (opens != closes) {
            return CheckResult.fail(RejectionReason.UNBALANCED_DELIMITERS,
                    language.displayName() + " 查询括号不匹配：'" + open + "' " + opens + " 个，'" + close + "' "
                            + closes + " 个",
                    null);
        }

        int depthFound = maxDepth(masked, open, close);
        if (depthFound > maxDepth) {
            return CheckResult.fail(RejectionReason.NESTING_TOO_DEEP,
                    language.displayName() + " 查询嵌套过深：" + depthFound + " 层，上限 " + maxDepth + " 层",
                    depthFound + "-level nesting");
        }
        return CheckResult.pass();
    }

    /**
     * 从左到右扫描，记录未闭合开括号数量的最大值
     */
    public static int maxDepth(String text, char open, char close) {
        int depth = 0;
        int max = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                depth++;
                max = Math.max(max, depth);
            } else if (c == close) {
                depth--;
            }
        }
        return max;
    }

    /**
     * 返回第一个未闭合引号的位置，全部配对时返回 -1。反斜杠转义的引号不参与配对。
     */
    static int findUnterminatedQuote(String text) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int start = i;
                i++;
                boolean closed = false;
                while (i < text.length()) {
                    char inner = text.charAt(i);
                    if (inner == '\\') {
                        i += 2;
                        continue;
                    }
                    i++;
                    if (inner == c) {
                        closed = true;
                        break;
                    }
                }
                if (!closed) {
                    return start;
                }
            } else {
                i++;
            }
        }
        return -1;
    }
}
