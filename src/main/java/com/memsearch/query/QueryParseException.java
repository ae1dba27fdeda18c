package com.memsearch.query;

public class QueryParseException extends RuntimeException {

    /** 查询词非法的具体原因 */
    public enum Reason {
        EMPTY_QUERY_WORD,
        DOUBLE_MINUS,
        INVALID_CHARACTER
    }

    private final Reason reason;
    private final int position;
    private final String queryString;
    private final String suggestion;

    public QueryParseException(Reason reason, String message, int position, String queryString) {
        super(buildMessage(message, position, queryString));
        this.reason = reason;
        this.position = position;
        this.queryString = queryString;
        this.suggestion = suggestFix(reason);
    }

    public Reason getReason() {
        return reason;
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        String printableQuery = query.replaceAll("\\p{Cntrl}", "?");
        int caretPos = Math.max(0, Math.min(pos, printableQuery.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + printableQuery + System.lineSeparator() + pointer;
    }

    private static String suggestFix(Reason reason) {
        return switch (reason) {
            case EMPTY_QUERY_WORD -> "减号后必须紧跟要排除的词";
            case DOUBLE_MINUS -> "排除词只能以一个减号开头";
            case INVALID_CHARACTER -> "请删除查询中的控制字符";
        };
    }
}
