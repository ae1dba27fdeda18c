package com.memsearch.query;

import com.memsearch.text.StopWords;
import com.memsearch.text.Tokenizer;
import com.memsearch.text.Words;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

public class QueryParser {
    private static final char MINUS = '-';

    private final Tokenizer tokenizer;
    private final StopWords stopWords;

    public QueryParser(Tokenizer tokenizer, StopWords stopWords) {
        this.tokenizer = tokenizer;
        this.stopWords = stopWords;
    }

    /**
     * 解析查询并对两组词排序去重。
     */
    public ParsedQuery parse(String query) {
        return parse(query, true);
    }

    /**
     * 将查询字符串解析为加词与减词。
     *
     * dedupe 为 false 时保留原始顺序与重复，供下游自行去重的并行匹配使用。
     */
    public ParsedQuery parse(String query, boolean dedupe) {
        String queryString = query == null ? "" : query;
        List<String> plusWords = new ArrayList<>();
        List<String> minusWords = new ArrayList<>();

        int cursor = 0;
        for (String token : tokenizer.split(queryString)) {
            int position = queryString.indexOf(token, cursor);
            cursor = position + token.length();

            QueryWord queryWord = parseQueryWord(token, position, queryString);
            if (stopWords.isStopWord(queryWord.data())) {
                continue;
            }
            if (queryWord.minus()) {
                minusWords.add(queryWord.data());
            } else {
                plusWords.add(queryWord.data());
            }
        }

        if (!dedupe) {
            return new ParsedQuery(plusWords, minusWords);
        }
        TreeSet<String> uniqueMinus = new TreeSet<>(minusWords);
        TreeSet<String> uniquePlus = new TreeSet<>(plusWords);
        uniquePlus.removeAll(uniqueMinus);
        return new ParsedQuery(new ArrayList<>(uniquePlus), new ArrayList<>(uniqueMinus));
    }

    /**
     * 校验单个查询词并剥离前导减号。
     */
    private QueryWord parseQueryWord(String token, int position, String queryString) {
        boolean minus = token.charAt(0) == MINUS;
        String data = minus ? token.substring(1) : token;

        if (data.isEmpty()) {
            throw new QueryParseException(QueryParseException.Reason.EMPTY_QUERY_WORD,
                    "查询词为空", position, queryString);
        }
        if (data.charAt(0) == MINUS) {
            throw new QueryParseException(QueryParseException.Reason.DOUBLE_MINUS,
                    "查询词 " + token + " 以双减号开头", position, queryString);
        }
        int controlIndex = Words.indexOfControlCharacter(data);
        if (controlIndex >= 0) {
            int offset = position + (minus ? 1 : 0) + controlIndex;
            throw new QueryParseException(QueryParseException.Reason.INVALID_CHARACTER,
                    "查询词含控制字符", offset, queryString);
        }
        return new QueryWord(data, minus);
    }

    private record QueryWord(String data, boolean minus) {
    }
}
