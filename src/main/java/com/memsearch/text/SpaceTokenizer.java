package com.memsearch.text;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 按单个空格切分文本，不做大小写归一化，也不裁剪其它空白字符。
 */
public class SpaceTokenizer implements Tokenizer {

    private static final char DELIMITER = ' ';

    @Override
    public Iterable<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return () -> new WordIterator(text);
    }

    /**
     * 立即切分并返回不可变列表。
     */
    public List<String> splitToList(String text) {
        List<String> words = new ArrayList<>();
        for (String word : split(text)) {
            words.add(word);
        }
        return List.copyOf(words);
    }

    private static final class WordIterator implements Iterator<String> {
        private final String text;
        private int cursor;
        private String next;

        private WordIterator(String text) {
            this.text = text;
            this.cursor = 0;
            advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public String next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            String current = next;
            advance();
            return current;
        }

        /**
         * 跳过连续分隔符产生的空片段，定位下一个非空词。
         */
        private void advance() {
            next = null;
            while (cursor <= text.length() && next == null) {
                int delimiterIndex = text.indexOf(DELIMITER, cursor);
                int segmentEnd = delimiterIndex < 0 ? text.length() : delimiterIndex;
                if (segmentEnd > cursor) {
                    next = text.substring(cursor, segmentEnd);
                }
                cursor = segmentEnd + 1;
            }
        }
    }
}
