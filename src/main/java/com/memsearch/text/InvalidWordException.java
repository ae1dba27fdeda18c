package com.memsearch.text;

/**
 * 索引或停用词中出现含控制字符的词。
 */
public class InvalidWordException extends IllegalArgumentException {
    private final String word;

    public InvalidWordException(String word) {
        super("Word " + printable(word) + " is invalid");
        this.word = word;
    }

    public String getWord() {
        return word;
    }

    /**
     * 将控制字符转为 \\uXXXX 形式，便于日志输出。
     */
    static String printable(String word) {
        StringBuilder builder = new StringBuilder(word.length() + 2);
        builder.append('"');
        for (int index = 0; index < word.length(); index++) {
            char ch = word.charAt(index);
            if (ch < ' ') {
                builder.append(String.format("\\u%04x", (int) ch));
            } else {
                builder.append(ch);
            }
        }
        return builder.append('"').toString();
    }
}
