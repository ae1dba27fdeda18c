package com.memsearch.index;

/**
 * 对没有任何倒排记录的词计算 IDF。正常调用路径不会触发。
 */
public class UnknownTermException extends RuntimeException {
    private final String term;

    public UnknownTermException(String term) {
        super("Term \"" + term + "\" has no postings");
        this.term = term;
    }

    public String getTerm() {
        return term;
    }
}
