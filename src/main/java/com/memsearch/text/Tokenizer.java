package com.memsearch.text;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项序列，每次迭代都会重新扫描原文。
     */
    Iterable<String> split(String text);
}
