package com.memsearch.text;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 停用词集合：去重、忽略空串，构造时校验每个词。
 */
public final class StopWords {

    private static final StopWords NONE = new StopWords(Set.of());

    private final Set<String> words;

    private StopWords(Set<String> words) {
        this.words = words;
    }

    /**
     * 从空格分隔的文本构造停用词集合。
     */
    public static StopWords parse(String text) {
        return of(new SpaceTokenizer().splitToList(text));
    }

    /**
     * 从任意字符串集合构造停用词集合。
     *
     * @throws InvalidWordException 任一停用词含控制字符
     */
    public static StopWords of(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return NONE;
        }
        Set<String> unique = new TreeSet<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            if (!Words.isValidWord(candidate)) {
                throw new InvalidWordException(candidate);
            }
            unique.add(candidate);
        }
        return new StopWords(Collections.unmodifiableSet(unique));
    }

    public static StopWords none() {
        return NONE;
    }

    /**
     * 判断词项是否为停用词，按字节精确比较。
     */
    public boolean isStopWord(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return words.contains(term);
    }

    public Set<String> asSet() {
        return words;
    }

    public int size() {
        return words.size();
    }
}
