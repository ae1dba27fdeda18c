package com.memsearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StopWordsTest {

    @Test
    @DisplayName("从文本构造时去重并忽略空片段")
    void testParseText() {
        StopWords stopWords = StopWords.parse("and  in at in");

        assertEquals(Set.of("and", "in", "at"), stopWords.asSet());
        assertTrue(stopWords.isStopWord("in"));
        assertFalse(stopWords.isStopWord("In"));
    }

    @Test
    @DisplayName("从集合构造时忽略空串与 null")
    void testOfCollection() {
        StopWords stopWords = StopWords.of(Arrays.asList("и", "", null, "в", "и"));

        assertEquals(2, stopWords.size());
        assertTrue(stopWords.isStopWord("в"));
        assertFalse(stopWords.isStopWord(""));
    }

    @Test
    @DisplayName("空输入返回共享的空集合")
    void testEmpty() {
        assertSame(StopWords.none(), StopWords.of(List.of()));
        assertEquals(0, StopWords.parse("").size());
        assertFalse(StopWords.none().isStopWord("cat"));
    }

    @Test
    @DisplayName("含控制字符的停用词被拒绝")
    void testInvalidStopWord() {
        InvalidWordException exception = assertThrows(InvalidWordException.class,
            () -> StopWords.of(List.of("ok", "b\u0001ad")));

        assertEquals("b\u0001ad", exception.getWord());
        assertTrue(exception.getMessage().contains("\\u0001"));
    }
}
