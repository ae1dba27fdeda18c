package com.memsearch.text;

public final class Words {

    private Words() {
    }

    /**
     * 判断词中是否不含控制字符（码点小于 0x20）。
     */
    public static boolean isValidWord(String word) {
        return indexOfControlCharacter(word) < 0;
    }

    /**
     * 返回首个控制字符的下标，不存在时返回 -1。
     */
    public static int indexOfControlCharacter(String word) {
        if (word == null) {
            return -1;
        }
        for (int index = 0; index < word.length(); index++) {
            if (word.charAt(index) < ' ') {
                return index;
            }
        }
        return -1;
    }
}
