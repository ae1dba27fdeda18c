package com.memsearch.document;

/** 文档状态，插入时确定，之后不可变 */
public enum DocumentStatus {
    ACTIVE,
    IRRELEVANT,
    BANNED,
    REMOVED
}
