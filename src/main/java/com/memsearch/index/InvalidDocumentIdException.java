package com.memsearch.index;

/**
 * 插入时 docId 为负数或已存在。
 */
public class InvalidDocumentIdException extends IllegalArgumentException {
    private final int docId;

    public InvalidDocumentIdException(int docId, String reason) {
        super("Invalid document_id " + docId + ": " + reason);
        this.docId = docId;
    }

    public int getDocId() {
        return docId;
    }
}
