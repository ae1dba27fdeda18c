package com.memsearch.index;

public class UnknownDocumentException extends RuntimeException {
    private final int docId;

    public UnknownDocumentException(int docId) {
        super("Document " + docId + " is not indexed");
        this.docId = docId;
    }

    public int getDocId() {
        return docId;
    }
}
