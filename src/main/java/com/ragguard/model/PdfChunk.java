package com.ragguard.model;

import lombok.Value;

/**
 * Contiguous page window of a split PDF. Pages are 1-based and inclusive.
 */
@Value
public class PdfChunk {

    int index;
    int startPage;
    int endPage;
    byte[] content;

    public int getPageCount() {
        return endPage - startPage + 1;
    }
}
