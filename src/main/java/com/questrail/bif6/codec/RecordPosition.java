package com.questrail.bif6.codec;

/**
 * Location of a record within the input, used for diagnostics only.
 *
 * @param recordIndex zero-based index of the record in file order
 * @param byteOffset  absolute offset of the record's first byte
 */
public record RecordPosition(long recordIndex, long byteOffset) {
    public RecordPosition {
        if (recordIndex < 0) {
            throw new IllegalArgumentException("recordIndex must be >= 0");
        }
        if (byteOffset < 0) {
            throw new IllegalArgumentException("byteOffset must be >= 0");
        }
    }
}
