package com.flagship.transaction_engine.io;

import lombok.Getter;

/**
 * An input row that could not be turned into a valid mutation.
 * Raised before the row reaches any account.
 */
@Getter
public class MalformedRecordException extends RuntimeException {

    private final long recordNumber;
    private final InputRecord record;

    public MalformedRecordException(long recordNumber, InputRecord record, String problem) {
        this(recordNumber, record, problem, null);
    }

    public MalformedRecordException(long recordNumber, InputRecord record, String problem, Throwable cause) {
        super(String.format("Error parsing record %d (tx %s): %s", recordNumber,
            record.getTx() == null ? "?" : record.getTx(), problem), cause);
        this.recordNumber = recordNumber;
        this.record = record;
    }
}
