package com.flagship.transaction_engine.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.mutation.Amounts;
import com.flagship.transaction_engine.mutation.Mutation;
import com.flagship.transaction_engine.mutation.MutationKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads the input CSV and turns each row into a validated {@link Mutation}.
 *
 * Rows are read lazily, one at a time. A row with bad content makes
 * {@link Iterator#next()} throw {@link MalformedRecordException} after the row
 * has been consumed, so callers may skip it and keep iterating. A broken CSV
 * stream surfaces as {@link UncheckedIOException} and cannot be continued.
 */
@Component
@RequiredArgsConstructor
public class CsvMutationReader {

    static final long MAX_CLIENT_ID = 0xFFFFL;
    static final long MAX_TRANSACTION_ID = 0xFFFF_FFFFL;

    private final CsvMapper csvMapper;

    public Iterator<Mutation> read(Reader source) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try {
            MappingIterator<InputRecord> rows = csvMapper.readerFor(InputRecord.class)
                .with(schema)
                .readValues(source);
            return new MutationIterator(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open transaction CSV", e);
        }
    }

    /**
     * Validates one raw row.
     *
     * @param recordNumber 1-based position of the row after the header, used in diagnostics
     * @throws MalformedRecordException if any column is invalid or the amount presence
     *         does not match the transaction type
     */
    public Mutation toMutation(InputRecord record, long recordNumber) {
        MutationKind kind;
        try {
            kind = MutationKind.fromLabel(record.getType());
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(recordNumber, record, e.getMessage());
        }

        int clientId = (int) parseId(record.getClient(), MAX_CLIENT_ID, "client", record, recordNumber);
        long id = parseId(record.getTx(), MAX_TRANSACTION_ID, "tx", record, recordNumber);

        String amountText = blankToNull(record.getAmount());
        if (kind.requiresAmount() && amountText == null) {
            throw new MalformedRecordException(recordNumber, record, kind.getLabel() + "s must have an amount");
        }
        if (!kind.requiresAmount() && amountText != null) {
            throw new MalformedRecordException(recordNumber, record, kind.getLabel() + "s may not have an amount");
        }

        Long amount = null;
        if (amountText != null) {
            try {
                amount = Amounts.parse(amountText);
            } catch (NumberFormatException | ArithmeticException e) {
                throw new MalformedRecordException(recordNumber, record, "invalid amount '" + amountText + "'", e);
            }
        }
        return new Mutation(id, kind, clientId, amount);
    }

    private long parseId(String text, long max, String column, InputRecord record, long recordNumber) {
        String value = blankToNull(text);
        if (value == null) {
            throw new MalformedRecordException(recordNumber, record, "missing " + column);
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0 || parsed > max) {
                throw new MalformedRecordException(recordNumber, record,
                    column + " " + value + " is outside 0.." + max);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(recordNumber, record, "invalid " + column + " '" + value + "'", e);
        }
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private class MutationIterator implements Iterator<Mutation> {

        private final MappingIterator<InputRecord> rows;
        private long recordNumber;

        MutationIterator(MappingIterator<InputRecord> rows) {
            this.rows = rows;
        }

        @Override
        public boolean hasNext() {
            try {
                return rows.hasNextValue();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read record " + (recordNumber + 1), e);
            }
        }

        @Override
        public Mutation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            InputRecord record;
            try {
                record = rows.nextValue();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read record " + (recordNumber + 1), e);
            }
            recordNumber++;
            return toMutation(record, recordNumber);
        }
    }
}
