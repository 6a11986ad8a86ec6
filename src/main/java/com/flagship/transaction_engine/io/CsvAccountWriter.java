package com.flagship.transaction_engine.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.account.AccountSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Iterator;

/**
 * Writes final account states as CSV ({@code client,available,held,total,locked}).
 * The target writer is flushed but not closed. With no accounts nothing is
 * written, not even the header.
 */
@Component
@RequiredArgsConstructor
public class CsvAccountWriter {

    private final CsvMapper csvMapper;

    public void write(Iterable<AccountSnapshot> accounts, Writer target) {
        Iterator<AccountSnapshot> remaining = accounts.iterator();
        if (!remaining.hasNext()) {
            return;
        }
        CsvSchema schema = csvMapper.schemaFor(AccountRow.class).withHeader();
        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(target)) {
            while (remaining.hasNext()) {
                rows.write(AccountRow.from(remaining.next()));
            }
            rows.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write account CSV", e);
        }
    }
}
