package com.flagship.transaction_engine.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw row of the input CSV ({@code type, client, tx, amount}).
 *
 * Every column is bound as text so that a bad value in one row is reported
 * by {@link CsvMutationReader} as a malformed record instead of breaking the
 * CSV stream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InputRecord {
    private String type;
    private String client;
    private String tx;
    private String amount;
}
