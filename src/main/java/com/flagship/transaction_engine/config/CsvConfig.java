package com.flagship.transaction_engine.config;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for the CSV input and output.
 *
 * Key features:
 * - Whitespace around headers and values is trimmed, blank lines are skipped
 * - Header names match regardless of case
 * - Writers never close the stream they write to (stdout stays open)
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
    }
}
