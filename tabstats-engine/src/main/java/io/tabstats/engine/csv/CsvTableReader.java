package io.tabstats.engine.csv;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.tabstats.engine.InputNotFoundException;
import io.tabstats.engine.TabStatsException;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// Reads a CSV table row by row: the header first, then raw data rows.
///
/// Rows are returned exactly as split by the CSV parser, with no padding or trimming;
/// rows may be shorter or longer than the header. Blank lines are skipped and a UTF-8
/// byte-order mark in front of the header is dropped. CSV syntax errors surface as
/// [IOException] from [#nextRow()].
public final class CsvTableReader implements Closeable {

    private static final char BOM = '\uFEFF';

    private final Reader source;
    private final MappingIterator<String[]> rows;
    private final List<String> header;
    private long rowsRead = 0;

    /// Open a UTF-8 CSV file.
    /// @param path the CSV file
    /// @param delimiter the column separator
    /// @return a reader positioned after the header
    /// @throws InputNotFoundException if the file does not exist
    /// @throws IOException if the file cannot be read
    public static CsvTableReader open(Path path, char delimiter) throws IOException {
        if (!Files.exists(path)) {
            throw new InputNotFoundException(path);
        }
        Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            return new CsvTableReader(reader, delimiter);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    /// @param source character source of the CSV text; closed with this reader
    /// @param delimiter the column separator
    /// @throws TabStatsException if the source holds no header row
    /// @throws IOException if the header cannot be read
    public CsvTableReader(Reader source, char delimiter) throws IOException {
        this.source = source;
        CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
        this.rows = mapper.readerFor(String[].class).with(schema).readValues(source);

        if (!rows.hasNextValue()) {
            throw new TabStatsException("CSV input is empty, expected a header row");
        }
        String[] names = rows.nextValue();
        if (names.length > 0 && !names[0].isEmpty() && names[0].charAt(0) == BOM) {
            names[0] = names[0].substring(1);
        }
        this.header = Collections.unmodifiableList(Arrays.asList(names));
    }

    /// @return the column names in input order
    public List<String> getHeader() {
        return header;
    }

    /// @return the next data row, or null at the end of input
    /// @throws IOException on read or CSV syntax errors
    public String[] nextRow() throws IOException {
        if (!rows.hasNextValue()) {
            return null;
        }
        rowsRead++;
        return rows.nextValue();
    }

    /// @return the number of data rows returned so far
    public long getRowsRead() {
        return rowsRead;
    }

    @Override
    public void close() throws IOException {
        try {
            rows.close();
        } finally {
            source.close();
        }
    }
}
