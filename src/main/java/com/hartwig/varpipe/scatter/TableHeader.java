package com.hartwig.varpipe.scatter;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a table into header and data rows. The header is the leading run of "#" lines, or the first non-empty line if there are none.
 */
final class TableHeader {
    private final List<String> header;
    private final String firstDataRow;

    private TableHeader(final List<String> header, final String firstDataRow) {
        this.header = header;
        this.firstDataRow = firstDataRow;
    }

    /**
     * Reads the header from the reader, leaving it positioned after the first data row, which is kept here.
     */
    static TableHeader read(BufferedReader reader) throws IOException {
        var header = new ArrayList<String>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                continue;
            }
            if (VcfFiles.isHeader(line)) {
                header.add(line);
            } else if (header.isEmpty()) {
                header.add(line);
                return new TableHeader(header, reader.readLine());
            } else {
                return new TableHeader(header, line);
            }
        }
        return new TableHeader(header, null);
    }

    List<String> lines() {
        return header;
    }

    /**
     * @return the data row read while looking for the end of the header, or null if the table has no data
     */
    String firstDataRow() {
        return firstDataRow;
    }
}
