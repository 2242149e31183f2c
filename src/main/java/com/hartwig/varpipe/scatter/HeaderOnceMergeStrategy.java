package com.hartwig.varpipe.scatter;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

class HeaderOnceMergeStrategy implements MergeStrategy {
    @Override
    public void merge(List<Path> shardFiles, Path target) throws IOException {
        List<String> expectedHeader = null;
        try (var writer = VcfFiles.openWriter(target)) {
            for (Path shardFile : shardFiles) {
                try (var reader = VcfFiles.openReader(shardFile)) {
                    var header = TableHeader.read(reader);
                    if (header.lines().isEmpty()) {
                        continue;
                    }
                    if (expectedHeader == null) {
                        expectedHeader = header.lines();
                        writeLines(writer, expectedHeader);
                    } else if (!expectedHeader.equals(header.lines())) {
                        throw new IOException(String.format("Header of %s differs from the header of the first shard", shardFile));
                    }
                    copyDataRows(header, reader, writer);
                }
            }
        }
    }

    static void copyDataRows(TableHeader header, BufferedReader reader, BufferedWriter writer) throws IOException {
        var line = header.firstDataRow();
        while (line != null) {
            if (!line.isEmpty()) {
                writer.write(line);
                writer.newLine();
            }
            line = reader.readLine();
        }
    }

    private static void writeLines(BufferedWriter writer, List<String> lines) throws IOException {
        for (String line : lines) {
            writer.write(line);
            writer.newLine();
        }
    }
}
