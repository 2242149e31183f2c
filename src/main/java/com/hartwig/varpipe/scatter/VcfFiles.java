package com.hartwig.varpipe.scatter;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Line level access to VCF and tabular files. Compression is decided by the ".gz" extension only.
 */
public final class VcfFiles {
    public static final String HEADER_PREFIX = "#";

    private VcfFiles() {
    }

    public static boolean isCompressed(Path path) {
        return path.getFileName().toString().endsWith(".gz");
    }

    public static BufferedReader openReader(Path path) throws IOException {
        var stream = Files.newInputStream(path);
        if (isCompressed(path)) {
            return new BufferedReader(new InputStreamReader(new GZIPInputStream(stream), StandardCharsets.UTF_8));
        }
        return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
    }

    public static BufferedWriter openWriter(Path path) throws IOException {
        var stream = Files.newOutputStream(path);
        if (isCompressed(path)) {
            return new BufferedWriter(new OutputStreamWriter(new GZIPOutputStream(stream), StandardCharsets.UTF_8));
        }
        return new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
    }

    public static boolean isHeader(String line) {
        return line.startsWith(HEADER_PREFIX);
    }

    /**
     * @return the CHROM column of a record line
     */
    public static String chromosome(String record) {
        var tab = record.indexOf('\t');
        return tab < 0 ? record : record.substring(0, tab);
    }

    public static long countRecords(Path path) throws IOException {
        try (var reader = openReader(path)) {
            return reader.lines().filter(line -> !line.isEmpty() && !isHeader(line)).count();
        }
    }

    /**
     * @return true if any line of the file contains the marker
     */
    public static boolean containsMarker(Path path, String marker) throws IOException {
        try (var reader = openReader(path)) {
            return reader.lines().anyMatch(line -> line.contains(marker));
        }
    }
}
