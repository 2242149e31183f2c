package com.hartwig.varpipe.scatter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import com.google.common.io.ByteStreams;

class CompressedMergeStrategy implements MergeStrategy {
    @Override
    public void merge(List<Path> shardFiles, Path target) throws IOException {
        if (shardFiles.isEmpty()) {
            throw new IOException("Nothing to merge into " + target);
        }
        try (var out = Files.newOutputStream(target)) {
            try (var first = Files.newInputStream(shardFiles.get(0))) {
                ByteStreams.copy(first, out);
            }
        }
        for (Path shardFile : shardFiles.subList(1, shardFiles.size())) {
            try (var reader = VcfFiles.openReader(shardFile);
                    var writer = new BufferedWriter(new OutputStreamWriter(new GZIPOutputStream(Files.newOutputStream(target,
                            StandardOpenOption.APPEND)), StandardCharsets.UTF_8))) {
                HeaderOnceMergeStrategy.copyDataRows(TableHeader.read(reader), reader, writer);
            }
        }
    }
}
