package com.hartwig.varpipe.scatter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(5)
class ScatterGatherControllerTest {
    private static final List<String> HEADER =
            List.of("##fileformat=VCFv4.2", "##contig=<ID=1>", "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO");
    private static final List<String> RECORDS = List.of("1\t100\t.\tA\tG\t50\tPASS\t.",
            "1\t200\t.\tC\tT\t50\tPASS\t.",
            "2\t300\t.\tG\tA\t50\tPASS\t.",
            "X\t400\t.\tT\tC\t50\tPASS\t.");

    @TempDir
    Path temporaryDirectory;

    private ExecutorService shardExecutor;
    private ScatterGatherController controller;

    @BeforeEach
    void setUp() {
        shardExecutor = Executors.newFixedThreadPool(3);
        controller = new ScatterGatherController(shardExecutor);
    }

    @AfterEach
    void tearDown() {
        shardExecutor.shutdownNow();
    }

    @Test
    void scatterWritesOneShardPerChromosomeWithFullHeader() throws IOException {
        var vcf = writeLines(temporaryDirectory.resolve("input.vcf"), concat(HEADER, RECORDS));

        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));

        assertThat(shards.keys()).containsExactly("1", "2", "X");
        assertThat(shards.isComplete()).isTrue();
        var chromosome1 = shards.files("1").get(ScatterGatherController.SHARD_VCF);
        assertThat(Files.readAllLines(chromosome1)).isEqualTo(concat(HEADER, RECORDS.subList(0, 2)));
        var chromosomeX = shards.files("X").get(ScatterGatherController.SHARD_VCF);
        assertThat(Files.readAllLines(chromosomeX)).isEqualTo(concat(HEADER, RECORDS.subList(3, 4)));
    }

    @Test
    void scatterAndGatherRoundTripsWithHeaderOnce() throws IOException {
        var vcf = writeLines(temporaryDirectory.resolve("input.vcf"), concat(HEADER, RECORDS));

        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));
        var mapped = controller.map(shards, (key, files) -> files);
        var merged = controller.gather(mapped, MergeStrategy.headerOnce(), temporaryDirectory.resolve("merged.vcf"));

        assertThat(Files.readAllLines(merged)).isEqualTo(Files.readAllLines(vcf));
    }

    @Test
    void gatherOrdersShardsByChromosomeNotByInputOrder() throws IOException {
        var unordered = List.of(RECORDS.get(3), RECORDS.get(2), RECORDS.get(0), RECORDS.get(1));
        var vcf = writeLines(temporaryDirectory.resolve("input.vcf"), concat(HEADER, unordered));

        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));
        var merged = controller.gather(shards, MergeStrategy.headerOnce(), temporaryDirectory.resolve("merged.vcf"));

        assertThat(Files.readAllLines(merged)).isEqualTo(concat(HEADER, RECORDS));
    }

    @Test
    void compressedInputGivesCompressedShardsAndMerge() throws IOException {
        var vcf = writeGzipLines(temporaryDirectory.resolve("input.vcf.gz"), concat(HEADER, RECORDS));

        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));
        var firstShard = shards.files("1").get(ScatterGatherController.SHARD_VCF);
        assertThat(firstShard.getFileName().toString()).endsWith(".vcf.gz");

        var merged = controller.gather(shards, MergeStrategy.compressed(), temporaryDirectory.resolve("merged.vcf.gz"));

        assertThat(readGzipLines(merged)).isEqualTo(concat(HEADER, RECORDS));
        var firstShardBytes = Files.readAllBytes(firstShard);
        assertThat(Arrays.copyOf(Files.readAllBytes(merged), firstShardBytes.length)).isEqualTo(firstShardBytes);
    }

    @Test
    void shardWorkRunsPerChromosome() throws IOException {
        var vcf = writeLines(temporaryDirectory.resolve("input.vcf"), concat(HEADER, RECORDS));
        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));

        var counted = controller.map(shards, (key, files) -> {
            var count = VcfFiles.countRecords(files.get(ScatterGatherController.SHARD_VCF));
            var table = temporaryDirectory.resolve("count-" + key + ".tsv");
            Files.writeString(table, "chromosome\trecords\n" + key + "\t" + count + "\n");
            return Map.of("counts", table);
        });
        var merged = controller.gather(counted, "counts", MergeStrategy.headerOnce(), temporaryDirectory.resolve("counts.tsv"));

        assertThat(Files.readAllLines(merged)).containsExactly("chromosome\trecords", "1\t2", "2\t1", "X\t1");
    }

    @Test
    void gatherRefusesSetWithFailedShard() throws IOException {
        var vcf = writeLines(temporaryDirectory.resolve("input.vcf"), concat(HEADER, RECORDS));
        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));

        var mapped = controller.map(shards, (key, files) -> {
            if (key.equals("2")) {
                throw new IOException("annotation cache missing for chromosome 2");
            }
            return files;
        });
        var target = temporaryDirectory.resolve("merged.vcf");

        assertThat(mapped.status("2")).isEqualTo(ShardSet.ShardStatus.FAILED);
        assertThat(mapped.status("X")).isEqualTo(ShardSet.ShardStatus.COMPLETED);
        var e = assertThrows(ShardFailure.class, () -> controller.gather(mapped, MergeStrategy.headerOnce(), target));
        assertThat(e.getShardKey()).isEqualTo("2");
        assertThat(e.getMessage()).isEqualTo("Shard '2' did not complete: annotation cache missing for chromosome 2");
        assertThat(target).doesNotExist();
    }

    @Test
    void gatherRefusesSetWithPendingShard() {
        var shards = ShardSet.pending(List.of("1", "2", "X"));
        shards.complete("1", Map.of("vcf", temporaryDirectory.resolve("1.vcf")));
        shards.complete("X", Map.of("vcf", temporaryDirectory.resolve("X.vcf")));

        var e = assertThrows(ShardFailure.class,
                () -> controller.gather(shards, "vcf", MergeStrategy.headerOnce(), temporaryDirectory.resolve("merged.vcf")));
        assertThat(e.getShardKey()).isEqualTo("2");
        assertThat(e.getMessage()).endsWith("still pending");
    }

    @Test
    void headerOnceRejectsDifferingHeaders() throws IOException {
        var first = writeLines(temporaryDirectory.resolve("a.tsv"), List.of("chromosome\tscore", "1\t0.5"));
        var second = writeLines(temporaryDirectory.resolve("b.tsv"), List.of("chromosome\tother", "2\t0.7"));

        assertThrows(IOException.class, () -> MergeStrategy.headerOnce().merge(List.of(first, second), temporaryDirectory.resolve("c.tsv")));
    }

    @Test
    void headerOnceSkipsBlankLinesBeforeTableHeader() throws IOException {
        var first = writeLines(temporaryDirectory.resolve("a.tsv"), List.of("", "chromosome\tscore", "1\t0.5"));
        var second = writeLines(temporaryDirectory.resolve("b.tsv"), List.of("chromosome\tscore", "", "2\t0.7"));
        var target = temporaryDirectory.resolve("c.tsv");

        MergeStrategy.headerOnce().merge(List.of(first, second), target);

        assertThat(Files.readAllLines(target)).containsExactly("chromosome\tscore", "1\t0.5", "2\t0.7");
    }

    @Test
    void emptyScatterHasNoShards() throws IOException {
        var vcf = writeLines(temporaryDirectory.resolve("input.vcf"), HEADER);

        var shards = controller.scatter(vcf, PartitionKeyExtractor.byChromosome(), temporaryDirectory.resolve("shards"));

        assertThat(shards.size()).isZero();
    }

    private static List<String> concat(List<String> first, List<String> second) {
        var lines = new ArrayList<>(first);
        lines.addAll(second);
        return lines;
    }

    private static Path writeLines(Path path, List<String> lines) throws IOException {
        return Files.write(path, lines, StandardCharsets.UTF_8);
    }

    private static Path writeGzipLines(Path path, List<String> lines) throws IOException {
        try (var out = new GZIPOutputStream(Files.newOutputStream(path))) {
            out.write((String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
        }
        return path;
    }

    private static List<String> readGzipLines(Path path) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path)); var bytes = new ByteArrayOutputStream()) {
            in.transferTo(bytes);
            return List.of(bytes.toString(StandardCharsets.UTF_8).split("\n"));
        }
    }
}
