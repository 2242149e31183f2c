package com.hartwig.varpipe.reference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.hartwig.varpipe.config.ReferenceVersion;
import com.hartwig.varpipe.storage.LocalArtifactStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(10)
class ReferenceCacheTest {
    @TempDir
    Path temporaryDirectory;

    private LocalArtifactStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new LocalArtifactStore(temporaryDirectory.resolve("store"));
    }

    @Test
    void sequentialCallsBuildOnce() {
        var builder = new CountingBuilder();
        var cache = new ReferenceCache(store, builder);

        var first = cache.getOrBuild(ReferenceVersion.HG38);
        var second = cache.getOrBuild(ReferenceVersion.HG38);

        assertThat(builder.builds.get()).isEqualTo(1);
        assertThat(second).isEqualTo(first);
        assertThat(first.isComplete()).isTrue();
        assertThat(first.directory()).isEqualTo(store.getRoot().resolve("references/hg38/genome"));
        assertThat(first.sequence()).hasContent(">chr1\nACGT");
    }

    @Test
    void storedBuildIsReusedByANewCache() {
        var builder = new CountingBuilder();
        new ReferenceCache(store, builder).getOrBuild(ReferenceVersion.HG19);

        var reused = new ReferenceCache(store, builder).getOrBuild(ReferenceVersion.HG19);

        assertThat(builder.builds.get()).isEqualTo(1);
        assertThat(reused.version()).isEqualTo(ReferenceVersion.HG19);
    }

    @Test
    void concurrentCallsShareOneBuild() throws InterruptedException, ExecutionException {
        var release = new CountDownLatch(1);
        var builder = new CountingBuilder(release);
        var cache = new ReferenceCache(store, builder);
        var callers = Executors.newFixedThreadPool(8);
        try {
            var results = new ArrayList<Future<ReferenceBuild>>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(() -> cache.getOrBuild(ReferenceVersion.HG38)));
            }
            assertThat(builder.started.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            var directories = new ArrayList<Path>();
            for (Future<ReferenceBuild> result : results) {
                directories.add(result.get().directory());
            }
            assertThat(builder.builds.get()).isEqualTo(1);
            assertThat(directories).containsOnly(store.getRoot().resolve("references/hg38/genome"));
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void versionsBuildIndependently() {
        var builder = new CountingBuilder();
        var cache = new ReferenceCache(store, builder);

        var hg19 = cache.getOrBuild(ReferenceVersion.HG19);
        var hg38 = cache.getOrBuild(ReferenceVersion.HG38);

        assertThat(builder.builds.get()).isEqualTo(2);
        assertThat(hg19.directory()).isNotEqualTo(hg38.directory());
    }

    @Test
    void failedBuildIsReportedAndNothingIsStored() {
        ReferenceBuilder failing = (version, target) -> {
            throw new IOException("download of " + version + " failed");
        };
        var cache = new ReferenceCache(store, failing);

        var e = assertThrows(ReferenceBuildError.class, () -> cache.getOrBuild(ReferenceVersion.HG38));

        assertThat(e.getVersion()).isEqualTo(ReferenceVersion.HG38);
        assertThat(e.getMessage()).isEqualTo("Could not build reference hg38: download of hg38 failed");
        assertThat(store.findShared("references/hg38")).isEmpty();
    }

    @Test
    void incompleteBuildIsRejected() {
        ReferenceBuilder partial = (version, target) -> Files.writeString(target.resolve(ReferenceBuild.SEQUENCE_FILE), ">chr1\n");
        var cache = new ReferenceCache(store, partial);

        var e = assertThrows(ReferenceBuildError.class, () -> cache.getOrBuild(ReferenceVersion.HG19));

        assertThat(e.getMessage()).contains("builder did not produce genome.fa, genome.fa.fai and genome.dict");
        assertThat(store.findShared("references/hg19")).isEmpty();
    }

    @Test
    void laterCallRetriesAfterFailure() {
        var attempts = new AtomicInteger();
        var working = new CountingBuilder();
        ReferenceBuilder flaky = (version, target) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IOException("mirror unavailable");
            }
            working.build(version, target);
        };
        var cache = new ReferenceCache(store, flaky);

        assertThrows(ReferenceBuildError.class, () -> cache.getOrBuild(ReferenceVersion.HG38));
        var build = cache.getOrBuild(ReferenceVersion.HG38);

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(build.isComplete()).isTrue();
    }

    private static class CountingBuilder implements ReferenceBuilder {
        private final AtomicInteger builds = new AtomicInteger();
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release;

        CountingBuilder() {
            this(new CountDownLatch(0));
        }

        CountingBuilder(final CountDownLatch release) {
            this.release = release;
        }

        @Override
        public void build(ReferenceVersion version, Path targetDirectory) throws IOException {
            builds.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            Files.writeString(targetDirectory.resolve(ReferenceBuild.SEQUENCE_FILE), ">chr1\nACGT\n");
            Files.writeString(targetDirectory.resolve(ReferenceBuild.INDEX_FILE), "chr1\t4\t6\t4\t5\n");
            Files.writeString(targetDirectory.resolve(ReferenceBuild.DICTIONARY_FILE), "@HD\tVN:1.6\n@SQ\tSN:chr1\tLN:4\n");
        }
    }
}
