package com.hartwig.varpipe.scatter;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Canonical chromosome ordering: 1..22, X, Y, M. A "chr" prefix is ignored, unknown contigs sort after the canonical ones by name.
 */
public final class ChromosomeOrder implements Comparator<String> {
    public static final ChromosomeOrder INSTANCE = new ChromosomeOrder();

    public static final List<String> CANONICAL =
            Stream.concat(IntStream.rangeClosed(1, 22).mapToObj(String::valueOf), Stream.of("X", "Y", "M")).collect(Collectors.toUnmodifiableList());

    /**
     * Chromosomes kept for analysis: autosomes and sex chromosomes, no mitochondrial or unplaced contigs.
     */
    public static final Set<String> ANALYSIS_CHROMOSOMES =
            CANONICAL.stream().filter(chromosome -> !chromosome.equals("M")).collect(Collectors.toUnmodifiableSet());

    private ChromosomeOrder() {
    }

    /**
     * Strips a "chr" prefix and maps "MT" to "M".
     */
    public static String normalize(String chromosome) {
        var stripped = chromosome.regionMatches(true, 0, "chr", 0, 3) ? chromosome.substring(3) : chromosome;
        return stripped.equals("MT") ? "M" : stripped;
    }

    public static boolean isAnalysisChromosome(String chromosome) {
        return ANALYSIS_CHROMOSOMES.contains(normalize(chromosome));
    }

    @Override
    public int compare(String left, String right) {
        var leftIndex = CANONICAL.indexOf(normalize(left));
        var rightIndex = CANONICAL.indexOf(normalize(right));
        if (leftIndex >= 0 && rightIndex >= 0) {
            return leftIndex != rightIndex ? Integer.compare(leftIndex, rightIndex) : left.compareTo(right);
        }
        if (leftIndex >= 0) {
            return -1;
        }
        if (rightIndex >= 0) {
            return 1;
        }
        return left.compareTo(right);
    }
}
