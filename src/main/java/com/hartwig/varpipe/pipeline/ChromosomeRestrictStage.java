package com.hartwig.varpipe.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.scatter.ChromosomeOrder;
import com.hartwig.varpipe.scatter.VcfFiles;
import com.hartwig.varpipe.workflow.StageContext;
import com.hartwig.varpipe.workflow.StageExecutor;
import com.hartwig.varpipe.workflow.StageResult;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renames contigs with the optional chromosome map input and keeps only autosomes and sex chromosomes. This is the only place where
 * records are dropped by chromosome.
 */
public class ChromosomeRestrictStage implements StageExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChromosomeRestrictStage.class);
    private static final Pattern CONTIG_HEADER = Pattern.compile("^##contig=<ID=([^,>]+)(.*)$");

    private final String input;
    private final String output;

    public ChromosomeRestrictStage(final String input, final String output) {
        this.input = input;
        this.output = output;
    }

    @Override
    public StageResult execute(StageContext context) throws IOException {
        var vcf = context.input(input);
        var chromosomeMap = context.inputs().get(PipelineParameters.CHROMOSOME_MAP);
        var renames = chromosomeMap != null ? readChromosomeMap(chromosomeMap.path()) : Map.<String, String>of();
        var target = context.workDirectory().resolve(VcfFiles.isCompressed(vcf) ? "restricted.vcf.gz" : "restricted.vcf");

        long kept = 0;
        long dropped = 0;
        try (var reader = VcfFiles.openReader(vcf); var writer = VcfFiles.openWriter(target)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                String written;
                if (VcfFiles.isHeader(line)) {
                    written = restrictHeader(line, renames);
                } else {
                    written = restrictRecord(line, renames);
                    if (written == null) {
                        dropped++;
                    } else {
                        kept++;
                    }
                }
                if (written != null) {
                    writer.write(written);
                    writer.newLine();
                }
            }
        }
        LOGGER.info("[{}] Kept {} records on analysis chromosomes, dropped {}", context.runId(), kept, dropped);
        return StageResult.of(output, target);
    }

    private static String restrictHeader(String line, Map<String, String> renames) {
        Matcher matcher = CONTIG_HEADER.matcher(line);
        if (!matcher.matches()) {
            return line;
        }
        var contig = renames.getOrDefault(matcher.group(1), matcher.group(1));
        return ChromosomeOrder.isAnalysisChromosome(contig) ? "##contig=<ID=" + contig + matcher.group(2) : null;
    }

    private static String restrictRecord(String record, Map<String, String> renames) {
        var chromosome = VcfFiles.chromosome(record);
        var renamed = renames.getOrDefault(chromosome, chromosome);
        if (!ChromosomeOrder.isAnalysisChromosome(renamed)) {
            return null;
        }
        return renamed.equals(chromosome) ? record : renamed + record.substring(chromosome.length());
    }

    /**
     * Reads a two column table, old name then new name, separated by whitespace. Blank lines and '#' comments are skipped.
     */
    static Map<String, String> readChromosomeMap(Path path) throws IOException {
        var renames = new HashMap<String, String>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (StringUtils.isBlank(line) || line.startsWith("#")) {
                continue;
            }
            var columns = StringUtils.split(line.trim());
            if (columns.length != 2) {
                throw new IOException(String.format("Chromosome map %s has a malformed line: '%s'", path, line));
            }
            renames.put(columns[0], columns[1]);
        }
        return renames;
    }
}
