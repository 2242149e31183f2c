package com.hartwig.varpipe;

import java.io.FileInputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import com.hartwig.varpipe.config.DefinitionReader;
import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.config.ValidationError;
import com.hartwig.varpipe.workflow.RunReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "varpipe", description = "Annotates and scores the variants of a patient VCF against an HPO phenotype list")
public class VarPipeMain implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(VarPipeMain.class);

    @CommandLine.Option(names = { "--input-vcf" },
                        description = "Patient VCF, .vcf or .vcf.gz")
    private String inputVcf;

    @CommandLine.Option(names = { "--input-hpo" },
                        description = "HPO term list, .hpo or .txt")
    private String inputHpo;

    @CommandLine.Option(names = { "--reference-directory" },
                        description = "Directory with annotation data sources")
    private String referenceDirectory;

    @CommandLine.Option(names = { "--reference-version" },
                        description = "Reference genome version, hg19 or hg38")
    private String referenceVersion;

    @CommandLine.Option(names = { "--run-id" },
                        description = "Name of the run, defaults to the VCF file name")
    private String runId;

    @CommandLine.Option(names = { "--output-directory" },
                        description = "Directory the results are published to")
    private String outputDirectory;

    @CommandLine.Option(names = { "--store-directory" },
                        description = "Artifact store, defaults to .store in the output directory")
    private String storeDirectory;

    @CommandLine.Option(names = { "--chromosome-map" },
                        description = "Two column contig rename table")
    private String chromosomeMap;

    @CommandLine.Option(names = { "--threads" },
                        description = "Number of concurrent stages and shards")
    private String threads;

    @CommandLine.Option(names = { "--tools" },
                        description = "YAML file with tool definitions overriding the bundled ones")
    private String toolsYamlFileName;

    @Override
    public Integer call() {
        try {
            var definitionReader = new DefinitionReader();
            var tools = definitionReader.readDefaultTools();
            if (toolsYamlFileName != null) {
                try (var toolsYaml = new FileInputStream(toolsYamlFileName)) {
                    tools = tools.withOverrides(definitionReader.readTools(toolsYaml));
                }
            }

            RunReport report;
            try (var engine = new VariantPipelineEngine(tools)) {
                report = engine.run(parameters());
            }
            if (!report.success()) {
                LOGGER.error("Run [{}] failed. {}", report.runId(), report.failureSummary().orElse(""));
                return 1;
            }
            LOGGER.info("Run [{}] finished successfully.", report.runId());
            return 0;
        } catch (ValidationError e) {
            LOGGER.error(e.getMessage());
            return 1;
        } catch (Exception e) {
            LOGGER.error("Unexpected exception", e);
            return 1;
        }
    }

    Map<String, String> parameters() {
        var parameters = new HashMap<String, String>();
        putIfPresent(parameters, PipelineParameters.INPUT_VCF, inputVcf);
        putIfPresent(parameters, PipelineParameters.INPUT_HPO, inputHpo);
        putIfPresent(parameters, PipelineParameters.REFERENCE_DIRECTORY, referenceDirectory);
        putIfPresent(parameters, PipelineParameters.REFERENCE_VERSION, referenceVersion);
        putIfPresent(parameters, PipelineParameters.RUN_ID, runId);
        putIfPresent(parameters, PipelineParameters.OUTPUT_DIRECTORY, outputDirectory);
        putIfPresent(parameters, PipelineParameters.STORE_DIRECTORY, storeDirectory);
        putIfPresent(parameters, PipelineParameters.CHROMOSOME_MAP, chromosomeMap);
        putIfPresent(parameters, PipelineParameters.THREADS, threads);
        return parameters;
    }

    private static void putIfPresent(Map<String, String> parameters, String name, String value) {
        if (value != null) {
            parameters.put(name, value);
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new VarPipeMain()).execute(args));
    }
}
