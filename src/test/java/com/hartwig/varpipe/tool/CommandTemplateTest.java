package com.hartwig.varpipe.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class CommandTemplateTest {
    @Test
    void placeholdersAreSubstitutedPerArgument() {
        var template = CommandTemplate.of(List.of("bcftools", "norm", "--fasta-ref", "${reference_build}/genome.fa", "${input_vcf}"));

        var arguments = template.render(Map.of("reference_build", "/store/ref", "input_vcf", "/data/my sample.vcf"));

        assertThat(arguments).containsExactly("bcftools", "norm", "--fasta-ref", "/store/ref/genome.fa", "/data/my sample.vcf");
    }

    @Test
    void unresolvedPlaceholderIsAnError() {
        var template = CommandTemplate.of(List.of("tool", "--in", "${missing}"));
        var e = assertThrows(IllegalArgumentException.class, () -> template.render(Map.of("other", "x")));
        assertThat(e.getMessage()).isEqualTo("No value for placeholder 'missing' in argument '${missing}'");
    }

    @Test
    void emptyTemplateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CommandTemplate.of(List.of()));
    }
}
