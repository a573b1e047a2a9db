package org.ecaflow.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisRunnerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private AnalysisRunner runner(String stdin) {
        return new AnalysisRunner(
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private static Path copyFixture(Path dir, String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = AnalysisRunnerTest.class.getResourceAsStream("/automations/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void shouldWriteReportFileAndFailStrictRun(@TempDir Path dir) throws Exception {
        // Given
        Path input = copyFixture(dir, "circular.yaml");
        Path output = dir.resolve("report.json");

        // When
        int lenient = runner("").run(new String[] {"--in", input.toString(), "--out", output.toString()});
        int strict = runner("").run(new String[] {"--in", input.toString(), "--out", output.toString(), "--strict"});

        // Then
        assertThat(lenient).isEqualTo(AnalysisRunner.EXIT_OK);
        assertThat(strict).isEqualTo(AnalysisRunner.EXIT_FINDINGS);
        JsonNode report = mapper.readTree(Files.readString(output));
        assertThat(report.get("summary").get("circularity_issues").asInt()).isEqualTo(1);
    }

    @Test
    void shouldReadStdinAndWriteStdout() throws Exception {
        // Given
        String yaml = """
            - alias: Quiet
              trigger:
                - platform: state
                  entity_id: binary_sensor.door
                  to: "on"
              action:
                - service: light.turn_on
                  target:
                    entity_id: light.hall
            """;

        // When
        int exit = runner(yaml).run(new String[] {"--compact", "--strict"});

        // Then
        assertThat(exit).isEqualTo(AnalysisRunner.EXIT_OK);
        String out = stdout.toString(StandardCharsets.UTF_8).trim();
        assertThat(out).doesNotContain("\n");
        assertThat(mapper.readTree(out).get("summary").get("edges").asInt()).isEqualTo(1);
    }

    @Test
    void shouldReplaceBundledCatalogWhenAsked(@TempDir Path dir) throws Exception {
        // Given: a catalog that knows nothing about locks, so the loop is broken
        Path input = copyFixture(dir, "circular.yaml");
        Path catalog = dir.resolve("catalog.yaml");
        Files.writeString(catalog, "effects:\n  light.turn_on: \"on\"\n  switch.turn_on: \"on\"\n");

        // When
        int exit = runner("").run(new String[] {
            "--in", input.toString(), "--catalog", catalog.toString(), "--replace-catalog", "--strict"});

        // Then
        assertThat(exit).isEqualTo(AnalysisRunner.EXIT_OK);
    }

    @Test
    void shouldFailOnMissingOrInvalidInput(@TempDir Path dir) throws Exception {
        // Given
        Path broken = dir.resolve("broken.yaml");
        Files.writeString(broken, "- alias: [unclosed\n");

        // Then
        assertThat(runner("").run(new String[] {"--in", dir.resolve("absent.yaml").toString()}))
            .isEqualTo(AnalysisRunner.EXIT_ERROR);
        assertThat(runner("").run(new String[] {"--in", broken.toString()}))
            .isEqualTo(AnalysisRunner.EXIT_ERROR);
        assertThat(runner("").run(new String[] {"--bogus"}))
            .isEqualTo(AnalysisRunner.EXIT_ERROR);
    }

    @Test
    void shouldRequireCatalogForReplaceFlag() {
        assertThatThrownBy(() -> AnalysisRunner.RunnerOptions.parse(new String[] {"--replace-catalog"}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisRunner.RunnerOptions.parse(new String[] {"--in"}))
            .hasMessageContaining("Missing value");
    }
}
