package ai.policy.revision.plan;

import static org.assertj.core.api.Assertions.assertThat;

import ai.policy.revision.operation.EditManifest;
import ai.policy.revision.operation.FailureKind;
import ai.policy.revision.operation.OperationResult;
import ai.policy.revision.operation.OperationStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesSummaryAndEntries() throws IOException {
        EditManifest manifest = new EditManifest(List.of(
                new OperationResult(0, "replace", "<owner>", OperationStatus.APPLIED, Optional.empty(), "", 1),
                new OperationResult(1, "comment", "Vault", OperationStatus.SKIPPED,
                        Optional.of(FailureKind.TARGET_NOT_FOUND), "target not found", 0),
                new OperationResult(2, "explode", "x", OperationStatus.INVALID,
                        Optional.of(FailureKind.INVALID_OPERATION), "unknown action 'explode'", 0)));
        Path target = tempDir.resolve("reports/out.docx.manifest.json");

        new ManifestWriter().write(manifest, Path.of("in.docx"), Path.of("out.docx"), target);

        JsonNode root = mapper.readTree(Files.readString(target));
        assertThat(root.path("source").asText()).isEqualTo("in.docx");
        assertThat(root.path("output").asText()).isEqualTo("out.docx");
        assertThat(root.path("summary").path("applied").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("skipped").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("failed").asInt()).isZero();
        assertThat(root.path("summary").path("invalid").asInt()).isEqualTo(1);
        JsonNode operations = root.path("operations");
        assertThat(operations.size()).isEqualTo(3);
        assertThat(operations.get(0).path("status").asText()).isEqualTo("applied");
        assertThat(operations.get(0).path("failure").isNull()).isTrue();
        assertThat(operations.get(0).path("occurrences").asInt()).isEqualTo(1);
        assertThat(operations.get(1).path("failure").asText()).isEqualTo("target_not_found");
        assertThat(operations.get(2).path("action").asText()).isEqualTo("explode");
        assertThat(operations.get(2).path("detail").asText()).contains("explode");
    }

    @Test
    void rendersIndentedJson() {
        String json = new ManifestWriter().render(new EditManifest(List.of()), Path.of("a.docx"), Path.of("b.docx"));

        assertThat(json).contains("\n").contains("\"operations\" : [ ]");
    }
}
