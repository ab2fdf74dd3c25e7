package ai.policy.revision.plan;

import ai.policy.revision.docx.SerializationException;
import ai.policy.revision.operation.EditManifest;
import ai.policy.revision.operation.OperationResult;
import ai.policy.revision.operation.OperationStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the per-operation outcome report next to the revised document.
 */
public class ManifestWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestWriter.class);

    private final ObjectMapper mapper;

    public ManifestWriter() {
        this(new ObjectMapper());
    }

    public ManifestWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(EditManifest manifest, Path source, Path output, Path target) {
        Objects.requireNonNull(target, "target");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), toReport(manifest, source, output));
        } catch (IOException ex) {
            throw new SerializationException("Failed to write manifest " + target, ex);
        }
        LOGGER.info("Wrote manifest to {}", target);
    }

    String render(EditManifest manifest, Path source, Path output) {
        try {
            return mapper.writeValueAsString(toReport(manifest, source, output));
        } catch (IOException ex) {
            throw new SerializationException("Failed to render manifest", ex);
        }
    }

    private Report toReport(EditManifest manifest, Path source, Path output) {
        Summary summary = new Summary(
                manifest.count(OperationStatus.APPLIED),
                manifest.count(OperationStatus.SKIPPED),
                manifest.count(OperationStatus.FAILED),
                manifest.count(OperationStatus.INVALID));
        List<Entry> entries = manifest.results().stream().map(ManifestWriter::toEntry).toList();
        return new Report(String.valueOf(source), String.valueOf(output), summary, entries);
    }

    private static Entry toEntry(OperationResult result) {
        return new Entry(
                result.index(),
                result.action(),
                result.target(),
                lower(result.status().name()),
                result.failure().map(kind -> lower(kind.name())).orElse(null),
                result.detail(),
                result.occurrences());
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    record Report(String source, String output, Summary summary, List<Entry> operations) {
    }

    record Summary(long applied, long skipped, long failed, long invalid) {
    }

    record Entry(int index, String action, String target, String status, String failure, String detail, int occurrences) {
    }
}
