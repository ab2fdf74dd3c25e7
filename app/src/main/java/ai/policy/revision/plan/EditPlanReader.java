package ai.policy.revision.plan;

import ai.policy.revision.operation.ActionKind;
import ai.policy.revision.operation.EditInstruction;
import ai.policy.revision.operation.InvalidOperationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an operation list from JSON.
 *
 * <p>Two shapes are accepted: a bare array of records, or an object with
 * {@code metadata.logo_path} and {@code instructions.operations}. Image paths resolve against
 * the directory of the plan file and are read eagerly, so a missing image surfaces as an
 * invalid record rather than a load failure.
 */
public class EditPlanReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EditPlanReader.class);

    private final ObjectMapper mapper;

    public EditPlanReader() {
        this(new ObjectMapper());
    }

    public EditPlanReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public EditPlan read(Path planFile) {
        Objects.requireNonNull(planFile, "planFile");
        JsonNode root;
        try {
            root = mapper.readTree(planFile.toFile());
        } catch (IOException ex) {
            throw new EditPlanException("Failed to read operation list " + planFile, ex);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new EditPlanException("Operation list " + planFile + " is empty");
        }
        Path baseDir = Optional.ofNullable(planFile.toAbsolutePath().getParent()).orElse(Path.of("."));
        Optional<Path> logoPath = Optional.ofNullable(root.path("metadata").path("logo_path").textValue())
                .filter(value -> !value.isBlank())
                .map(baseDir::resolve);

        JsonNode operations = operationsNode(root, planFile);
        Map<Path, byte[]> images = new HashMap<>();
        List<EditInstruction> instructions = new ArrayList<>();
        for (JsonNode node : operations) {
            PlanEntry entry;
            try {
                entry = mapper.treeToValue(node, PlanEntry.class);
            } catch (JsonProcessingException ex) {
                throw new EditPlanException("Malformed record #" + instructions.size() + " in " + planFile, ex);
            }
            instructions.add(toInstruction(entry, baseDir, logoPath, images));
        }
        LOGGER.info("Read {} operations from {}", instructions.size(), planFile);
        return new EditPlan(logoPath, instructions);
    }

    private JsonNode operationsNode(JsonNode root, Path planFile) {
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            JsonNode nested = root.path("instructions").path("operations");
            if (nested.isArray()) {
                return nested;
            }
            JsonNode flat = root.path("operations");
            if (flat.isArray()) {
                return flat;
            }
        }
        throw new EditPlanException("Operation list " + planFile
                + " must be an array or contain instructions.operations");
    }

    private EditInstruction toInstruction(PlanEntry entry, Path baseDir, Optional<Path> logoPath, Map<Path, byte[]> images) {
        EditInstruction.Builder builder = EditInstruction.builder(entry.action(), entry.targetText())
                .replacement(entry.replacement())
                .comment(entry.comment())
                .commentAuthor(entry.commentAuthor())
                .matchCase(entry.matchCase())
                .wholeWord(entry.wholeWord())
                .wildcards(entry.wildcards())
                .wholeDocument(entry.wholeDocument())
                .skipIfAbsent(entry.skipIfAbsent())
                .size(entry.widthMm(), entry.heightMm());
        if (isImageAction(entry.action())) {
            Optional<Path> image = Optional.ofNullable(entry.imagePath())
                    .filter(value -> !value.isBlank())
                    .map(baseDir::resolve)
                    .or(() -> logoPath);
            image.ifPresent(path -> builder.image(path.toString(), images.computeIfAbsent(path, this::readImage)));
        }
        return builder.build();
    }

    private boolean isImageAction(String action) {
        try {
            return ActionKind.from(action) == ActionKind.REPLACE_WITH_IMAGE;
        } catch (InvalidOperationException ex) {
            // reported by the parser when the record is applied
            return false;
        }
    }

    private byte[] readImage(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            LOGGER.error("Failed to read image {}: {}", path, ex.getMessage());
            return new byte[0];
        }
    }
}
