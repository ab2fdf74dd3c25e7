package ai.policy.revision.plan;

import ai.policy.revision.operation.EditInstruction;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Operation list read from disk, with the default logo declared in its metadata.
 */
public record EditPlan(Optional<Path> logoPath, List<EditInstruction> instructions) {

    public EditPlan {
        logoPath = logoPath == null ? Optional.empty() : logoPath;
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }
}
