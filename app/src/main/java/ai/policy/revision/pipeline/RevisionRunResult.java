package ai.policy.revision.pipeline;

import ai.policy.revision.operation.EditManifest;
import java.nio.file.Path;
import java.util.Objects;

/**
 * What one pipeline run produced.
 */
public record RevisionRunResult(EditManifest manifest, Path output, Path manifestPath) {

    public RevisionRunResult {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(manifestPath, "manifestPath");
    }
}
