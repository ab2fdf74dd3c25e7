package ai.policy.revision.pipeline;

import ai.policy.revision.docx.DocxDocumentReader;
import ai.policy.revision.docx.DocxDocumentWriter;
import ai.policy.revision.docx.LoadedDocument;
import ai.policy.revision.docx.SerializationException;
import ai.policy.revision.operation.EditManifest;
import ai.policy.revision.operation.OperationInterpreter;
import ai.policy.revision.plan.EditPlan;
import ai.policy.revision.plan.EditPlanReader;
import ai.policy.revision.plan.ManifestWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one revision session: load the document and the operation list, apply the operations,
 * then write the revised document and its manifest.
 */
public class RevisionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RevisionPipeline.class);

    private final DocxDocumentReader documentReader;
    private final EditPlanReader planReader;
    private final OperationInterpreter interpreter;
    private final DocxDocumentWriter documentWriter;
    private final ManifestWriter manifestWriter;

    public RevisionPipeline(DocxDocumentReader documentReader,
                            EditPlanReader planReader,
                            OperationInterpreter interpreter,
                            DocxDocumentWriter documentWriter,
                            ManifestWriter manifestWriter) {
        this.documentReader = Objects.requireNonNull(documentReader, "documentReader");
        this.planReader = Objects.requireNonNull(planReader, "planReader");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
        this.manifestWriter = Objects.requireNonNull(manifestWriter, "manifestWriter");
    }

    public RevisionRunResult run(Path input, Path operations, Path output, Path manifestPath) {
        EditPlan plan = planReader.read(operations);
        if (plan.instructions().isEmpty()) {
            LOGGER.warn("Operation list {} is empty, the document is copied unchanged", operations);
        }
        LoadedDocument loaded = documentReader.read(input);
        try {
            EditManifest manifest = interpreter.apply(loaded.document(), plan.instructions());
            documentWriter.write(loaded, output);
            manifestWriter.write(manifest, input, output, manifestPath);
            return new RevisionRunResult(manifest, output, manifestPath);
        } finally {
            close(loaded);
        }
    }

    private void close(LoadedDocument loaded) {
        try {
            loaded.close();
        } catch (IOException ex) {
            throw new SerializationException("Failed to release source document", ex);
        }
    }
}
