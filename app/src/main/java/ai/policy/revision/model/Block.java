package ai.policy.revision.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Paragraph-like container: an ordered list of runs in one story of the document.
 */
public final class Block {

    private final int id;
    private final ContainerKind kind;
    private final List<Run> runs;
    private boolean modified;

    Block(int id, ContainerKind kind, List<Run> runs) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.runs = new ArrayList<>(Objects.requireNonNull(runs, "runs"));
    }

    public int id() {
        return id;
    }

    public ContainerKind kind() {
        return kind;
    }

    public List<Run> runs() {
        return Collections.unmodifiableList(runs);
    }

    public Run run(int index) {
        return runs.get(index);
    }

    public int runCount() {
        return runs.size();
    }

    public boolean isModified() {
        return modified;
    }

    /**
     * Replaces the runs in {@code [fromIndex, toIndex)} and flags the block for serialization.
     */
    public void replaceRuns(int fromIndex, int toIndex, List<Run> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        List<Run> window = runs.subList(fromIndex, toIndex);
        window.clear();
        window.addAll(replacement);
        modified = true;
    }

    public void setRun(int index, Run run) {
        runs.set(index, Objects.requireNonNull(run, "run"));
        modified = true;
    }

    void restore(List<Run> saved, boolean wasModified) {
        runs.clear();
        runs.addAll(saved);
        modified = wasModified;
    }

    public String text() {
        return join(run -> true);
    }

    /** Text as it reads once every tracked change is accepted. */
    public String acceptedText() {
        return join(run -> !run.isDeleted());
    }

    /** Text as it reads once every tracked change is rejected. */
    public String rejectedText() {
        return join(run -> !run.isInserted());
    }

    private String join(Predicate<Run> filter) {
        StringBuilder builder = new StringBuilder();
        for (Run run : runs) {
            if (filter.test(run)) {
                builder.append(run.text());
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "Block{id=" + id + ", kind=" + kind + ", runs=" + runs.size() + '}';
    }
}
