package ai.policy.revision.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Arena holding every block, run and comment thread of one document.
 *
 * <p>Blocks keep document order: body and table cells first, then headers, then footers.
 * Ids for runs, revisions and comments come from separate sequential allocators so a session
 * is reproducible.
 */
public final class Document {

    private final List<Block> blocks = new ArrayList<>();
    private final Map<Integer, Integer> indexById = new HashMap<>();
    private final List<RevisionThread> threads = new ArrayList<>();
    private final Set<Integer> sessionRevisionIds = new HashSet<>();
    private final IdAllocator blockIds = new IdAllocator(0);
    private final IdAllocator runIds = new IdAllocator(0);
    private final IdAllocator revisionIds = new IdAllocator(1);
    private final IdAllocator commentIds = new IdAllocator(0);

    public Block addBlock(ContainerKind kind, List<Run> runs) {
        Block block = new Block(blockIds.next(), kind, runs);
        indexById.put(block.id(), blocks.size());
        blocks.add(block);
        return block;
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Block block(int blockId) {
        return blocks.get(blockIndex(blockId));
    }

    public int blockIndex(int blockId) {
        Integer index = indexById.get(blockId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown block id " + blockId);
        }
        return index;
    }

    public int nextRunId() {
        return runIds.next();
    }

    public int nextRevisionId() {
        int id = revisionIds.next();
        sessionRevisionIds.add(id);
        return id;
    }

    public int nextCommentId() {
        return commentIds.next();
    }

    /**
     * Marks revision ids up to {@code highestExisting} as taken by markup already in the source.
     */
    public void reserveRevisionIds(int highestExisting) {
        revisionIds.reserveAbove(highestExisting);
    }

    public void reserveCommentIds(int highestExisting) {
        commentIds.reserveAbove(highestExisting);
    }

    /**
     * Whether the tag was created in this session rather than loaded from the source.
     */
    public boolean isSessionRevision(RevisionTag tag) {
        return sessionRevisionIds.contains(tag.revisionId());
    }

    public void addThread(RevisionThread thread) {
        threads.add(Objects.requireNonNull(thread, "thread"));
    }

    public List<RevisionThread> threads() {
        return Collections.unmodifiableList(threads);
    }

    /**
     * Captures every block's runs and the thread list so a failed operation can be undone.
     */
    public Snapshot snapshot() {
        List<List<Run>> runs = new ArrayList<>(blocks.size());
        List<Boolean> modified = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            runs.add(List.copyOf(block.runs()));
            modified.add(block.isModified());
        }
        return new Snapshot(runs, modified, threads.size());
    }

    /**
     * Puts blocks and threads back as captured. Ids handed out since stay consumed.
     */
    public void restore(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.runs.size() != blocks.size()) {
            throw new IllegalStateException("snapshot covers " + snapshot.runs.size() + " blocks, document has " + blocks.size());
        }
        for (int i = 0; i < blocks.size(); i++) {
            blocks.get(i).restore(snapshot.runs.get(i), snapshot.modified.get(i));
        }
        threads.subList(snapshot.threadCount, threads.size()).clear();
    }

    public List<Block> modifiedBlocks() {
        return blocks.stream().filter(Block::isModified).collect(Collectors.toUnmodifiableList());
    }

    public String acceptedText() {
        return blocks.stream().map(Block::acceptedText).collect(Collectors.joining("\n"));
    }

    public String rejectedText() {
        return blocks.stream().map(Block::rejectedText).collect(Collectors.joining("\n"));
    }

    /**
     * Opaque state captured by {@link #snapshot()}.
     */
    public static final class Snapshot {

        private final List<List<Run>> runs;
        private final List<Boolean> modified;
        private final int threadCount;

        private Snapshot(List<List<Run>> runs, List<Boolean> modified, int threadCount) {
            this.runs = runs;
            this.modified = modified;
            this.threadCount = threadCount;
        }
    }
}
