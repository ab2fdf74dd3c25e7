package ai.policy.revision.docx;

import ai.policy.revision.model.Block;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.EmbeddedImage;
import ai.policy.revision.model.RevisionTag;
import ai.policy.revision.model.RevisionThread;
import ai.policy.revision.model.Run;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.xwpf.usermodel.XWPFComment;
import org.apache.poi.xwpf.usermodel.XWPFComments;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRunTrackChange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the block model back into the source package.
 *
 * <p>Only modified blocks are rebuilt. Their paragraph content is replaced run by run:
 * tracked insertions become {@code w:ins}, tracked deletions {@code w:del} with {@code w:delText},
 * and comment threads are written to the comments part with range markers in the paragraph.
 */
public class DocxDocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocxDocumentWriter.class);

    public void write(LoadedDocument loaded, Path target) {
        Objects.requireNonNull(target, "target");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                write(loaded, out);
            }
        } catch (IOException ex) {
            LOGGER.error("Failed to write {}", target, ex);
            throw new SerializationException("Failed to write document " + target, ex);
        }
        LOGGER.info("Wrote revised document to {}", target);
    }

    public void write(LoadedDocument loaded, OutputStream out) {
        apply(loaded);
        try {
            loaded.source().write(out);
        } catch (IOException ex) {
            throw new SerializationException("Failed to serialize document", ex);
        }
    }

    void apply(LoadedDocument loaded) {
        Document document = loaded.document();
        List<Block> modified = document.modifiedBlocks();
        for (Block block : modified) {
            rebuild(loaded.paragraph(block.id()), block);
        }
        writeThreads(loaded.source(), document.threads());
        LOGGER.debug("Rebuilt {} paragraphs, {} comment threads", modified.size(), document.threads().size());
    }

    private void rebuild(XWPFParagraph paragraph, Block block) {
        CTP ctp = paragraph.getCTP();
        clearContent(ctp);
        List<Run> runs = block.runs();
        Map<Integer, Integer> firstRun = new HashMap<>();
        Map<Integer, Integer> lastRun = new HashMap<>();
        for (int i = 0; i < runs.size(); i++) {
            for (Integer commentId : runs.get(i).commentIds()) {
                firstRun.putIfAbsent(commentId, i);
                lastRun.put(commentId, i);
            }
        }
        int index = 0;
        while (index < runs.size()) {
            int end = groupEnd(runs, index, firstRun, lastRun);
            for (Map.Entry<Integer, Integer> entry : firstRun.entrySet()) {
                if (entry.getValue() == index) {
                    ctp.addNewCommentRangeStart().setId(WordXml.id(entry.getKey()));
                }
            }
            writeGroup(ctp, paragraph, runs.subList(index, end));
            for (Map.Entry<Integer, Integer> entry : lastRun.entrySet()) {
                if (entry.getValue() == end - 1) {
                    ctp.addNewCommentRangeEnd().setId(WordXml.id(entry.getKey()));
                    ctp.addNewR().addNewCommentReference().setId(WordXml.id(entry.getKey()));
                }
            }
            index = end;
        }
    }

    private void clearContent(CTP ctp) {
        List<XmlObject> children = new ArrayList<>();
        try (XmlCursor cursor = ctp.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    if (!"pPr".equals(cursor.getName().getLocalPart())) {
                        children.add(cursor.getObject());
                    }
                } while (cursor.toNextSibling());
            }
        }
        for (XmlObject child : children) {
            try (XmlCursor cursor = child.newCursor()) {
                cursor.removeXml();
            }
        }
    }

    /**
     * End (exclusive) of the run group starting at {@code start}: consecutive text runs with the
     * same revision state and no comment boundary inside.
     */
    private int groupEnd(List<Run> runs, int start, Map<Integer, Integer> firstRun, Map<Integer, Integer> lastRun) {
        Run head = runs.get(start);
        if (head.inline().isPresent()) {
            return start + 1;
        }
        int end = start + 1;
        while (end < runs.size()) {
            Run next = runs.get(end);
            if (next.inline().isPresent() || !next.revision().equals(head.revision())
                    || !next.priorInsertion().equals(head.priorInsertion())
                    || firstRun.containsValue(end) || lastRun.containsValue(end - 1)) {
                break;
            }
            end++;
        }
        return end;
    }

    private void writeGroup(CTP ctp, XWPFParagraph paragraph, List<Run> group) {
        Run head = group.get(0);
        if (head.inline().isPresent()) {
            copyFragment(ctp, (XmlFragment) head.inline().get());
            return;
        }
        Optional<RevisionTag> revision = head.revision();
        if (revision.isEmpty()) {
            group.forEach(run -> writeRun(ctp.addNewR(), paragraph, run, false));
            return;
        }
        RevisionTag tag = revision.get();
        CTRunTrackChange change;
        if (head.priorInsertion().isPresent()) {
            // deletion of another author's insertion nests inside that insertion
            CTRunTrackChange insertion = ctp.addNewIns();
            describe(insertion, head.priorInsertion().get());
            change = insertion.addNewDel();
        } else {
            change = tag.isDeletion() ? ctp.addNewDel() : ctp.addNewIns();
        }
        describe(change, tag);
        group.forEach(run -> writeRun(change.addNewR(), paragraph, run, tag.isDeletion()));
    }

    private static void describe(CTRunTrackChange change, RevisionTag tag) {
        change.setId(WordXml.id(tag.revisionId()));
        change.setAuthor(tag.author());
        change.setDate(WordXml.calendar(tag.timestamp()));
    }

    private void copyFragment(CTP ctp, XmlFragment fragment) {
        try (XmlCursor cursor = ctp.newCursor()) {
            cursor.toEndToken();
            fragment.copyTo(cursor);
        } catch (XmlException ex) {
            throw new SerializationException("Failed to restore " + fragment.describe(), ex);
        }
    }

    private void writeRun(CTR r, XWPFParagraph paragraph, Run run, boolean deleted) {
        if (run.format() instanceof DocxRunFormat format) {
            r.addNewRPr().set(format.properties());
        }
        if (run.image().isPresent()) {
            addPicture(new XWPFRun(r, paragraph), run.image().get());
            return;
        }
        StringBuilder chunk = new StringBuilder();
        for (char c : run.text().toCharArray()) {
            if (c == '\t' || c == '\n') {
                flushText(r, chunk, deleted);
                if (c == '\t') {
                    r.addNewTab();
                } else {
                    r.addNewBr();
                }
            } else {
                chunk.append(c);
            }
        }
        flushText(r, chunk, deleted);
    }

    private void flushText(CTR r, StringBuilder chunk, boolean deleted) {
        if (chunk.length() == 0) {
            return;
        }
        CTText text = deleted ? r.addNewDelText() : r.addNewT();
        text.setStringValue(chunk.toString());
        try (XmlCursor cursor = text.newCursor()) {
            cursor.setAttributeText(WordXml.QN_XML_SPACE, "preserve");
        }
        chunk.setLength(0);
    }

    private void addPicture(XWPFRun run, EmbeddedImage image) {
        int pictureType = switch (image.format()) {
            case PNG -> org.apache.poi.xwpf.usermodel.Document.PICTURE_TYPE_PNG;
            case JPEG -> org.apache.poi.xwpf.usermodel.Document.PICTURE_TYPE_JPEG;
            case GIF -> org.apache.poi.xwpf.usermodel.Document.PICTURE_TYPE_GIF;
            case BMP -> org.apache.poi.xwpf.usermodel.Document.PICTURE_TYPE_BMP;
        };
        try {
            run.addPicture(new ByteArrayInputStream(image.data()), pictureType, image.name(),
                    Math.toIntExact(image.widthEmu()), Math.toIntExact(image.heightEmu()));
        } catch (IOException | InvalidFormatException | ArithmeticException ex) {
            throw new SerializationException("Failed to embed image " + image.name(), ex);
        }
    }

    private void writeThreads(XWPFDocument source, List<RevisionThread> threads) {
        if (threads.isEmpty()) {
            return;
        }
        XWPFComments comments = source.getDocComments() != null ? source.getDocComments() : source.createComments();
        for (RevisionThread thread : threads) {
            XWPFComment comment = comments.createComment(WordXml.id(thread.commentId()));
            comment.setAuthor(thread.author());
            comment.setInitials(initials(thread.author()));
            comment.setDate(WordXml.calendar(thread.timestamp()));
            comment.createParagraph().createRun().setText(thread.body());
        }
    }

    static String initials(String author) {
        return Arrays.stream(author.trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT))
                .collect(Collectors.joining());
    }
}
