package ai.policy.revision.docx;

import ai.policy.revision.model.ContainerKind;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.RevisionKind;
import ai.policy.revision.model.RevisionTag;
import ai.policy.revision.model.Run;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFComment;
import org.apache.poi.xwpf.usermodel.XWPFComments;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRunTrackChange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@code .docx} into the block model.
 *
 * <p>Body paragraphs and table cells come first in document order, followed by every header and
 * then every footer. Plain text runs become editable runs. Runs already inside {@code w:ins} or
 * {@code w:del} keep their revision tags, including deletions nested in an insertion. Anything
 * else in a paragraph is kept as an opaque fragment.
 */
public class DocxDocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocxDocumentReader.class);
    private static final Set<String> TEXT_RUN_CHILDREN = Set.of("rPr", "t", "delText", "tab", "br", "cr", "lastRenderedPageBreak");
    private static final String UNKNOWN_AUTHOR = "Unknown";

    private final Optional<HighlightingCleaner> highlightingCleaner;

    public DocxDocumentReader() {
        this(false);
    }

    /**
     * @param cleanHighlighting strip highlighting and run shading before the model is built
     */
    public DocxDocumentReader(boolean cleanHighlighting) {
        this.highlightingCleaner = cleanHighlighting ? Optional.of(new HighlightingCleaner()) : Optional.empty();
    }

    public LoadedDocument read(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            LoadedDocument loaded = read(in);
            LOGGER.info("Loaded {} ({} blocks)", path, loaded.document().blocks().size());
            return loaded;
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to read document " + path, ex);
        }
    }

    public LoadedDocument read(InputStream in) {
        XWPFDocument source;
        try {
            source = new XWPFDocument(in);
        } catch (IOException | RuntimeException ex) {
            throw new DocumentLoadException("Not a readable WordprocessingML document", ex);
        }
        return load(source);
    }

    LoadedDocument load(XWPFDocument source) {
        highlightingCleaner.ifPresent(cleaner -> LOGGER.info("Removed {} highlighting marks", cleaner.clean(source)));
        Document document = new Document();
        Map<Integer, XWPFParagraph> paragraphs = new HashMap<>();
        readBody(document, paragraphs, source.getBodyElements(), ContainerKind.BODY);
        for (XWPFHeader header : source.getHeaderList()) {
            readBody(document, paragraphs, header.getBodyElements(), ContainerKind.HEADER);
        }
        for (XWPFFooter footer : source.getFooterList()) {
            readBody(document, paragraphs, footer.getBodyElements(), ContainerKind.FOOTER);
        }
        reserveExistingIds(source, document);
        return new LoadedDocument(source, document, paragraphs);
    }

    private void readBody(Document document, Map<Integer, XWPFParagraph> paragraphs,
                          List<IBodyElement> elements, ContainerKind kind) {
        for (IBodyElement element : elements) {
            if (element instanceof XWPFParagraph paragraph) {
                int blockId = document.addBlock(kind, readRuns(document, paragraph)).id();
                paragraphs.put(blockId, paragraph);
            } else if (element instanceof XWPFTable table) {
                ContainerKind cellKind = kind == ContainerKind.BODY ? ContainerKind.TABLE_CELL : kind;
                for (XWPFTableRow row : table.getRows()) {
                    for (XWPFTableCell cell : row.getTableCells()) {
                        readBody(document, paragraphs, cell.getBodyElements(), cellKind);
                    }
                }
            } else {
                LOGGER.debug("Leaving {} element untouched", element.getElementType());
            }
        }
    }

    private List<Run> readRuns(Document document, XWPFParagraph paragraph) {
        List<Run> runs = new ArrayList<>();
        try (XmlCursor cursor = paragraph.getCTP().newCursor()) {
            if (!cursor.toFirstChild()) {
                return runs;
            }
            do {
                XmlObject child = cursor.getObject();
                String name = localName(cursor);
                if ("pPr".equals(name)) {
                    continue;
                }
                if (child instanceof CTR ctr && isPlainText(ctr)) {
                    runs.add(textRun(document, ctr, Optional.empty()));
                } else if (child instanceof CTRunTrackChange change && ("ins".equals(name) || "del".equals(name))
                        && holdsOnlyPlainRuns(change, "ins".equals(name))) {
                    RevisionTag tag = tagOf(change, "ins".equals(name) ? RevisionKind.INSERTED : RevisionKind.DELETED);
                    readTrackedRuns(document, change, tag, runs);
                } else {
                    runs.add(Run.inline(document.nextRunId(), XmlFragment.capture(child, name)));
                }
            } while (cursor.toNextSibling());
        }
        return runs;
    }

    private Run textRun(Document document, CTR ctr, Optional<RevisionTag> tag) {
        StringBuilder text = new StringBuilder();
        try (XmlCursor cursor = ctr.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    switch (localName(cursor)) {
                        case "t", "delText" -> text.append(((CTText) cursor.getObject()).getStringValue());
                        case "tab" -> text.append('\t');
                        case "br", "cr" -> text.append('\n');
                        default -> {
                        }
                    }
                } while (cursor.toNextSibling());
            }
        }
        Run run = Run.text(document.nextRunId(), text.toString(), DocxRunFormat.of(ctr.isSetRPr() ? ctr.getRPr() : null));
        return tag.map(run::withRevision).orElse(run);
    }

    /**
     * Reads the runs of a {@code w:ins} or {@code w:del}. A {@code w:del} nested in an insertion
     * marks inserted text that was deleted later, so those runs carry both tags.
     */
    private void readTrackedRuns(Document document, CTRunTrackChange change, RevisionTag tag, List<Run> runs) {
        try (XmlCursor cursor = change.newCursor()) {
            if (!cursor.toFirstChild()) {
                return;
            }
            do {
                XmlObject child = cursor.getObject();
                if (child instanceof CTR ctr) {
                    runs.add(textRun(document, ctr, Optional.of(tag)));
                } else if (child instanceof CTRunTrackChange nested) {
                    RevisionTag deletion = tagOf(nested, RevisionKind.DELETED);
                    for (CTR ctr : nested.getRList()) {
                        runs.add(textRun(document, ctr, Optional.of(tag)).markDeleted(deletion));
                    }
                }
            } while (cursor.toNextSibling());
        }
    }

    private boolean holdsOnlyPlainRuns(CTRunTrackChange change, boolean allowNestedDeletion) {
        try (XmlCursor cursor = change.newCursor()) {
            if (!cursor.toFirstChild()) {
                return true;
            }
            do {
                XmlObject child = cursor.getObject();
                if (allowNestedDeletion && "del".equals(localName(cursor)) && child instanceof CTRunTrackChange nested) {
                    if (!holdsOnlyPlainRuns(nested, false)) {
                        return false;
                    }
                } else if (!(child instanceof CTR ctr) || !isPlainText(ctr)) {
                    return false;
                }
            } while (cursor.toNextSibling());
        }
        return true;
    }

    private boolean isPlainText(CTR ctr) {
        try (XmlCursor cursor = ctr.newCursor()) {
            if (!cursor.toFirstChild()) {
                return true;
            }
            do {
                String name = localName(cursor);
                if (!TEXT_RUN_CHILDREN.contains(name)) {
                    return false;
                }
                // page and column breaks are layout, not text
                String breakType = cursor.getAttributeText(WordXml.QN_W_TYPE);
                if ("br".equals(name) && breakType != null && !"textWrapping".equals(breakType)) {
                    return false;
                }
            } while (cursor.toNextSibling());
        }
        return true;
    }

    private RevisionTag tagOf(CTRunTrackChange change, RevisionKind kind) {
        String author = change.getAuthor() == null || change.getAuthor().isBlank() ? UNKNOWN_AUTHOR : change.getAuthor();
        Instant timestamp = change.isSetDate() && change.getDate() != null ? change.getDate().toInstant() : Instant.EPOCH;
        BigInteger id = change.getId();
        int revisionId = id == null || id.signum() < 0 || id.bitLength() > 31 ? 0 : id.intValue();
        return new RevisionTag(kind, author, timestamp, revisionId);
    }

    private void reserveExistingIds(XWPFDocument source, Document document) {
        List<XmlObject> roots = new ArrayList<>();
        roots.add(source.getDocument());
        source.getHeaderList().forEach(header -> roots.add(header._getHdrFtr()));
        source.getFooterList().forEach(footer -> roots.add(footer._getHdrFtr()));
        int highestRevision = -1;
        for (XmlObject root : roots) {
            highestRevision = Math.max(highestRevision, WordXml.maxId(root, ".//w:ins"));
            highestRevision = Math.max(highestRevision, WordXml.maxId(root, ".//w:del"));
        }
        document.reserveRevisionIds(highestRevision);

        XWPFComments comments = source.getDocComments();
        if (comments != null) {
            int highestComment = -1;
            for (XWPFComment comment : comments.getComments()) {
                String id = comment.getId();
                if (id != null && id.trim().matches("\\d{1,9}")) {
                    highestComment = Math.max(highestComment, Integer.parseInt(id.trim()));
                }
            }
            document.reserveCommentIds(highestComment);
        }
    }

    private static String localName(XmlCursor cursor) {
        return cursor.getName() == null ? "" : cursor.getName().getLocalPart();
    }
}
