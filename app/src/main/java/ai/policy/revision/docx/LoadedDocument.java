package ai.policy.revision.docx;

import ai.policy.revision.model.Document;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

/**
 * A {@code .docx} package together with the block model read from it.
 */
public final class LoadedDocument implements Closeable {

    private final XWPFDocument source;
    private final Document document;
    private final Map<Integer, XWPFParagraph> paragraphs;

    LoadedDocument(XWPFDocument source, Document document, Map<Integer, XWPFParagraph> paragraphs) {
        this.source = Objects.requireNonNull(source, "source");
        this.document = Objects.requireNonNull(document, "document");
        this.paragraphs = Map.copyOf(paragraphs);
    }

    public Document document() {
        return document;
    }

    XWPFDocument source() {
        return source;
    }

    XWPFParagraph paragraph(int blockId) {
        XWPFParagraph paragraph = paragraphs.get(blockId);
        if (paragraph == null) {
            throw new IllegalArgumentException("No paragraph for block " + blockId);
        }
        return paragraph;
    }

    @Override
    public void close() throws IOException {
        source.close();
    }
}
