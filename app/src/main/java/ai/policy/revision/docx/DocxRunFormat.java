package ai.policy.revision.docx;

import ai.policy.revision.model.RunFormat;
import java.util.Objects;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;

/**
 * Run properties ({@code w:rPr}) detached from the source paragraph.
 */
final class DocxRunFormat implements RunFormat {

    private final CTRPr properties;

    private DocxRunFormat(CTRPr properties) {
        this.properties = properties;
    }

    static RunFormat of(CTRPr properties) {
        if (properties == null) {
            return RunFormat.NONE;
        }
        return new DocxRunFormat((CTRPr) properties.copy());
    }

    CTRPr properties() {
        return properties;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocxRunFormat that)) {
            return false;
        }
        return Objects.equals(properties.xmlText(), that.properties.xmlText());
    }

    @Override
    public int hashCode() {
        return properties.xmlText().hashCode();
    }

    @Override
    public String toString() {
        return "DocxRunFormat" + properties.xmlText();
    }
}
