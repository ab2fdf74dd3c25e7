package ai.policy.revision.docx;

import ai.policy.revision.model.InlineObject;
import java.util.Objects;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.apache.xmlbeans.XmlOptions;

/**
 * Paragraph child the engine does not edit (bookmarks, fields, drawings, comment markers),
 * kept as serialized XML so it can be put back in place.
 */
final class XmlFragment implements InlineObject {

    private final String elementName;
    private final String xml;

    private XmlFragment(String elementName, String xml) {
        this.elementName = elementName;
        this.xml = xml;
    }

    static XmlFragment capture(XmlObject element, String elementName) {
        Objects.requireNonNull(element, "element");
        return new XmlFragment(elementName, element.xmlText(new XmlOptions().setSaveOuter()));
    }

    /**
     * Copies the fragment into the position of {@code destination}.
     */
    void copyTo(XmlCursor destination) throws XmlException {
        XmlObject parsed = XmlObject.Factory.parse(xml);
        try (XmlCursor source = parsed.newCursor()) {
            if (!source.toFirstChild()) {
                throw new XmlException("empty fragment for element " + elementName);
            }
            source.copyXml(destination);
        }
    }

    @Override
    public String describe() {
        return "w:" + elementName;
    }

    @Override
    public String toString() {
        return "XmlFragment{" + elementName + '}';
    }
}
