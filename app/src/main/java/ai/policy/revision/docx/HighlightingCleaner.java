package ai.policy.revision.docx;

import java.util.ArrayList;
import java.util.List;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;

/**
 * Removes highlight and run shading left on template placeholders. The change is not tracked.
 */
public class HighlightingCleaner {

    /**
     * @return number of highlight and shading elements removed
     */
    public int clean(XWPFDocument source) {
        List<XmlObject> roots = new ArrayList<>();
        roots.add(source.getDocument());
        source.getHeaderList().forEach(header -> roots.add(header._getHdrFtr()));
        source.getFooterList().forEach(footer -> roots.add(footer._getHdrFtr()));
        int removed = 0;
        for (XmlObject root : roots) {
            for (XmlObject found : root.selectPath(WordXml.path(".//w:rPr"))) {
                if (found instanceof CTRPr properties) {
                    removed += strip(properties);
                }
            }
        }
        return removed;
    }

    private int strip(CTRPr properties) {
        int removed = 0;
        while (properties.sizeOfHighlightArray() > 0) {
            properties.removeHighlight(0);
            removed++;
        }
        while (properties.sizeOfShdArray() > 0) {
            properties.removeShd(0);
            removed++;
        }
        return removed;
    }
}
