package ai.policy.revision.docx;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Calendar;
import java.util.Locale;
import java.util.TimeZone;
import java.util.regex.Pattern;
import javax.xml.namespace.QName;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

/**
 * WordprocessingML names and small XmlBeans helpers shared by the reader and the writer.
 */
final class WordXml {

    static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final QName QN_W_ID = new QName(NS_W, "id");
    static final QName QN_W_TYPE = new QName(NS_W, "type");
    static final QName QN_XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d{1,9}");

    private WordXml() {
    }

    static String path(String expression) {
        return "declare namespace w='" + NS_W + "' " + expression;
    }

    /**
     * Highest numeric {@code w:id} among the elements matched by {@code expression}, or -1.
     */
    static int maxId(XmlObject root, String expression) {
        int max = -1;
        for (XmlObject found : root.selectPath(path(expression))) {
            try (XmlCursor cursor = found.newCursor()) {
                String raw = cursor.getAttributeText(QN_W_ID);
                // only numeric ids can collide with allocated ones
                if (raw != null && NUMERIC_ID.matcher(raw.trim()).matches()) {
                    max = Math.max(max, Integer.parseInt(raw.trim()));
                }
            }
        }
        return max;
    }

    static Calendar calendar(Instant instant) {
        Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"), Locale.ROOT);
        calendar.setTimeInMillis(instant.toEpochMilli());
        return calendar;
    }

    static BigInteger id(int value) {
        return BigInteger.valueOf(value);
    }
}
