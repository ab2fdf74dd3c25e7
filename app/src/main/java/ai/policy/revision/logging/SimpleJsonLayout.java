package ai.policy.revision.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One JSON object per log line. The operation index and action from the MDC are lifted to
 * top-level {@code operation} and {@code action} fields; other MDC entries go under {@code mdc}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    static final String MDC_OPERATION_INDEX = "operation.index";
    static final String MDC_OPERATION_ACTION = "operation.action";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final Set<String> LIFTED_KEYS = Set.of(MDC_OPERATION_INDEX, MDC_OPERATION_ACTION);

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        builder.append(',');
        appendField(builder, "level", event.getLevel().toString());
        builder.append(',');
        appendField(builder, "logger", event.getLoggerName());
        builder.append(',');
        appendField(builder, "thread", event.getThreadName());
        builder.append(',');
        appendField(builder, "message", event.getFormattedMessage());

        Map<String, String> mdc = safeMdc(event);
        String index = mdc.get(MDC_OPERATION_INDEX);
        if (index != null && index.matches("\\d+")) {
            builder.append(',').append(quote("operation")).append(':').append(index);
        }
        if (mdc.containsKey(MDC_OPERATION_ACTION)) {
            builder.append(',');
            appendField(builder, "action", mdc.get(MDC_OPERATION_ACTION));
        }
        Map<String, String> remaining = new LinkedHashMap<>(mdc);
        remaining.keySet().removeAll(LIFTED_KEYS);
        if (!remaining.isEmpty()) {
            builder.append(',');
            builder.append("\"mdc\":{");
            String payload = remaining.entrySet().stream()
                    .map(entry -> quote(entry.getKey()) + ':' + quote(entry.getValue()))
                    .collect(Collectors.joining(","));
            builder.append(payload);
            builder.append('}');
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            builder.append(',');
            appendField(builder, "error", throwable.getClassName() + ": " + throwable.getMessage());
        }

        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private void appendField(StringBuilder builder, String name, String value) {
        builder.append(quote(name)).append(':').append(quote(value));
    }

    private Map<String, String> safeMdc(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null ? Map.of() : map;
    }

    private String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
