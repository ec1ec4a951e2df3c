package astro.sewingmachine.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * One JSON object per event. MDC entries, such as the spectrum being measured, are lifted to
 * top-level fields; a thrown exception is reduced to its class and message.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, String> fields = new TreeMap<>();
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) {
            fields.putAll(mdc);
        }
        StringBuilder json = new StringBuilder(256).append('{');
        appendField(json, "timestamp", DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(event.getTimeStamp())));
        appendField(json, "level", String.valueOf(event.getLevel()));
        appendField(json, "logger", event.getLoggerName());
        appendField(json, "thread", event.getThreadName());
        appendField(json, "message", event.getFormattedMessage());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            appendField(json, "exception", throwable.getClassName());
            appendField(json, "exceptionMessage", throwable.getMessage());
        }
        fields.forEach((key, value) -> appendField(json, key, value));
        json.setLength(json.length() - 1);
        return json.append('}').append(CoreConstants.LINE_SEPARATOR).toString();
    }

    private static void appendField(StringBuilder json, String name, String value) {
        appendString(json, name);
        json.append(':');
        if (value == null) {
            json.append("null");
        } else {
            appendString(json, value);
        }
        json.append(',');
    }

    private static void appendString(StringBuilder json, String value) {
        json.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '"' || ch == '\\') {
                json.append('\\').append(ch);
            } else if (ch == '\n') {
                json.append("\\n");
            } else if (ch == '\r') {
                json.append("\\r");
            } else if (ch == '\t') {
                json.append("\\t");
            } else if (ch < 0x20) {
                json.append(String.format("\\u%04x", (int) ch));
            } else {
                json.append(ch);
            }
        }
        json.append('"');
    }
}
