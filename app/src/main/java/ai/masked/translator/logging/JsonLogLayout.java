package ai.masked.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One JSON object per log event, written with Jackson's streaming generator.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final JsonFactory jsonFactory = new JsonFactory();

    @Override
    public String doLayout(ILoggingEvent event) {
        StringWriter writer = new StringWriter(256);
        try (JsonGenerator generator = jsonFactory.createGenerator(writer)) {
            generator.writeStartObject();
            generator.writeStringField("timestamp",
                    TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
            generator.writeStringField("level", event.getLevel().toString());
            generator.writeStringField("logger", event.getLoggerName());
            generator.writeStringField("thread", event.getThreadName());
            generator.writeStringField("message", event.getFormattedMessage());

            Map<String, String> mdc = event.getMDCPropertyMap();
            if (mdc != null && !mdc.isEmpty()) {
                generator.writeObjectFieldStart("mdc");
                for (Map.Entry<String, String> entry : mdc.entrySet()) {
                    generator.writeStringField(entry.getKey(), entry.getValue());
                }
                generator.writeEndObject();
            }

            IThrowableProxy throwable = event.getThrowableProxy();
            if (throwable != null) {
                generator.writeStringField("exception", ThrowableProxyUtil.asString(throwable));
            }
            generator.writeEndObject();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render log event", ex);
        }
        return writer + System.lineSeparator();
    }
}
