package dev.mars.backstop.logging;

import ch.qos.logback.classic.pattern.ThrowableProxyConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Map;

/**
 * Logback layout emitting one JSON object per line.
 *
 * <p>Fields: {@code timestamp}, {@code level}, {@code logger}, {@code thread}, {@code message},
 * the correlation id and request fields when present in the MDC, any other MDC entries under
 * {@code mdc}, and the formatted stack trace under {@code exception}.</p>
 *
 * <pre>{@code
 * <encoder class="ch.qos.logback.core.encoder.LayoutWrappingEncoder">
 *     <layout class="dev.mars.backstop.logging.StructuredJsonLayout"/>
 * </encoder>
 * }</pre>
 */
public class StructuredJsonLayout extends LayoutBase<ILoggingEvent> {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ThrowableProxyConverter throwableConverter = new ThrowableProxyConverter();
    private boolean includeMdc = true;

    @Override
    public void start() {
        throwableConverter.setContext(getContext());
        throwableConverter.start();
        super.start();
    }

    @Override
    public void stop() {
        throwableConverter.stop();
        super.stop();
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", Instant.ofEpochMilli(event.getTimeStamp()).toString());
        node.put("level", event.getLevel().toString());
        node.put("logger", event.getLoggerName());
        node.put("thread", event.getThreadName());
        node.put("message", event.getFormattedMessage());

        Map<String, String> mdc = event.getMDCPropertyMap();
        putIfPresent(node, "correlationId", mdc.get(CorrelationContext.MDC_CORRELATION_ID));
        putIfPresent(node, "httpMethod", mdc.get(CorrelationContext.MDC_REQUEST_METHOD));
        putIfPresent(node, "httpUrl", mdc.get(CorrelationContext.MDC_REQUEST_URL));

        if (includeMdc && !mdc.isEmpty()) {
            ObjectNode mdcNode = node.putObject("mdc");
            mdc.forEach(mdcNode::put);
        }

        if (event.getThrowableProxy() != null) {
            node.put("exception", throwableConverter.convert(event));
        }

        try {
            return objectMapper.writeValueAsString(node) + CoreConstants.LINE_SEPARATOR;
        } catch (JsonProcessingException e) {
            addError("Failed to serialise log event", e);
            return event.getFormattedMessage() + CoreConstants.LINE_SEPARATOR;
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isEmpty()) {
            node.put(field, value);
        }
    }

    @Override
    public String getContentType() {
        return "application/json";
    }

    public boolean isIncludeMdc() {
        return includeMdc;
    }

    /**
     * Set from logback.xml with {@code <includeMdc>false</includeMdc>}.
     */
    public void setIncludeMdc(boolean includeMdc) {
        this.includeMdc = includeMdc;
    }
}
