package dev.mars.backstop.logging;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import io.vertx.core.Context;
import io.vertx.core.Vertx;

/**
 * Logback converter for {@code %correlationId}. Register it in logback.xml with
 * {@code <conversionRule conversionWord="correlationId" converterClass="dev.mars.backstop.logging.CorrelationIdConverter"/>}.
 */
public class CorrelationIdConverter extends ClassicConverter {

    /**
     * Shown when the event carries no correlation id.
     */
    private static final String NO_CORRELATION_INDICATOR = "-";

    @Override
    public String convert(ILoggingEvent event) {
        String mdcValue = event.getMDCPropertyMap().get(CorrelationContext.MDC_CORRELATION_ID);
        if (mdcValue != null && !mdcValue.isEmpty()) {
            return mdcValue;
        }

        // Logback appenders run on the logging thread, so the current Vert.x context is the caller's.
        Context ctx = Vertx.currentContext();
        if (ctx != null) {
            Object contextValue = ctx.get(CorrelationContext.MDC_CORRELATION_ID);
            if (contextValue != null) {
                return contextValue.toString();
            }
        }

        return NO_CORRELATION_INDICATOR;
    }
}
