package lab.relay.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import lab.relay.common.CorrelationIdFilter;

/**
 * Passes only events whose MDC carries a non-blank value under {@code mdcKey}: HTTP request flows and the
 * background drives they started. Backs the request-flow appender in logback-spring.xml.
 */
public class RequireCorrelationIdFilter extends Filter<ILoggingEvent> {

    private String mdcKey = CorrelationIdFilter.MDC_CORRELATION_ID_KEY;

    // Set from <mdcKey> in the appender's filter element.
    public void setMdcKey(String mdcKey) {
        this.mdcKey = mdcKey;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null || event.getMDCPropertyMap() == null) {
            return FilterReply.DENY;
        }
        String value = event.getMDCPropertyMap().get(mdcKey);
        return value == null || value.isBlank() ? FilterReply.DENY : FilterReply.NEUTRAL;
    }
}
