package io.microtrace.platform.starter.observability.obsv;

import ch.qos.logback.classic.spi.ILoggingEvent;
import com.fasterxml.jackson.core.JsonGenerator;
import io.microtrace.platform.http.context.RequestIdContext;
import java.io.IOException;
import java.util.Map;
import net.logstash.logback.composite.AbstractFieldJsonProvider;

/**
 * Writes the request id from the MDC as a top-level field on every record, or {@code "-"} when
 * the record was emitted outside a request.
 */
public class RequestIdJsonProvider extends AbstractFieldJsonProvider<ILoggingEvent> {

    public static final String FIELD_REQUEST_ID = RequestIdContext.MDC_KEY;

    public RequestIdJsonProvider() {
        setFieldName(FIELD_REQUEST_ID);
    }

    @Override
    public void writeTo(JsonGenerator generator, ILoggingEvent event) throws IOException {
        Map<String, String> mdc = event.getMDCPropertyMap();
        String id = mdc == null ? null : mdc.get(RequestIdContext.MDC_KEY);
        generator.writeStringField(getFieldName(), id == null || id.isEmpty() ? RequestIdContext.NONE : id);
    }
}
