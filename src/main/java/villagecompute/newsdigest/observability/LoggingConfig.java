package villagecompute.newsdigest.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Central configuration and utilities for structured logging with pipeline context.
 *
 * <p>
 * This class defines the MDC field names attached to every log line of a digest run so that recovered errors can be
 * correlated with the item or batch that caused them. The console format in {@code application.yaml} prints these
 * fields.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier of the run span</li>
 * <li>{@code span_id} - Current span identifier</li>
 * <li>{@code run_id} - Identifier generated once per pipeline run</li>
 * <li>{@code pipeline_stage} - Current stage (filter, enrich, rank, dispatch, archive)</li>
 * <li>{@code item_url} - URL of the item being enriched</li>
 * <li>{@code batch_index} - One-based index of the batch being delivered</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the pipeline:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRunId(runId);
 * LoggingConfig.setStage("enrich");
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each run must call
 * {@link #clearMDC()} when it finishes.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Pipeline run identifier (UUID string).
     */
    public static final String MDC_RUN_ID = "run_id";

    /**
     * Pipeline stage name.
     */
    public static final String MDC_PIPELINE_STAGE = "pipeline_stage";

    /**
     * URL of the item currently being processed. Only present inside per-item enrichment.
     */
    public static final String MDC_ITEM_URL = "item_url";

    /**
     * One-based batch index. Only present while a batch is being delivered.
     */
    public static final String MDC_BATCH_INDEX = "batch_index";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are used when no span
     * is active to keep the log structure consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setRunId(String runId) {
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId);
        }
    }

    public static void setStage(String stage) {
        if (stage != null) {
            MDC.put(MDC_PIPELINE_STAGE, stage);
        }
    }

    /**
     * Sets the item URL for per-item log correlation. Pass null to clear it.
     *
     * @param url
     *            item URL, or null
     */
    public static void setItemUrl(String url) {
        if (url != null) {
            MDC.put(MDC_ITEM_URL, url);
        } else {
            MDC.remove(MDC_ITEM_URL);
        }
    }

    /**
     * Sets the one-based batch index. Pass null to clear it.
     *
     * @param batchIndex
     *            one-based batch index, or null
     */
    public static void setBatchIndex(Integer batchIndex) {
        if (batchIndex != null) {
            MDC.put(MDC_BATCH_INDEX, batchIndex.toString());
        } else {
            MDC.remove(MDC_BATCH_INDEX);
        }
    }

    /**
     * Clears all pipeline MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_PIPELINE_STAGE);
        MDC.remove(MDC_ITEM_URL);
        MDC.remove(MDC_BATCH_INDEX);
    }
}
