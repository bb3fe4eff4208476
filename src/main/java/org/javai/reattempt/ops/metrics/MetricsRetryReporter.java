package org.javai.reattempt.ops.metrics;

import org.javai.reattempt.RequestError;
import org.javai.reattempt.ops.RetryReporter;
import org.javai.reattempt.ops.RetryReporterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.function.Consumer;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.UserApi.fetch","attemptNumber":"2","code":"bad_status:503"}
 * }</pre>
 *
 * <p>Constructor options:</p>
 * <ul>
 *   <li>{@link #MetricsRetryReporter()} - namespace from {@value #NAMESPACE_PROPERTY} or
 *   {@value #NAMESPACE_ENV}, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsRetryReporter implements RetryReporter {

	public static final String NAMESPACE_PROPERTY = "reattempt.metrics.namespace";
	public static final String NAMESPACE_ENV = "REATTEMPT_METRICS_NAMESPACE";

	private static final String DEFAULT_LOGGER_NAME = "org.javai.reattempt.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger LOG = LoggerFactory.getLogger(MetricsRetryReporter.class);

	private final String namespace;
	private final Consumer<String> sink;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter whose namespace comes from configuration, if set.
	 */
	public MetricsRetryReporter() {
		this(RetryReporterUtils.resolveConfig(NAMESPACE_PROPERTY, NAMESPACE_ENV).orElse(null));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param logger the SLF4J logger each JSON line is written to at INFO
	 */
	public MetricsRetryReporter(String namespace, Logger logger) {
		this(namespace, logger::info, Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Consumer<String> sink, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.sink = sink;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, RequestError error, int attemptNumber) {
		emit(buildJson("retry_attempt", operation, "attemptNumber", attemptNumber, error));
	}

	@Override
	public void reportRetryExhausted(String operation, RequestError error, int totalAttempts) {
		emit(buildJson("retry_exhausted", operation, "totalAttempts", totalAttempts, error));
	}

	@Override
	public void reportNotRetriable(String operation, RequestError error, int attemptNumber) {
		emit(buildJson("not_retriable", operation, "attemptNumber", attemptNumber, error));
	}

	@Override
	public void reportSuspended(String operation, RequestError error, int attemptNumber) {
		emit(buildJson("suspended", operation, "attemptNumber", attemptNumber, error));
	}

	private void emit(String json) {
		try {
			sink.accept(json);
		} catch (RuntimeException e) {
			// Reporting must never break a retry chain
			LOG.warn("Failed to emit retry metric", e);
		}
	}

	private String buildJson(String eventType, String operation, String countKey, int count, RequestError error) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", eventType, true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "trackingKey", buildTrackingKey(operation), false);
		appendField(sb, countKey, String.valueOf(count), false);
		appendField(sb, "code", RetryReporterUtils.errorCode(error), false);
		String detail = RetryReporterUtils.errorDetail(error);
		if (detail != null) {
			appendField(sb, "detail", detail, false);
		}
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private static void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(RetryReporterUtils.escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
