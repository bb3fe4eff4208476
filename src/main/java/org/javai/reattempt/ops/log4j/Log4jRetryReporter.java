package org.javai.reattempt.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.reattempt.RequestError;
import org.javai.reattempt.ops.RetryReporter;
import org.javai.reattempt.ops.RetryReporterUtils;

/**
 * Reports retry events using Log4j2.
 *
 * <p>Levels by event:
 * <ul>
 *   <li>retry attempt → INFO</li>
 *   <li>suspended → INFO</li>
 *   <li>retry exhausted → WARN</li>
 *   <li>not retriable → DEBUG</li>
 * </ul>
 * Each event carries a marker ({@code RETRY}, {@code SUSPENDED}, {@code RETRY_EXHAUSTED},
 * {@code NOT_RETRIABLE}) so appenders can route them.
 */
public class Log4jRetryReporter implements RetryReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker SUSPENDED_MARKER = MarkerManager.getMarker("SUSPENDED");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker NOT_RETRIABLE_MARKER = MarkerManager.getMarker("NOT_RETRIABLE");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.reattempt.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, RequestError error, int attemptNumber) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying operation [{}] after attempt {}. Error: {}{}",
				operation,
				attemptNumber,
				RetryReporterUtils.errorCode(error),
				formatDetail(error));
	}

	@Override
	public void reportRetryExhausted(String operation, RequestError error, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for operation [{}] after {} attempts. Error: {}{}",
				operation,
				totalAttempts,
				RetryReporterUtils.errorCode(error),
				formatDetail(error));
	}

	@Override
	public void reportNotRetriable(String operation, RequestError error, int attemptNumber) {
		logger.atDebug()
			.withMarker(NOT_RETRIABLE_MARKER)
			.log("Operation [{}] failed on attempt {} with a non-retriable error: {}{}",
				operation,
				attemptNumber,
				RetryReporterUtils.errorCode(error),
				formatDetail(error));
	}

	@Override
	public void reportSuspended(String operation, RequestError error, int attemptNumber) {
		logger.atInfo()
			.withMarker(SUSPENDED_MARKER)
			.log("Operation [{}] suspended after attempt {}. Error: {}{}",
				operation,
				attemptNumber,
				RetryReporterUtils.errorCode(error),
				formatDetail(error));
	}

	private static String formatDetail(RequestError error) {
		String detail = RetryReporterUtils.errorDetail(error);
		return detail != null ? " (" + detail + ")" : "";
	}
}
