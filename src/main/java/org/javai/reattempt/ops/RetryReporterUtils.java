package org.javai.reattempt.ops;

import org.javai.reattempt.RequestError;

import java.util.Optional;

/**
 * Shared utilities for RetryReporter implementations.
 */
public final class RetryReporterUtils {

	private RetryReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value, or empty if neither is set
	 */
	public static Optional<String> resolveConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * A stable, low-cardinality code for an error, suitable as a metrics dimension.
	 * Bad statuses keep their status code, e.g. {@code bad_status:503}.
	 */
	public static String errorCode(RequestError error) {
		if (error instanceof RequestError.BadStatus badStatus) {
			return "bad_status:" + badStatus.code();
		}
		if (error instanceof RequestError.NetworkUnreachable) {
			return "network_unreachable";
		}
		if (error instanceof RequestError.TimedOut) {
			return "timed_out";
		}
		if (error instanceof RequestError.BadUrl) {
			return "bad_url";
		}
		if (error instanceof RequestError.BadBody) {
			return "bad_body";
		}
		return "custom";
	}

	/**
	 * The free-text part of an error, or null for errors that carry none.
	 */
	public static String errorDetail(RequestError error) {
		if (error instanceof RequestError.BadUrl badUrl) {
			return badUrl.url();
		}
		if (error instanceof RequestError.BadBody badBody) {
			return badBody.message();
		}
		if (error instanceof RequestError.CustomError custom) {
			return custom.message();
		}
		return null;
	}

	/**
	 * Escapes special characters for JSON string values.
	 */
	public static String escapeJson(String s) {
		if (s == null) return "";
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
