package org.javai.reattempt.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.reattempt.RequestError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class Log4jRetryReporterTest {

	private CapturingAppender appender;
	private Logger logger;
	private Log4jRetryReporter reporter;

	@BeforeEach
	void setUp() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		logger = context.getLogger("org.javai.reattempt.test.Log4jRetryReporter");
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
		logger.setLevel(Level.DEBUG);
		reporter = new Log4jRetryReporter(logger);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void reportRetryAttempt_logsAtInfoWithRetryMarker() {
		reporter.reportRetryAttempt("UserApi.fetch", RequestError.badStatus(503), 2);

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("Retrying operation [UserApi.fetch] after attempt 2. Error: bad_status:503");
	}

	@Test
	void reportRetryExhausted_logsAtWarn() {
		reporter.reportRetryExhausted("UserApi.fetch", RequestError.custom("quota exceeded"), 3);

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY_EXHAUSTED");
		assertThat(event.getMessage().getFormattedMessage()).endsWith("Error: custom (quota exceeded)");
	}

	@Test
	void reportNotRetriable_logsAtDebug() {
		reporter.reportNotRetriable("op", RequestError.badStatus(404), 1);

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
		assertThat(event.getMarker().getName()).isEqualTo("NOT_RETRIABLE");
	}

	@Test
	void reportSuspended_logsAtInfoWithSuspendedMarker() {
		reporter.reportSuspended("op", RequestError.badStatus(401), 1);

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMarker().getName()).isEqualTo("SUSPENDED");
	}

	private static final class CapturingAppender extends AbstractAppender {

		private final List<LogEvent> events = new CopyOnWriteArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
