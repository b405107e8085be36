package works.abcedit.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.abcedit.cst.DocumentContext;
import works.abcedit.logback.DocumentLogFilter.LogController;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.abcedit.logging.MdcKeys.DOCUMENT_INSTANCE_ID;
import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

class DocumentLogFilterTest {
	final LoggerContext loggerContext = new LoggerContext();
	final Logger logger = loggerContext.getLogger("works.abcedit.SomeClass");
	final DocumentLogFilter filter = new DocumentLogFilter();
	final DocumentContext quiet = DocumentContext.builder().name("quiet").build();
	final DocumentContext noisy = DocumentContext.builder().name("noisy").build();

	@AfterEach
	void unregister() {
		DocumentLogFilter.unregister(quiet);
		DocumentLogFilter.unregister(noisy);
	}

	@Test
	void overrideAppliesOnlyToItsDocument() {
		LogController controller = new LogController();
		controller.setLogging(Level.WARN, "works.abcedit.SomeClass");
		DocumentLogFilter.register(quiet, controller);

		try (MDCScope ignored = setupMDC(quiet)) {
			assertEquals(DENY, decide(Level.WARN));
			assertEquals(DENY, decide(Level.INFO));
			assertEquals(NEUTRAL, decide(Level.ERROR));
		}
		try (MDCScope ignored = setupMDC(noisy)) {
			assertEquals(NEUTRAL, decide(Level.WARN));
		}
		assertEquals(NEUTRAL, decide(Level.WARN), "No document in the MDC");
	}

	@Test
	void explicitLoggerLevelWins() {
		LogController controller = new LogController();
		controller.setLogging(Level.ERROR, DocumentLogFilterTest.class);
		DocumentLogFilter.register(quiet, controller);
		Logger configured = loggerContext.getLogger(DocumentLogFilterTest.class);
		configured.setLevel(Level.DEBUG);

		try (MDCScope ignored = setupMDC(quiet)) {
			assertEquals(NEUTRAL, filter.decide(null, configured, Level.WARN, "message", null, null));
		}
	}

	@Test
	void mdcScopesNest() {
		try (MDCScope outer = setupMDC(noisy)) {
			try (MDCScope inner = setupMDC(quiet, "legato")) {
				assertEquals(quiet.instanceID(), MDC.get(DOCUMENT_INSTANCE_ID));
			}
			assertEquals(noisy.instanceID(), MDC.get(DOCUMENT_INSTANCE_ID));
		}
	}

	private FilterReply decide(Level level) {
		return filter.decide(null, logger, level, "message", null, null);
	}
}
