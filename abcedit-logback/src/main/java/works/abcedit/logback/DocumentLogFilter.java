package works.abcedit.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.abcedit.cst.DocumentContext;
import works.abcedit.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toMap;
import static works.abcedit.logging.MdcKeys.DOCUMENT_INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-document logging control.
 * Intended to suppress expected warnings during testing,
 * such as the reader complaining about deliberately malformed input.
 * <p>
 * A log message is associated with a document by the MDC key
 * {@link MdcKeys#DOCUMENT_INSTANCE_ID}, which
 * {@link works.abcedit.logging.MappedDiagnosticContext#setupMDC setupMDC} sets.
 * <p>
 * Precedence:
 * <ol>
 *     <li>
 *         a level configured on the specific logger is respected;
 *     </li>
 *     <li>
 *         otherwise, an override registered for the document via {@link #register} applies;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply.
 *     </li>
 * </ol>
 * Remember to add this filter to the logger context,
 * for example with {@code <turboFilter class="works.abcedit.logback.DocumentLogFilter"/>}.
 */
public class DocumentLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByDocumentID = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		/**
		 * Messages from the given loggers at or below <code>level</code> are dropped.
		 */
		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(identity(), n -> level)));
		}

		public void clear() {
			overrides.clear();
		}
	}

	/**
	 * Causes <code>controller</code> to control logs emitted while
	 * <code>document</code> is in the MDC.
	 */
	public static void register(DocumentContext document, LogController controller) {
		LOGGER.debug("Registering log controller {} for document {} \"{}\"", System.identityHashCode(controller), document.instanceID(), document.name());
		LogController old = controllersByDocumentID.put(document.instanceID(), controller);
		assert old == null || old == controller : "Must not register two log controllers for the same document: " + document;
	}

	public static void unregister(DocumentContext document) {
		controllersByDocumentID.remove(document.instanceID());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			return NEUTRAL;
		}
		String documentID = MDC.get(DOCUMENT_INSTANCE_ID);
		if (documentID == null) {
			return NEUTRAL;
		}
		LogController controller = controllersByDocumentID.get(documentID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}
		if (overrideLevel.isGreaterOrEqual(messageLevel)) {
			return DENY;
		} else {
			return NEUTRAL;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(DocumentLogFilter.class);
}
