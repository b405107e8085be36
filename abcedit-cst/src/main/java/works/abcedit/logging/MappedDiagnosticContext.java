package works.abcedit.logging;

import org.slf4j.MDC;
import works.abcedit.cst.DocumentContext;

import static works.abcedit.logging.MdcKeys.DOCUMENT_INSTANCE_ID;
import static works.abcedit.logging.MdcKeys.DOCUMENT_NAME;
import static works.abcedit.logging.MdcKeys.OPERATION;

/**
 * Puts a document's identity into the SLF4J {@link MDC}
 * so that log lines emitted while editing it can be correlated,
 * and so that {@code DocumentLogFilter} can apply per-document levels.
 */
public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	public static MDCScope setupMDC(DocumentContext ctx) {
		return setupMDC(ctx, null);
	}

	/**
	 * @param operation a short name for what's being done to the document, or null
	 */
	public static MDCScope setupMDC(DocumentContext ctx, String operation) {
		MDCScope result = new MDCScope();
		MDC.put(DOCUMENT_NAME, ctx.name());
		MDC.put(DOCUMENT_INSTANCE_ID, ctx.instanceID());
		if (operation != null) {
			MDC.put(OPERATION, operation);
		}
		return result;
	}

	/**
	 * Restores the MDC keys to the values they had when the scope was opened.
	 * Scopes nest as long as they are closed in reverse order.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String oldName = MDC.get(DOCUMENT_NAME);
		private final String oldInstanceID = MDC.get(DOCUMENT_INSTANCE_ID);
		private final String oldOperation = MDC.get(OPERATION);

		MDCScope() { }

		@Override
		public void close() {
			restore(DOCUMENT_NAME, oldName);
			restore(DOCUMENT_INSTANCE_ID, oldInstanceID);
			restore(OPERATION, oldOperation);
		}

		private static void restore(String key, String value) {
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}
	}
}
