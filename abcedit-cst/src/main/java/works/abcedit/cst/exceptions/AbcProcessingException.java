package works.abcedit.cst.exceptions;

/**
 * An internal invariant of the tree has been violated,
 * such as two reachable nodes sharing an id.
 * <p>
 * This does not indicate a problem with the input text.
 * Correct transforms never cause this to be thrown.
 */
public final class AbcProcessingException extends AbcException {
	public AbcProcessingException(String message) {
		super(message);
	}

	public AbcProcessingException(Throwable cause) {
		super(cause);
	}

	public AbcProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
