package works.abcedit.cst.exceptions;

public sealed abstract class AbcException extends RuntimeException permits AbcFormatException, AbcProcessingException {
	protected AbcException(String message) {
		super(message);
	}

	protected AbcException(Throwable cause) {
		super(cause);
	}

	protected AbcException(String message, Throwable cause) {
		super(message, cause);
	}
}
