package works.abcedit.cst.exceptions;

/**
 * The input text contains characters that are not valid ABC.
 */
public final class AbcSyntaxException extends AbcFormatException {
	public AbcSyntaxException(String message) {
		super(message);
	}

	public AbcSyntaxException(Throwable cause) {
		super(cause);
	}

	public AbcSyntaxException(String message, Throwable cause) {
		super(message, cause);
	}
}
