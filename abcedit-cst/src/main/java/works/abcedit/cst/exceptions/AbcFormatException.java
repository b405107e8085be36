package works.abcedit.cst.exceptions;

/**
 * The ABC input text is invalid.
 * <p>
 * Concrete so it can be thrown when the reader can't tell
 * whether the problem is lexical or structural.
 * Prefer one of the subclasses when you know which applies.
 */
public sealed class AbcFormatException extends AbcException permits
	AbcContentException,
	AbcSyntaxException
{
	public AbcFormatException(String message) {
		super(message);
	}

	public AbcFormatException(Throwable cause) {
		super(cause);
	}

	public AbcFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
