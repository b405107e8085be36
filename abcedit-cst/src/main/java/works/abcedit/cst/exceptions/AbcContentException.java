package works.abcedit.cst.exceptions;

/**
 * The input is lexically valid but a field value can't be interpreted,
 * like an {@code M:} line that isn't a meter.
 */
public final class AbcContentException extends AbcFormatException {
	public AbcContentException(String message) {
		super(message);
	}

	public AbcContentException(Throwable cause) {
		super(cause);
	}

	public AbcContentException(String message, Throwable cause) {
		super(message, cause);
	}
}
