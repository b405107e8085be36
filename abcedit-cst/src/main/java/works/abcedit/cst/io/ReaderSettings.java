package works.abcedit.cst.io;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ReaderSettings {
	public static final ReaderSettings DEFAULT = ReaderSettings.builder().build();

	/**
	 * When true, unrecognized input throws
	 * {@link works.abcedit.cst.exceptions.AbcSyntaxException AbcSyntaxException}.
	 * When false, it becomes an {@code ErrorExpr} node so the text still round-trips.
	 */
	@Default boolean strict = false;

	/**
	 * Whether lenient reading logs each {@code ErrorExpr} it produces.
	 */
	@Default boolean warnOnErrors = true;
}
