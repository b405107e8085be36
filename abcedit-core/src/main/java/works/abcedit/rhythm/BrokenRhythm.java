package works.abcedit.rhythm;

/**
 * The duration multipliers implied by {@code >} and {@code <} markers.
 * <p>
 * With <code>n</code> markers, {@code >} lengthens the first note by
 * <code>(2^(n+1) - 1) / 2^n</code> and shortens the second to <code>1 / 2^n</code>,
 * so the pair keeps its total length. {@code <} is the mirror image.
 */
public record BrokenRhythm(Rational first, Rational second) {
	public static final BrokenRhythm NONE = new BrokenRhythm(Rational.ONE, Rational.ONE);

	/**
	 * @param marker a run of one repeated character, {@code >} or {@code <}
	 */
	public static BrokenRhythm of(String marker) {
		if (marker.isEmpty()) {
			return NONE;
		}
		int n = Math.min(marker.length(), 30);
		long power = 1L << n;
		Rational longer = Rational.of(2 * power - 1, power);
		Rational shorter = Rational.of(1, power);
		if (marker.charAt(0) == '<') {
			return new BrokenRhythm(shorter, longer);
		} else {
			return new BrokenRhythm(longer, shorter);
		}
	}
}
