package works.abcedit.selectors;

/**
 * How {@link FanOut} treats the notes inside chords.
 */
public enum WalkStrategy {
	/**
	 * Every matching node in scope, chord members included.
	 */
	ALL,

	/**
	 * Never looks inside a chord.
	 */
	SKIP_CHORD_CHILDREN,

	/**
	 * Only matching nodes whose parent is a chord.
	 */
	ONLY_CHORD_NOTES,
}
