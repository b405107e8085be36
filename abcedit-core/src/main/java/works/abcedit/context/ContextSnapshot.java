package works.abcedit.context;

import works.abcedit.rhythm.Rational;

import static java.util.Objects.requireNonNull;

/**
 * The musical context in effect from some position onward.
 *
 * @param key the key as written, like {@code "Gm"}; empty when none was given
 * @param meter the length of one measure, in whole notes
 * @param noteLength the unit note length ({@code L:})
 */
public record ContextSnapshot(String key, Rational meter, Rational noteLength, Clef clef) {
	public static final ContextSnapshot DEFAULT = new ContextSnapshot("", Rational.ONE, Rational.of(1, 8), Clef.TREBLE);

	public ContextSnapshot {
		requireNonNull(key);
		requireNonNull(meter);
		requireNonNull(noteLength);
		requireNonNull(clef);
	}

	public ContextSnapshot withKey(String key) {
		return new ContextSnapshot(key, meter, noteLength, clef);
	}

	public ContextSnapshot withMeter(Rational meter) {
		return new ContextSnapshot(key, meter, noteLength, clef);
	}

	public ContextSnapshot withNoteLength(Rational noteLength) {
		return new ContextSnapshot(key, meter, noteLength, clef);
	}

	public ContextSnapshot withClef(Clef clef) {
		return new ContextSnapshot(key, meter, noteLength, clef);
	}
}
