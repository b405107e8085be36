package works.abcedit.context;

import java.util.Locale;
import java.util.Optional;

/**
 * The clefs that matter for choosing a middle-line pitch.
 * Octave variants like {@code treble-8} and line numbers like {@code alto1}
 * fold into their base clef.
 */
public enum Clef {
	TREBLE("B"),
	BASS("D"),
	ALTO("B"),
	TENOR("A,"),
	PERC("B"),
	NONE("B");

	private final String slashPitch;

	Clef(String slashPitch) {
		this.slashPitch = slashPitch;
	}

	/**
	 * @return the pitch, in ABC spelling, that slash notes use on this clef's staff
	 */
	public String slashPitch() {
		return slashPitch;
	}

	/**
	 * @param name a clef name as written after {@code clef=}, like {@code "bass"} or {@code "treble+8"}
	 */
	public static Optional<Clef> parse(String name) {
		String base = name.trim().toLowerCase(Locale.ROOT);
		int end = 0;
		while (end < base.length() && Character.isLetter(base.charAt(end))) {
			end++;
		}
		switch (base.substring(0, end)) {
			case "treble":
				return Optional.of(TREBLE);
			case "bass":
				return Optional.of(BASS);
			case "alto":
				return Optional.of(ALTO);
			case "tenor":
				return Optional.of(TENOR);
			case "perc":
				return Optional.of(PERC);
			case "none":
				return Optional.of(NONE);
			default:
				return Optional.empty();
		}
	}
}
