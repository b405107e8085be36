package works.abcedit.pitch;

import org.jetbrains.annotations.Nullable;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;

/**
 * A pitch as written, ignoring the key signature.
 * <p>
 * Octaves follow MIDI numbering: an uppercase letter is octave 4,
 * so {@code C} is MIDI 60 and {@code c} is 72.
 *
 * @param step diatonic index, 0 for C up to 6 for B
 * @param accidental one of {@code ^ ^^ _ __ =}, or null
 */
public record WrittenPitch(int step, int octave, @Nullable String accidental) {
	static final String LETTERS = "CDEFGAB";
	private static final int[] SEMITONES = {0, 2, 4, 5, 7, 9, 11};

	private static final WrittenPitch[] SHARP_SPELLINGS = spellings("C ^C D ^D E F ^F G ^G A ^A B");
	private static final WrittenPitch[] FLAT_SPELLINGS = spellings("C _D D _E E F _G G _A A _B B");

	/**
	 * @param pitch a {@link Tag#Pitch} node
	 * @return null if it has no note letter
	 */
	public static @Nullable WrittenPitch of(CstNode pitch) {
		int step = -1;
		int octave = 4;
		String accidental = null;
		for (CstNode t = pitch.firstChild(); t != null; t = t.nextSibling()) {
			String lexeme = t.lexeme();
			if (lexeme == null || lexeme.isEmpty()) {
				continue;
			}
			if (t.isToken(TokenType.NOTE_LETTER)) {
				char letter = lexeme.charAt(0);
				step = LETTERS.indexOf(Character.toUpperCase(letter));
				if (Character.isLowerCase(letter)) {
					octave++;
				}
			} else if (t.isToken(TokenType.OCTAVE)) {
				for (char c : lexeme.toCharArray()) {
					octave += c == '\'' ? 1 : -1;
				}
			} else if (t.isToken(TokenType.ACCIDENTAL)) {
				accidental = lexeme;
			}
		}
		return step < 0 ? null : new WrittenPitch(step, octave, accidental);
	}

	/**
	 * @param preferFlats spell black keys as flats rather than sharps
	 */
	public static WrittenPitch fromMidi(int midi, boolean preferFlats) {
		WrittenPitch spelling = (preferFlats ? FLAT_SPELLINGS : SHARP_SPELLINGS)[Math.floorMod(midi, 12)];
		return new WrittenPitch(spelling.step, Math.floorDiv(midi, 12) - 1, spelling.accidental);
	}

	public int alteration() {
		if (accidental == null) {
			return 0;
		}
		int result = 0;
		for (char c : accidental.toCharArray()) {
			result += c == '^' ? 1 : c == '_' ? -1 : 0;
		}
		return result;
	}

	public int midi() {
		return (octave + 1) * 12 + SEMITONES[step] + alteration();
	}

	/**
	 * Moves along the white keys, keeping the accidental.
	 */
	public WrittenPitch stepDiatonic(int steps) {
		int index = step + steps;
		return new WrittenPitch(Math.floorMod(index, 7), octave + Math.floorDiv(index, 7), accidental);
	}

	public WrittenPitch withAccidental(@Nullable String newAccidental) {
		return new WrittenPitch(step, octave, newAccidental);
	}

	/**
	 * @return the ABC text, like {@code "_B,"} or {@code "c'"}
	 */
	public String lexeme() {
		StringBuilder sb = new StringBuilder();
		if (accidental != null) {
			sb.append(accidental);
		}
		sb.append(letter());
		sb.append(octaveMarks());
		return sb.toString();
	}

	/**
	 * @return the children of a {@link Tag#Pitch} node spelling this pitch, as synthetic tokens
	 */
	public CstNode[] tokens(DocumentContext ctx) {
		String marks = octaveMarks();
		int count = 1 + (accidental == null ? 0 : 1) + (marks.isEmpty() ? 0 : 1);
		CstNode[] result = new CstNode[count];
		int i = 0;
		if (accidental != null) {
			result[i++] = CstNode.syntheticToken(ctx, TokenType.ACCIDENTAL, accidental);
		}
		result[i++] = CstNode.syntheticToken(ctx, TokenType.NOTE_LETTER, String.valueOf(letter()));
		if (!marks.isEmpty()) {
			result[i] = CstNode.syntheticToken(ctx, TokenType.OCTAVE, marks);
		}
		return result;
	}

	public CstNode toNode(DocumentContext ctx) {
		return CstNode.branch(ctx, Tag.Pitch, tokens(ctx));
	}

	private char letter() {
		char upper = LETTERS.charAt(step);
		return octave >= 5 ? Character.toLowerCase(upper) : upper;
	}

	private String octaveMarks() {
		if (octave >= 5) {
			return "'".repeat(octave - 5);
		} else {
			return ",".repeat(4 - octave);
		}
	}

	private static WrittenPitch[] spellings(String names) {
		String[] parts = names.split(" ");
		WrittenPitch[] result = new WrittenPitch[parts.length];
		for (int i = 0; i < parts.length; i++) {
			String name = parts[i];
			String accidental = name.length() > 1 ? name.substring(0, 1) : null;
			result[i] = new WrittenPitch(LETTERS.indexOf(name.charAt(name.length() - 1)), 4, accidental);
		}
		return result;
	}
}
