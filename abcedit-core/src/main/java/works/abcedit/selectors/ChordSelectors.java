package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import org.pcollections.PSet;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.scope.Scopes;

/**
 * Selects notes within chords by their pitch order.
 * <p>
 * A chord is considered when a cursor names it, one of its notes,
 * or anything containing it. Each chord is considered once per cursor.
 */
public final class ChordSelectors {
	private ChordSelectors() { }

	/**
	 * Lowest first. Notes at the same pitch keep their written order.
	 */
	static final Comparator<CstNode> BY_PITCH = Comparator.comparingInt(ChordSelectors::pitchKey);

	public static Selection selectTop(Selection input) {
		return selectNthFromTop(input, 0);
	}

	public static Selection selectBottom(Selection input) {
		return perChord(input, (notes, out) -> out.add(Selection.singletonCursor(notes.get(0).id())));
	}

	/**
	 * @param n zero-based; chords with fewer than <code>n + 1</code> notes contribute nothing
	 */
	public static Selection selectNthFromTop(Selection input, int n) {
		if (n < 0) {
			throw new IllegalArgumentException("n must not be negative: " + n);
		}
		return perChord(input, (notes, out) -> {
			int index = notes.size() - 1 - n;
			if (index >= 0) {
				out.add(Selection.singletonCursor(notes.get(index).id()));
			}
		});
	}

	public static Selection selectAllButTop(Selection input) {
		return perChord(input, (notes, out) -> {
			for (CstNode note : notes.subList(0, notes.size() - 1)) {
				out.add(Selection.singletonCursor(note.id()));
			}
		});
	}

	public static Selection selectAllButBottom(Selection input) {
		return perChord(input, (notes, out) -> {
			for (CstNode note : notes.subList(1, notes.size())) {
				out.add(Selection.singletonCursor(note.id()));
			}
		});
	}

	/**
	 * @param action receives each chord's notes sorted lowest first, never empty
	 */
	private static Selection perChord(Selection input, BiConsumer<List<CstNode>, List<PSet<Long>>> action) {
		List<PSet<Long>> result = new ArrayList<>();
		for (PSet<Long> cursor : input.cursors()) {
			walk(input.root(), cursor, false, action, result);
		}
		return input.withCursors(result);
	}

	private static void walk(CstNode node, Set<Long> cursor, boolean inScope, BiConsumer<List<CstNode>, List<PSet<Long>>> action, List<PSet<Long>> out) {
		boolean nowInScope = inScope || cursor.contains(node.id());
		if (node.is(Tag.Chord)) {
			if (nowInScope || Scopes.hasDescendantInScope(node, cursor)) {
				List<CstNode> notes = new ArrayList<>();
				for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
					if (c.is(Tag.Note)) {
						notes.add(c);
					}
				}
				if (!notes.isEmpty()) {
					notes.sort(BY_PITCH);
					action.accept(notes, out);
				}
			}
			return;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			walk(c, cursor, nowInScope, action, out);
		}
	}

	/**
	 * Orders pitches by staff position, then accidental.
	 * Each diatonic step is worth 5 so accidentals of up to two semitones
	 * can't overtake a neighbouring letter.
	 */
	static int pitchKey(CstNode note) {
		CstNode pitch = null;
		for (CstNode c = note.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Pitch)) {
				pitch = c;
				break;
			}
		}
		if (pitch == null) {
			return 0;
		}
		int step = 0;
		int accidental = 0;
		for (CstNode t = pitch.firstChild(); t != null; t = t.nextSibling()) {
			String lexeme = t.lexeme();
			if (lexeme == null) {
				continue;
			}
			if (t.isToken(TokenType.NOTE_LETTER)) {
				char letter = lexeme.charAt(0);
				step += "CDEFGAB".indexOf(Character.toUpperCase(letter));
				if (Character.isLowerCase(letter)) {
					step += 7;
				}
			} else if (t.isToken(TokenType.OCTAVE)) {
				for (char c : lexeme.toCharArray()) {
					step += c == '\'' ? 7 : -7;
				}
			} else if (t.isToken(TokenType.ACCIDENTAL)) {
				for (char c : lexeme.toCharArray()) {
					accidental += c == '^' ? 1 : c == '_' ? -1 : 0;
				}
			}
		}
		return step * 5 + accidental;
	}
}
