package works.abcedit.selectors;

import java.util.EnumSet;
import java.util.Set;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static works.abcedit.selectors.FanOut.fanOutByPredicate;
import static works.abcedit.selectors.WalkStrategy.ALL;
import static works.abcedit.selectors.WalkStrategy.ONLY_CHORD_NOTES;
import static works.abcedit.selectors.WalkStrategy.SKIP_CHORD_CHILDREN;

/**
 * Selectors that pick nodes by kind, one singleton cursor per match.
 * <p>
 * Scope reaches down but never up: <code>selectNotes(selectChords(s))</code> gives the notes
 * inside the chords, while <code>selectChords(selectNotes(s))</code> gives nothing.
 */
public final class TypeSelectors {
	private TypeSelectors() { }

	private static final Set<Tag> RHYTHM_PARENTS = EnumSet.of(Tag.Note, Tag.Chord, Tag.Rest, Tag.YSPACER);

	public static Selection selectNotes(Selection input) {
		return fanOutByPredicate(input, n -> n.is(Tag.Note), ALL);
	}

	public static Selection selectChords(Selection input) {
		return fanOutByPredicate(input, n -> n.is(Tag.Chord), ALL);
	}

	public static Selection selectNonChordNotes(Selection input) {
		return fanOutByPredicate(input, n -> n.is(Tag.Note), SKIP_CHORD_CHILDREN);
	}

	public static Selection selectChordNotes(Selection input) {
		return fanOutByPredicate(input, n -> n.is(Tag.Note), ONLY_CHORD_NOTES);
	}

	/**
	 * Includes multi-measure rests.
	 */
	public static Selection selectRests(Selection input) {
		return fanOutByPredicate(input, n -> n.is(Tag.Rest) || n.is(Tag.MultiMeasureRest), ALL);
	}

	/**
	 * The {@link Tag#Rhythm} nodes themselves.
	 */
	public static Selection selectRhythm(Selection input) {
		return fanOutByPredicate(input, n -> n.is(Tag.Rhythm), ALL);
	}

	/**
	 * Notes, chords, rests and spacers that carry an explicit rhythm.
	 */
	public static Selection selectRhythmParent(Selection input) {
		return fanOutByPredicate(input, TypeSelectors::isRhythmParent, ALL);
	}

	private static boolean isRhythmParent(CstNode node) {
		if (!RHYTHM_PARENTS.contains(node.tag())) {
			return false;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Rhythm)) {
				return true;
			}
		}
		return false;
	}
}
