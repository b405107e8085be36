package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.scope.Scopes;
import works.abcedit.walk.TreeWalk;

import static works.abcedit.selectors.VoiceMarkers.isInlineVoiceMarker;

/**
 * Selectors that group tune content by measure.
 */
public final class MeasureSelectors {
	private MeasureSelectors() { }

	static final Set<Tag> MUSIC_ELEMENTS = EnumSet.of(
		Tag.Note, Tag.Chord, Tag.Rest, Tag.Beam, Tag.Grace_group, Tag.MultiMeasureRest, Tag.Tuplet);

	/**
	 * One cursor per run of music elements between measure boundaries.
	 * Barlines, inline voice markers and line ends are boundaries.
	 * Elements outside the scope are skipped without ending the run.
	 *
	 * @return <code>input</code> itself if no music element is in scope
	 */
	public static Selection selectMeasures(Selection input) {
		boolean hasScope = Scopes.hasMeaningfulScope(input);
		Set<Long> scope = hasScope
			? Scopes.expandScopeToDescendants(input.root(), Scopes.collectCursorIds(input.cursors()))
			: Set.of();
		Grouping grouping = new Grouping(scope, hasScope);
		for (CstNode body : TreeWalk.findByTag(input.root(), Tag.Tune_Body)) {
			grouping.walk(body);
			grouping.flush();
		}
		if (!grouping.matchedAny) {
			LOGGER.debug("No music elements in scope");
			return input;
		}
		return input.withCursors(grouping.cursors);
	}

	private static final class Grouping {
		final Set<Long> scope;
		final boolean hasScope;
		final List<PSet<Long>> cursors = new ArrayList<>();
		final List<Long> run = new ArrayList<>();
		boolean matchedAny = false;

		Grouping(Set<Long> scope, boolean hasScope) {
			this.scope = scope;
			this.hasScope = hasScope;
		}

		void walk(CstNode container) {
			for (CstNode c = container.firstChild(); c != null; c = c.nextSibling()) {
				if (c.is(Tag.System)) {
					walk(c);
					flush();
				} else if (c.is(Tag.Music_code)) {
					walk(c);
				} else if (c.is(Tag.BarLine) || isInlineVoiceMarker(c)) {
					flush();
				} else if (MUSIC_ELEMENTS.contains(c.tag()) && Scopes.isInScope(c, scope, hasScope)) {
					run.add(c.id());
					matchedAny = true;
				}
			}
		}

		void flush() {
			if (!run.isEmpty()) {
				cursors.add(Selection.cursorOf(run));
				run.clear();
			}
		}
	}

	/**
	 * One singleton cursor for each note or chord in measures <code>start</code>
	 * through <code>end</code> of every tune, counting from 1.
	 * Grace notes count; the notes inside a chord don't get their own cursors.
	 */
	public static Selection selectMeasureRange(Selection input, int start, int end) {
		if (start < 1) {
			throw new IllegalArgumentException("Invalid start measure: " + start + ". Must be a positive integer.");
		}
		if (end < 1) {
			throw new IllegalArgumentException("Invalid end measure: " + end + ". Must be a positive integer.");
		}
		if (start > end) {
			throw new IllegalArgumentException("Invalid measure range: start (" + start + ") must be <= end (" + end + ")");
		}
		boolean hasScope = Scopes.hasMeaningfulScope(input);
		Set<Long> scope = hasScope
			? Scopes.expandScopeToDescendants(input.root(), Scopes.collectCursorIds(input.cursors()))
			: Set.of();
		List<PSet<Long>> result = new ArrayList<>();
		for (CstNode body : TreeWalk.findByTag(input.root(), Tag.Tune_Body)) {
			int[] measure = {1};
			collectRange(body, start, end, measure, scope, hasScope, result);
		}
		return input.withCursors(result);
	}

	private static void collectRange(CstNode container, int start, int end, int[] measure, Set<Long> scope, boolean hasScope, List<PSet<Long>> out) {
		for (CstNode c = container.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.BarLine)) {
				measure[0]++;
			} else if (c.is(Tag.System) || c.is(Tag.Music_code)) {
				collectRange(c, start, end, measure, scope, hasScope, out);
			} else if (measure[0] >= start && measure[0] <= end) {
				collectNotesAndChords(c, scope, hasScope, out);
			}
		}
	}

	private static void collectNotesAndChords(CstNode node, Set<Long> scope, boolean hasScope, List<PSet<Long>> out) {
		if (node.is(Tag.Note) || node.is(Tag.Chord)) {
			if (Scopes.isInScope(node, scope, hasScope)) {
				out.add(Selection.singletonCursor(node.id()));
			}
		} else if (node.is(Tag.Beam) || node.is(Tag.Grace_group)) {
			for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
				collectNotesAndChords(c, scope, hasScope, out);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MeasureSelectors.class);
}
