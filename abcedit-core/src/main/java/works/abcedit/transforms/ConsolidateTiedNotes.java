package works.abcedit.transforms;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.rhythm.Rational;
import works.abcedit.rhythm.RhythmCodec;
import works.abcedit.rhythm.RhythmTransforms;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;
import static works.abcedit.selectors.VoiceMarkers.isVoiceMarker;
import static works.abcedit.transforms.Consolidation.hasTie;
import static works.abcedit.transforms.Consolidation.nextMeaningfulSibling;

/**
 * Merges a tied note into the next one when they have the same pitch and
 * length and the sum can be written without a tie: <code>C-C</code> becomes <code>C2</code>.
 * <p>
 * Works within each bar of each cursor and repeats until nothing changes.
 * The merged note is tied onward only if the absorbed note was.
 */
public final class ConsolidateTiedNotes {
	private ConsolidateTiedNotes() { }

	/**
	 * @return the input's cursors without the absorbed notes
	 */
	public static Selection consolidateTiedNotes(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "consolidateTiedNotes")) {
			Set<Long> consumed = new HashSet<>();
			for (PSet<Long> cursor : input.cursors()) {
				consolidate(input.root(), ctx, SelectedNodes.expandContainers(input.root(), cursor), consumed);
			}
			LOGGER.debug("Absorbed {} tied notes", consumed.size());
			return input.withCursors(input.cursors().stream()
				.map(c -> c.minusAll(consumed))
				.toList());
		}
	}

	/**
	 * @param selected the ids to work on; absorbed ids are removed from it
	 * @param consumed receives the ids of absorbed notes
	 */
	static void consolidate(CstNode root, DocumentContext ctx, Set<Long> selected, Set<Long> consumed) {
		List<CstNode> nodes = SelectedNodes.inCursor(root, selected, n -> true);
		for (List<CstNode> bar : Consolidation.splitAtBarLines(nodes)) {
			boolean changed = true;
			while (changed) {
				changed = consolidateBar(root, ctx, bar, selected, consumed);
			}
		}
	}

	private static boolean consolidateBar(CstNode root, DocumentContext ctx, List<CstNode> bar, Set<Long> selected, Set<Long> consumed) {
		boolean changed = false;
		for (CstNode node : bar) {
			if (consumed.contains(node.id()) || !(node.is(Tag.Note) || node.is(Tag.Chord)) || !hasTie(node)) {
				continue;
			}
			CstNode next = nextMeaningfulSibling(node);
			if (next == null || next.is(Tag.BarLine) || isVoiceMarker(next) || !samePitches(node, next)) {
				continue;
			}
			Rational first = RhythmCodec.writtenRhythm(node);
			Rational second = RhythmCodec.writtenRhythm(next);
			if (!first.equals(second)) {
				continue;
			}
			Rational sum = first.add(second);
			if (!sum.isPowerOfTwo()) {
				continue;
			}
			RhythmTransforms.setNodeRhythm(ctx, node, sum);
			if (!hasTie(next)) {
				Consolidation.removeTie(node);
			}
			TreeEdits.ParentRef ref = TreeEdits.findParent(root, next);
			if (ref != null) {
				TreeEdits.removeChild(ref.parent(), ref.prev(), next);
			}
			consumed.add(next.id());
			selected.remove(next.id());
			changed = true;
		}
		return changed;
	}

	private static boolean samePitches(CstNode a, CstNode b) {
		if (a.is(Tag.Note) && b.is(Tag.Note)) {
			String pa = Consolidation.pitchText(a);
			return pa != null && Objects.equals(pa, Consolidation.pitchText(b));
		} else if (a.is(Tag.Chord) && b.is(Tag.Chord)) {
			return Consolidation.chordPitchTexts(a).equals(Consolidation.chordPitchTexts(b));
		}
		return false;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConsolidateTiedNotes.class);
}
