package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.rhythm.RhythmCodec;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;
import static works.abcedit.selectors.VoiceMarkers.isVoiceMarker;

/**
 * Fills the gaps in a melody by replacing each selected rest or y-spacer
 * with a tied copy of the note or chord before it, so <code>C z D</code>
 * becomes <code>C2 D</code>.
 * <p>
 * Barlines don't break the chain, but voice markers and multi-measure rests do.
 * After the replacement, tied notes are merged within each bar
 * (see {@link ConsolidateTiedNotes}) and the tie on the last selected note is dropped.
 */
public final class Legato {
	private Legato() { }

	/**
	 * @return the input's cursors with each replaced rest's id swapped for its copy's,
	 * and without the ids of notes absorbed during merging
	 */
	public static Selection legato(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "legato")) {
			CstNode root = input.root();
			Map<Long, Long> replaced = new HashMap<>();
			Set<Long> consumed = new HashSet<>();
			List<Set<Long>> working = new ArrayList<>();
			for (PSet<Long> cursor : input.cursors()) {
				Set<Long> selected = SelectedNodes.expandContainers(root, cursor);
				new Filler(ctx, selected, replaced).fill(root);
				working.add(selected);
			}
			for (Set<Long> selected : working) {
				ConsolidateTiedNotes.consolidate(root, ctx, selected, consumed);
			}
			for (Set<Long> selected : working) {
				removeTrailingTie(root, selected);
			}
			LOGGER.debug("Filled {} rests, absorbed {} notes", replaced.size(), consumed.size());
			List<PSet<Long>> result = new ArrayList<>();
			for (PSet<Long> cursor : input.cursors()) {
				PSet<Long> updated = cursor;
				for (Long id : cursor) {
					Long replacement = replaced.get(id);
					if (replacement != null) {
						updated = updated.minus(id).plus(replacement);
					}
				}
				result.add(updated.minusAll(consumed));
			}
			return input.withCursors(result);
		}
	}

	private static final class Filler {
		final DocumentContext ctx;
		final Set<Long> selected;
		final Map<Long, Long> replaced;
		@Nullable CstNode source = null;

		Filler(DocumentContext ctx, Set<Long> selected, Map<Long, Long> replaced) {
			this.ctx = ctx;
			this.selected = selected;
			this.replaced = replaced;
		}

		void fill(CstNode parent) {
			CstNode prev = null;
			CstNode c = parent.firstChild();
			while (c != null) {
				CstNode next = c.nextSibling();
				CstNode current = visit(parent, prev, c);
				prev = current;
				c = next;
			}
		}

		/**
		 * @return the node now occupying <code>node</code>'s position
		 */
		private CstNode visit(CstNode parent, @Nullable CstNode prev, CstNode node) {
			if (selected.contains(node.id())) {
				if (isVoiceMarker(node) || node.is(Tag.MultiMeasureRest)) {
					source = null;
					return node;
				} else if (node.is(Tag.Note) || node.is(Tag.Chord)) {
					source = node;
					return node;
				} else if ((node.is(Tag.Rest) || node.is(Tag.YSPACER)) && source != null) {
					CstNode copy = TreeEdits.cloneWithFreshIds(source, ctx);
					TreeEdits.replaceRhythm(copy, RhythmCodec.rationalToRhythm(ctx, RhythmCodec.writtenRhythm(node), null));
					Consolidation.addTie(source, ctx);
					TreeEdits.replaceChild(parent, prev, node, copy);
					selected.remove(node.id());
					selected.add(copy.id());
					replaced.put(node.id(), copy.id());
					source = copy;
					return copy;
				}
			}
			fill(node);
			return node;
		}
	}

	private static void removeTrailingTie(CstNode root, Set<Long> selected) {
		List<CstNode> notes = SelectedNodes.inCursor(root, selected, n -> n.is(Tag.Note) || n.is(Tag.Chord));
		if (!notes.isEmpty()) {
			Consolidation.removeTie(notes.get(notes.size() - 1));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Legato.class);
}
