package works.abcedit.transforms;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.rhythm.Rational;
import works.abcedit.rhythm.RhythmCodec;
import works.abcedit.rhythm.RhythmTransforms;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;
import static works.abcedit.selectors.VoiceMarkers.isVoiceMarker;
import static works.abcedit.transforms.Consolidation.nextMeaningfulSibling;

/**
 * Merges pairs of adjacent rests of the same kind and length when the sum is
 * a plain power of two: <code>z z</code> becomes <code>z2</code>, but
 * <code>z z z</code> only becomes <code>z2 z</code>.
 * <p>
 * Only the first rest of a pair needs to be selected.
 * Barlines and voice markers stop a merge. Repeats until nothing changes.
 */
public final class ConsolidateRests {
	private ConsolidateRests() { }

	/**
	 * @return the input's cursors without the absorbed rests
	 */
	public static Selection consolidateRests(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "consolidateRests")) {
			Set<Long> consumed = new HashSet<>();
			boolean changed = true;
			while (changed) {
				changed = false;
				for (PSet<Long> cursor : input.cursors()) {
					Set<Long> selected = SelectedNodes.expandContainers(input.root(), cursor);
					List<CstNode> rests = SelectedNodes.inCursor(input.root(), selected, n -> n.is(Tag.Rest));
					for (CstNode rest : rests) {
						if (!consumed.contains(rest.id()) && mergeWithNext(input.root(), ctx, rest, consumed)) {
							changed = true;
						}
					}
				}
			}
			LOGGER.debug("Absorbed {} rests", consumed.size());
			return input.withCursors(input.cursors().stream()
				.map(c -> c.minusAll(consumed))
				.toList());
		}
	}

	private static boolean mergeWithNext(CstNode root, DocumentContext ctx, CstNode rest, Set<Long> consumed) {
		String kind = restKind(rest);
		CstNode next = nextMeaningfulSibling(rest);
		if (kind == null || next == null || next.is(Tag.BarLine) || isVoiceMarker(next)) {
			return false;
		}
		if (!next.is(Tag.Rest) || !kind.equals(restKind(next))) {
			return false;
		}
		Rational first = RhythmCodec.writtenRhythm(rest);
		if (!first.equals(RhythmCodec.writtenRhythm(next))) {
			return false;
		}
		Rational sum = first.add(first);
		if (!sum.isPowerOfTwo()) {
			return false;
		}
		RhythmTransforms.setNodeRhythm(ctx, rest, sum);
		TreeEdits.ParentRef ref = TreeEdits.findParent(root, next);
		if (ref != null) {
			TreeEdits.removeChild(ref.parent(), ref.prev(), next);
		}
		consumed.add(next.id());
		return true;
	}

	/**
	 * @return {@code "z"} or {@code "x"}, or null if there's no rest token
	 */
	private static @Nullable String restKind(CstNode rest) {
		TreeEdits.ChildRef token = TreeEdits.findChildToken(rest, TokenType.REST);
		return token == null ? null : token.node().lexeme();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConsolidateRests.class);
}
