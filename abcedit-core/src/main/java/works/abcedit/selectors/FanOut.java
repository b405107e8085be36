package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

/**
 * Splits each cursor into one singleton cursor per matching node.
 * <p>
 * A node is in scope once the walk has passed through a node whose id is
 * in the cursor, so a cursor naming a measure's beam covers the notes inside it.
 */
public final class FanOut {
	private FanOut() { }

	public static Selection fanOutByPredicate(Selection input, Predicate<CstNode> predicate, WalkStrategy strategy) {
		List<PSet<Long>> result = new ArrayList<>();
		for (PSet<Long> cursor : input.cursors()) {
			walk(input.root(), cursor, false, false, predicate, strategy, result);
		}
		LOGGER.debug("Fan-out {} produced {} cursors from {}", strategy, result.size(), input.size());
		return input.withCursors(result);
	}

	private static void walk(
		CstNode node,
		Set<Long> cursor,
		boolean inScope,
		boolean parentIsChord,
		Predicate<CstNode> predicate,
		WalkStrategy strategy,
		List<PSet<Long>> out
	) {
		boolean nowInScope = inScope || cursor.contains(node.id());
		if (nowInScope && predicate.test(node)) {
			if (strategy != WalkStrategy.ONLY_CHORD_NOTES || parentIsChord) {
				out.add(Selection.singletonCursor(node.id()));
			}
		}
		boolean isChord = node.is(Tag.Chord);
		if (isChord && strategy == WalkStrategy.SKIP_CHORD_CHILDREN) {
			return;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			walk(c, cursor, nowInScope, isChord, predicate, strategy, out);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FanOut.class);
}
