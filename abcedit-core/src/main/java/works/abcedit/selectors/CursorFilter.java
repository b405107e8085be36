package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.pcollections.PSet;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.walk.TreeWalk;

public final class CursorFilter {
	private CursorFilter() { }

	/**
	 * Keeps the cursors naming at least one node that satisfies <code>predicate</code>.
	 * Kept cursors are the same objects, in the same order; the root is unchanged.
	 * Ids no longer in the tree never match.
	 */
	public static Selection filter(Selection input, Predicate<CstNode> predicate) {
		Map<Long, CstNode> index = TreeWalk.buildIdIndex(input.root());
		List<PSet<Long>> kept = new ArrayList<>();
		for (PSet<Long> cursor : input.cursors()) {
			for (long id : cursor) {
				CstNode node = index.get(id);
				if (node != null && predicate.test(node)) {
					kept.add(cursor);
					break;
				}
			}
		}
		LOGGER.debug("Filter kept {} of {} cursors", kept.size(), input.size());
		return new Selection(input.root(), TreePVector.from(kept));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CursorFilter.class);
}
