package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.walk.TreeWalk;

public final class SiblingSelector {
	private SiblingSelector() { }

	/**
	 * For each id in each cursor, walks the following siblings while
	 * <code>keepGoing</code> accepts them, one singleton cursor per sibling.
	 * Ids are visited in ascending order within a cursor. Whitespace and
	 * other bare tokens are siblings like any other.
	 */
	public static Selection selectSiblingsAfter(Selection input, Predicate<CstNode> keepGoing) {
		Map<Long, CstNode> index = TreeWalk.buildIdIndex(input.root());
		List<PSet<Long>> result = new ArrayList<>();
		for (PSet<Long> cursor : input.cursors()) {
			List<Long> ids = new ArrayList<>(cursor);
			ids.sort(null);
			for (long id : ids) {
				CstNode node = index.get(id);
				if (node == null) {
					continue;
				}
				for (CstNode s = node.nextSibling(); s != null && keepGoing.test(s); s = s.nextSibling()) {
					result.add(Selection.singletonCursor(s.id()));
				}
			}
		}
		LOGGER.debug("Sibling walk produced {} cursors from {}", result.size(), input.size());
		return input.withCursors(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SiblingSelector.class);
}
