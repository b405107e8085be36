package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.pcollections.PSet;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.scope.Scopes;
import works.abcedit.walk.TreeWalk;

/**
 * Widens a selection to whole tunes.
 */
public final class TuneSelector {
	private TuneSelector() { }

	/**
	 * Without a meaningful scope, returns one cursor per tune in the document.
	 * Otherwise returns one cursor per tune that contains any selected node,
	 * in document order. Each cursor holds just the tune's id.
	 */
	public static Selection selectTune(Selection input) {
		CstNode root = input.root();
		List<PSet<Long>> result = new ArrayList<>();
		if (!Scopes.hasMeaningfulScope(input)) {
			for (CstNode tune : TreeWalk.findByTag(root, Tag.Tune)) {
				result.add(Selection.singletonCursor(tune.id()));
			}
		} else {
			Set<Long> ids = Scopes.collectCursorIds(input.cursors());
			collectTunes(root, ids, result);
		}
		return input.withCursors(result);
	}

	private static void collectTunes(CstNode node, Set<Long> ids, List<PSet<Long>> out) {
		if (node.is(Tag.Tune)) {
			if (Scopes.hasDescendantInScope(node, ids)) {
				out.add(Selection.singletonCursor(node.id()));
			}
			return;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			collectTunes(c, ids, out);
		}
	}
}
