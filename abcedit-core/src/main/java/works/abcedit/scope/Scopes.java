package works.abcedit.scope;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.walk.TreeWalk;

/**
 * Helpers for deciding which nodes a structural selector may consider.
 * <p>
 * A selection's scope is the union of its cursors. A selection with no
 * meaningful scope (no cursors, or just the root) means the whole document.
 */
public final class Scopes {
	private Scopes() { }

	public static Set<Long> collectCursorIds(Iterable<? extends Set<Long>> cursors) {
		Set<Long> result = new HashSet<>();
		for (Set<Long> c : cursors) {
			result.addAll(c);
		}
		return result;
	}

	/**
	 * @return true unless the selection is empty or its only cursor is just the root
	 */
	public static boolean hasMeaningfulScope(Selection selection) {
		if (selection.cursors().isEmpty()) {
			return false;
		}
		if (selection.cursors().size() == 1) {
			Set<Long> only = selection.cursor(0);
			return !(only.size() == 1 && only.contains(selection.root().id()));
		}
		return true;
	}

	/**
	 * @return <code>ids</code> plus the ids of every descendant of the nodes they name
	 */
	public static Set<Long> expandScopeToDescendants(CstNode root, Set<Long> ids) {
		Set<Long> result = new HashSet<>(ids);
		Map<Long, CstNode> index = TreeWalk.buildIdIndex(root);
		for (Long id : ids) {
			CstNode node = index.get(id);
			if (node != null) {
				collectDescendantIds(node, result);
			}
		}
		return result;
	}

	/**
	 * Adds the ids of <code>node</code> and everything below it to <code>into</code>.
	 */
	public static void collectDescendantIds(CstNode node, Set<Long> into) {
		into.add(node.id());
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			collectDescendantIds(c, into);
		}
	}

	public static boolean hasDescendantInScope(CstNode node, Set<Long> ids) {
		if (ids.contains(node.id())) {
			return true;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			if (hasDescendantInScope(c, ids)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param hasScope false means everything is in scope
	 */
	public static boolean isInScope(CstNode node, Set<Long> ids, boolean hasScope) {
		return !hasScope || ids.contains(node.id());
	}
}
