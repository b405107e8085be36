package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.scope.Scopes;
import works.abcedit.walk.TreeWalk;

/**
 * Resolves cursor ids to nodes, in document order.
 */
public final class SelectedNodes {
	private SelectedNodes() { }

	/**
	 * @return every node named by any cursor of <code>selection</code> and accepted by <code>filter</code>, each once
	 */
	public static List<CstNode> all(Selection selection, Predicate<CstNode> filter) {
		return inCursor(selection.root(), Scopes.collectCursorIds(selection.cursors()), filter);
	}

	public static List<CstNode> inCursor(CstNode root, Set<Long> cursor, Predicate<CstNode> filter) {
		List<CstNode> result = new ArrayList<>();
		if (cursor.isEmpty()) {
			return result;
		}
		TreeWalk.forEach(root, n -> {
			if (cursor.contains(n.id()) && filter.test(n)) {
				result.add(n);
			}
		});
		return result;
	}

	/**
	 * Nodes that group music without being music themselves.
	 */
	static final Set<Tag> CONTAINERS = EnumSet.of(
		Tag.File_structure, Tag.Tune, Tag.Tune_header, Tag.Tune_Body, Tag.System, Tag.Music_code, Tag.Beam);

	/**
	 * Adds the content of every selected container, so that selecting a tune
	 * or a beam selects the notes in it. Elements like chords aren't opened up.
	 *
	 * @return a new mutable set
	 */
	public static Set<Long> expandContainers(CstNode root, Set<Long> cursor) {
		Set<Long> result = new HashSet<>(cursor);
		expand(root, false, result);
		return result;
	}

	private static void expand(CstNode node, boolean inherited, Set<Long> into) {
		boolean selected = inherited || into.contains(node.id());
		if (selected) {
			into.add(node.id());
		}
		if (CONTAINERS.contains(node.tag())) {
			for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
				expand(c, selected, into);
			}
		}
	}
}
