package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.pcollections.PSet;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.scope.Scopes;
import works.abcedit.walk.TreeWalk;

/**
 * Widens a selection to the whole lines (systems) it touches.
 */
public final class SystemSelector {
	private SystemSelector() { }

	/**
	 * One cursor per system with any selected content, holding every node
	 * of the system plus the info lines directly above it.
	 * Comments and line breaks between those info lines and the system are skipped over;
	 * anything else stops the search upward.
	 *
	 * @return <code>input</code> itself if it has no cursor ids or touches no system
	 */
	public static Selection selectSystem(Selection input) {
		Set<Long> rawScope = Scopes.collectCursorIds(input.cursors());
		if (rawScope.isEmpty()) {
			return input;
		}
		Set<Long> scope = Scopes.expandScopeToDescendants(input.root(), rawScope);

		List<PSet<Long>> result = new ArrayList<>();
		for (CstNode body : TreeWalk.findByTag(input.root(), Tag.Tune_Body)) {
			List<CstNode> preceding = new ArrayList<>();
			for (CstNode c = body.firstChild(); c != null; c = c.nextSibling()) {
				if (c.is(Tag.System) && Scopes.hasDescendantInScope(c, scope)) {
					Set<Long> cursor = new HashSet<>();
					for (CstNode info : precedingInfoLines(preceding)) {
						Scopes.collectDescendantIds(info, cursor);
					}
					Scopes.collectDescendantIds(c, cursor);
					result.add(Selection.cursorOf(cursor));
				}
				preceding.add(c);
			}
		}
		if (result.isEmpty()) {
			return input;
		}
		return input.withCursors(result);
	}

	/**
	 * @param siblings everything before the system, in document order
	 * @return the info lines that belong to the system, in document order
	 */
	private static List<CstNode> precedingInfoLines(List<CstNode> siblings) {
		List<CstNode> result = new ArrayList<>();
		for (int i = siblings.size() - 1; i >= 0; i--) {
			CstNode node = siblings.get(i);
			if (node.is(Tag.Comment) || node.isToken()) {
				continue;
			}
			if (node.is(Tag.Info_line)) {
				result.add(0, node);
			} else {
				break;
			}
		}
		return result;
	}
}
