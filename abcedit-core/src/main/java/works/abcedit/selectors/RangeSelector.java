package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.pcollections.PSet;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.NodePayload.TokenData;
import works.abcedit.scope.Scopes;

import static works.abcedit.walk.TreeWalk.comparePositions;
import static works.abcedit.walk.TreeWalk.firstToken;
import static works.abcedit.walk.TreeWalk.lastToken;
import static works.abcedit.walk.TreeWalk.positioned;

/**
 * Selects the largest nodes lying inside a text range.
 */
public final class RangeSelector {
	private RangeSelector() { }

	/**
	 * The range runs from (<code>startLine</code>, <code>startCol</code>) inclusive
	 * to (<code>endLine</code>, <code>endCol</code>) exclusive, zero-based.
	 * <p>
	 * A node entirely inside the range is selected whole.
	 * A node partly inside is searched for smaller nodes that fit, and if none do,
	 * it's selected itself; that's how a range within a single token selects the token.
	 * Nodes whose edge tokens have no source position, like synthetic line ends,
	 * are looked through rather than measured.
	 *
	 * @return one singleton cursor per selected node, in document order
	 */
	public static Selection selectRange(Selection input, int startLine, int startCol, int endLine, int endCol) {
		List<PSet<Long>> result = new ArrayList<>();
		if (comparePositions(startLine, startCol, endLine, endCol) >= 0) {
			return input.withCursors(result);
		}
		boolean hasScope = Scopes.hasMeaningfulScope(input);
		Set<Long> scope = hasScope
			? Scopes.expandScopeToDescendants(input.root(), Scopes.collectCursorIds(input.cursors()))
			: Set.of();
		new Walker(startLine, startCol, endLine, endCol, scope, hasScope, result).visit(input.root());
		return input.withCursors(result);
	}

	private record Walker(
		int startLine, int startCol, int endLine, int endCol,
		Set<Long> scope, boolean hasScope,
		List<PSet<Long>> out
	) {
		/**
		 * @return true if anything at or below <code>node</code> was selected
		 */
		boolean visit(CstNode node) {
			TokenData first = positioned(firstToken(node));
			TokenData last = positioned(lastToken(node));
			if (first == null || last == null) {
				return visitChildren(node);
			}
			int lastEnd = last.column() + last.lexeme().length();
			boolean startsInside = comparePositions(first.line(), first.column(), startLine, startCol) >= 0;
			boolean endsInside = comparePositions(last.line(), lastEnd, endLine, endCol) <= 0;
			boolean inScope = Scopes.isInScope(node, scope, hasScope);
			if (startsInside && endsInside) {
				if (inScope) {
					out.add(Selection.singletonCursor(node.id()));
					return true;
				}
				return visitChildren(node);
			}
			boolean endsBefore = comparePositions(last.line(), lastEnd, startLine, startCol) <= 0;
			boolean startsAfter = comparePositions(first.line(), first.column(), endLine, endCol) >= 0;
			if (endsBefore || startsAfter) {
				return false;
			}
			boolean matchedChild = visitChildren(node);
			if (!matchedChild && inScope) {
				out.add(Selection.singletonCursor(node.id()));
				return true;
			}
			return matchedChild;
		}

		boolean visitChildren(CstNode node) {
			boolean any = false;
			for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
				any |= visit(c);
			}
			return any;
		}
	}
}
