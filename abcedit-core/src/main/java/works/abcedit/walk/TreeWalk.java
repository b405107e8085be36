package works.abcedit.walk;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.NodePayload.TokenData;
import works.abcedit.cst.Tag;

/**
 * Root-relative searches over a tree that has no parent pointers.
 * Everything here is depth-first, in document order.
 */
public final class TreeWalk {
	private TreeWalk() { }

	/**
	 * @return the leftmost token at or below <code>node</code>, or null if there is none
	 */
	public static @Nullable CstNode firstToken(CstNode node) {
		if (node.isToken()) {
			return node;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			CstNode result = firstToken(c);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	/**
	 * @return the rightmost token at or below <code>node</code>, or null if there is none
	 */
	public static @Nullable CstNode lastToken(CstNode node) {
		if (node.isToken()) {
			return node;
		}
		CstNode result = null;
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			CstNode candidate = lastToken(c);
			if (candidate != null) {
				result = candidate;
			}
		}
		return result;
	}

	/**
	 * Lexicographic comparison of (line, column) positions.
	 *
	 * @return negative, zero, or positive like {@link Comparable#compareTo}
	 */
	public static int comparePositions(int line1, int col1, int line2, int col2) {
		if (line1 != line2) {
			return Integer.compare(line1, line2);
		}
		return Integer.compare(col1, col2);
	}

	public static @Nullable CstNode findById(CstNode root, long id) {
		Deque<CstNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			CstNode node = stack.pop();
			if (node.id() == id) {
				return node;
			}
			if (node.nextSibling() != null && node != root) {
				stack.push(node.nextSibling());
			}
			if (node.firstChild() != null) {
				stack.push(node.firstChild());
			}
		}
		return null;
	}

	/**
	 * One full traversal, for callers that will look up many ids.
	 */
	public static Map<Long, CstNode> buildIdIndex(CstNode root) {
		Map<Long, CstNode> result = new HashMap<>();
		forEach(root, n -> result.put(n.id(), n));
		return result;
	}

	public static List<CstNode> findByTag(CstNode root, Tag tag) {
		List<CstNode> result = new ArrayList<>();
		forEach(root, n -> {
			if (n.is(tag)) {
				result.add(n);
			}
		});
		return result;
	}

	public static @Nullable CstNode findFirstByTag(CstNode root, Tag tag) {
		if (root.is(tag)) {
			return root;
		}
		for (CstNode c = root.firstChild(); c != null; c = c.nextSibling()) {
			CstNode result = findFirstByTag(c, tag);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	/**
	 * Finds the nearest node with the given tag that is the node with the given id
	 * or one of its ancestors. Done as a single traversal that keeps the current
	 * ancestor chain on a stack.
	 *
	 * @return null if the id isn't in the tree or no such ancestor exists
	 */
	public static @Nullable CstNode findAncestorByTag(CstNode root, long id, Tag tag) {
		CstNode[] result = {null};
		locate(root, id, tag, new ArrayDeque<>(), result);
		return result[0];
	}

	/**
	 * @return true once the id has been found, which stops the traversal
	 */
	private static boolean locate(CstNode node, long id, Tag tag, Deque<CstNode> ancestors, CstNode[] result) {
		ancestors.push(node);
		try {
			if (node.id() == id) {
				// Iteration starts at the top of the stack, which is the innermost node
				for (CstNode candidate : ancestors) {
					if (candidate.is(tag)) {
						result[0] = candidate;
						break;
					}
				}
				return true;
			}
			for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
				if (locate(c, id, tag, ancestors, result)) {
					return true;
				}
			}
			return false;
		} finally {
			ancestors.pop();
		}
	}

	/**
	 * Visits <code>root</code> and all its descendants, depth-first in document order.
	 */
	public static void forEach(CstNode root, Consumer<CstNode> action) {
		action.accept(root);
		for (CstNode c = root.firstChild(); c != null; c = c.nextSibling()) {
			forEach(c, action);
		}
	}

	public static int countNodes(CstNode root) {
		int[] count = {0};
		forEach(root, n -> count[0]++);
		return count[0];
	}

	public static List<CstNode> collectTokens(CstNode root) {
		List<CstNode> result = new ArrayList<>();
		forEach(root, n -> {
			if (n.isToken()) {
				result.add(n);
			}
		});
		return result;
	}

	/**
	 * @return the token's data if it has a real source position, else null
	 */
	public static @Nullable TokenData positioned(@Nullable CstNode token) {
		if (token == null) {
			return null;
		}
		TokenData t = token.token();
		if (t == null || t.isSynthetic()) {
			return null;
		}
		return t;
	}
}
