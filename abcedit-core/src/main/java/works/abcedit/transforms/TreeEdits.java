package works.abcedit.transforms;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.cst.exceptions.AbcProcessingException;

/**
 * Child-list surgery on a tree without parent or previous-sibling links.
 * <p>
 * Most operations take the <code>prev</code> sibling of the node being edited,
 * or null when that node is the first child. Callers locate it beforehand,
 * and again after any edit that might have changed it.
 */
public final class TreeEdits {
	private TreeEdits() { }

	/**
	 * @param prev the sibling before <code>node</code>, or null if it is the first child
	 */
	public record ChildRef(CstNode node, @Nullable CstNode prev) { }

	/**
	 * @param prev the sibling before the located node, or null if it is the first child
	 */
	public record ParentRef(CstNode parent, @Nullable CstNode prev) { }

	/**
	 * Searches by identity, not by id.
	 *
	 * @return null if <code>target</code> is <code>root</code> or isn't in the tree
	 */
	public static @Nullable ParentRef findParent(CstNode root, CstNode target) {
		CstNode prev = null;
		for (CstNode c = root.firstChild(); c != null; c = c.nextSibling()) {
			if (c == target) {
				return new ParentRef(root, prev);
			}
			ParentRef result = findParent(c, target);
			if (result != null) {
				return result;
			}
			prev = c;
		}
		return null;
	}

	/**
	 * @return the child of <code>parent</code> just before <code>target</code>,
	 * or null if <code>target</code> is the first child or not a child at all
	 */
	public static @Nullable CstNode findPrev(CstNode parent, CstNode target) {
		CstNode prev = null;
		for (CstNode c = parent.firstChild(); c != null; c = c.nextSibling()) {
			if (c == target) {
				return prev;
			}
			prev = c;
		}
		return null;
	}

	public static @Nullable ChildRef findChildByTag(CstNode parent, Tag tag) {
		CstNode prev = null;
		for (CstNode c = parent.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(tag)) {
				return new ChildRef(c, prev);
			}
			prev = c;
		}
		return null;
	}

	public static @Nullable ChildRef findChildToken(CstNode parent, TokenType type) {
		CstNode prev = null;
		for (CstNode c = parent.firstChild(); c != null; c = c.nextSibling()) {
			if (c.isToken(type)) {
				return new ChildRef(c, prev);
			}
			prev = c;
		}
		return null;
	}

	public static @Nullable ChildRef findRhythmChild(CstNode parent) {
		return findChildByTag(parent, Tag.Rhythm);
	}

	public static @Nullable ChildRef findTieChild(CstNode parent) {
		return findChildToken(parent, TokenType.TIE);
	}

	public static void insertBefore(CstNode parent, @Nullable CstNode prev, CstNode before, CstNode node) {
		node.nextSibling(before);
		if (prev == null) {
			parent.firstChild(node);
		} else {
			prev.nextSibling(node);
		}
	}

	/**
	 * @param after null means prepend
	 */
	public static void insertAfter(CstNode parent, @Nullable CstNode after, CstNode node) {
		if (after == null) {
			node.nextSibling(parent.firstChild());
			parent.firstChild(node);
		} else {
			node.nextSibling(after.nextSibling());
			after.nextSibling(node);
		}
	}

	/**
	 * Unlike {@link CstNode#appendChild}, this detaches whatever
	 * followed <code>node</code> in its old position.
	 */
	public static void appendChild(CstNode parent, CstNode node) {
		node.nextSibling(null);
		parent.appendChild(node);
	}

	public static void removeChild(CstNode parent, @Nullable CstNode prev, CstNode child) {
		if (prev == null) {
			parent.firstChild(child.nextSibling());
		} else {
			prev.nextSibling(child.nextSibling());
		}
		child.nextSibling(null);
	}

	public static void replaceChild(CstNode parent, @Nullable CstNode prev, CstNode oldChild, CstNode newChild) {
		newChild.nextSibling(oldChild.nextSibling());
		if (prev == null) {
			parent.firstChild(newChild);
		} else {
			prev.nextSibling(newChild);
		}
		oldChild.nextSibling(null);
	}

	/**
	 * An empty list just removes <code>oldChild</code>.
	 * The list may include <code>oldChild</code> itself, to keep it alongside new siblings.
	 */
	public static void replaceWithSequence(CstNode parent, @Nullable CstNode prev, CstNode oldChild, List<CstNode> newChildren) {
		if (newChildren.isEmpty()) {
			removeChild(parent, prev, oldChild);
			return;
		}
		CstNode after = oldChild.nextSibling();
		oldChild.nextSibling(null);
		if (prev == null) {
			parent.firstChild(newChildren.get(0));
		} else {
			prev.nextSibling(newChildren.get(0));
		}
		for (int i = 0; i < newChildren.size() - 1; i++) {
			newChildren.get(i).nextSibling(newChildren.get(i + 1));
		}
		newChildren.get(newChildren.size() - 1).nextSibling(after);
	}

	/**
	 * Replaces the Rhythm child of <code>node</code>. With no existing Rhythm,
	 * the new one goes before the tie if there is one, else at the end.
	 *
	 * @param rhythm null removes the existing Rhythm
	 */
	public static void replaceRhythm(CstNode node, @Nullable CstNode rhythm) {
		ChildRef existing = findRhythmChild(node);
		if (existing != null) {
			if (rhythm == null) {
				removeChild(node, existing.prev(), existing.node());
			} else {
				replaceChild(node, existing.prev(), existing.node(), rhythm);
			}
			return;
		}
		if (rhythm == null) {
			return;
		}
		ChildRef tie = findTieChild(node);
		if (tie != null) {
			insertBefore(node, tie.prev(), tie.node(), rhythm);
		} else {
			appendChild(node, rhythm);
		}
	}

	/**
	 * Deep copy of <code>node</code> and its descendants, but not its siblings.
	 * Every copied node gets a fresh id from <code>ctx</code>.
	 */
	public static CstNode cloneWithFreshIds(CstNode node, DocumentContext ctx) {
		CstNode result = new CstNode(ctx.nextId(), node.tag(), node.payload());
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			result.appendChild(cloneWithFreshIds(c, ctx));
		}
		return result;
	}

	/**
	 * Deep copy that keeps the original ids. The result must get fresh ids
	 * from {@link #reassignIds} before it joins the tree.
	 */
	public static CstNode cloneKeepingIds(CstNode node) {
		CstNode result = new CstNode(node.id(), node.tag(), node.payload());
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			result.appendChild(cloneKeepingIds(c));
		}
		return result;
	}

	/**
	 * Gives <code>node</code> and all its descendants fresh ids.
	 */
	public static void reassignIds(CstNode node, DocumentContext ctx) {
		node.id(ctx.nextId());
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			reassignIds(c, ctx);
		}
	}

	/**
	 * @throws AbcProcessingException if two nodes share an id
	 */
	public static void checkUniqueIds(CstNode root) {
		checkUniqueIds(root, new HashSet<>());
	}

	private static void checkUniqueIds(CstNode node, Set<Long> seen) {
		if (!seen.add(node.id())) {
			throw new AbcProcessingException("Duplicate node id " + node.id() + " at " + node);
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			checkUniqueIds(c, seen);
		}
	}

	public static CstNode ws(DocumentContext ctx) {
		return CstNode.syntheticToken(ctx, TokenType.WS, " ");
	}

	public static CstNode eol(DocumentContext ctx) {
		return CstNode.syntheticToken(ctx, TokenType.EOL, "\n");
	}

	public static CstNode tie(DocumentContext ctx) {
		return CstNode.syntheticToken(ctx, TokenType.TIE, "-");
	}

	/**
	 * An {@link Tag#Inline_field} like <code>[V:1]</code>.
	 *
	 * @param key including the colon, like {@code "V:"}
	 * @param value may be empty
	 */
	public static CstNode inlineField(DocumentContext ctx, String key, String value) {
		CstNode result = CstNode.branch(ctx, Tag.Inline_field,
			CstNode.syntheticToken(ctx, TokenType.INLN_FLD_LFT_BRKT, "["),
			CstNode.syntheticToken(ctx, TokenType.INF_HDR, key));
		if (!value.isEmpty()) {
			result.appendChild(CstNode.syntheticToken(ctx, TokenType.INFO_STR, value));
		}
		result.appendChild(CstNode.syntheticToken(ctx, TokenType.INLN_FLD_RGT_BRKT, "]"));
		return result;
	}

	/**
	 * An {@link Tag#Info_line} like <code>V:1</code>, without its line ending.
	 */
	public static CstNode infoLine(DocumentContext ctx, String key, String value) {
		CstNode result = CstNode.branch(ctx, Tag.Info_line, CstNode.syntheticToken(ctx, TokenType.INF_HDR, key));
		if (!value.isEmpty()) {
			result.appendChild(CstNode.syntheticToken(ctx, TokenType.INFO_STR, value));
		}
		return result;
	}
}
