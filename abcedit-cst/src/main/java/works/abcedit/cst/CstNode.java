package works.abcedit.cst;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A node of the concrete syntax tree.
 * <p>
 * Children form a singly linked list through {@link #nextSibling()}.
 * There are deliberately no parent or previous-sibling links:
 * code that needs them walks down from the root.
 * A node reachable from the root must appear exactly once in the tree.
 */
public final class CstNode {
	private long id;
	private Tag tag;
	private NodePayload payload;
	private CstNode firstChild;
	private CstNode nextSibling;

	public CstNode(long id, Tag tag, NodePayload payload) {
		this.id = id;
		this.tag = requireNonNull(tag);
		this.payload = requireNonNull(payload);
		if (tag == Tag.Token && !(payload instanceof NodePayload.TokenData)) {
			throw new IllegalArgumentException("Token node needs token data");
		}
	}

	public static CstNode branch(DocumentContext ctx, Tag tag) {
		return new CstNode(ctx.nextId(), tag, NodePayload.Empty.INSTANCE);
	}

	public static CstNode branch(DocumentContext ctx, Tag tag, CstNode... children) {
		CstNode result = branch(ctx, tag);
		for (CstNode child : children) {
			result.appendChild(child);
		}
		return result;
	}

	public static CstNode token(DocumentContext ctx, TokenType type, String lexeme, int line, int column) {
		return new CstNode(ctx.nextId(), Tag.Token, new NodePayload.TokenData(lexeme, type, line, column));
	}

	/**
	 * A token that has no position in the source text.
	 */
	public static CstNode syntheticToken(DocumentContext ctx, TokenType type, String lexeme) {
		return token(ctx, type, lexeme, NodePayload.SYNTHETIC, NodePayload.SYNTHETIC);
	}

	public long id() {
		return id;
	}

	public void id(long id) {
		this.id = id;
	}

	public Tag tag() {
		return tag;
	}

	public void tag(Tag tag) {
		this.tag = requireNonNull(tag);
	}

	public NodePayload payload() {
		return payload;
	}

	public void payload(NodePayload payload) {
		this.payload = requireNonNull(payload);
	}

	public @Nullable CstNode firstChild() {
		return firstChild;
	}

	public void firstChild(@Nullable CstNode firstChild) {
		this.firstChild = firstChild;
	}

	public @Nullable CstNode nextSibling() {
		return nextSibling;
	}

	public void nextSibling(@Nullable CstNode nextSibling) {
		this.nextSibling = nextSibling;
	}

	public boolean is(Tag tag) {
		return this.tag == tag;
	}

	public boolean isToken() {
		return payload instanceof NodePayload.TokenData;
	}

	public boolean isToken(TokenType type) {
		return payload instanceof NodePayload.TokenData t && t.tokenType() == type;
	}

	/**
	 * @return the token data, or null if this isn't a token
	 */
	public @Nullable NodePayload.TokenData token() {
		return payload instanceof NodePayload.TokenData t ? t : null;
	}

	/**
	 * @return the token's lexeme, or null if this isn't a token
	 */
	public @Nullable String lexeme() {
		NodePayload.TokenData t = token();
		return t == null ? null : t.lexeme();
	}

	public @Nullable TokenType tokenType() {
		NodePayload.TokenData t = token();
		return t == null ? null : t.tokenType();
	}

	/**
	 * Replaces this token's lexeme, keeping its type and position.
	 *
	 * @throws IllegalStateException if this isn't a token
	 */
	public void lexeme(String newLexeme) {
		NodePayload.TokenData t = token();
		if (t == null) {
			throw new IllegalStateException("Not a token: " + this);
		}
		payload = t.withLexeme(newLexeme);
	}

	/**
	 * @return a snapshot of the children; later changes to the tree don't affect it
	 */
	public List<CstNode> children() {
		List<CstNode> result = new ArrayList<>();
		for (CstNode c = firstChild; c != null; c = c.nextSibling) {
			result.add(c);
		}
		return result;
	}

	public boolean hasChildren() {
		return firstChild != null;
	}

	public @Nullable CstNode lastChild() {
		if (firstChild == null) {
			return null;
		}
		CstNode c = firstChild;
		while (c.nextSibling != null) {
			c = c.nextSibling;
		}
		return c;
	}

	/**
	 * Links <code>child</code> as the last child of this node.
	 * The child's own {@link #nextSibling()} is left as-is,
	 * so appending the head of a chain appends the whole chain.
	 *
	 * @return this
	 */
	public CstNode appendChild(CstNode child) {
		CstNode last = lastChild();
		if (last == null) {
			firstChild = child;
		} else {
			last.nextSibling = child;
		}
		return this;
	}

	/**
	 * Replaces all children with the given list, relinking their siblings.
	 */
	public void setChildren(List<CstNode> children) {
		firstChild = null;
		CstNode prev = null;
		for (CstNode c : children) {
			c.nextSibling = null;
			if (prev == null) {
				firstChild = c;
			} else {
				prev.nextSibling = c;
			}
			prev = c;
		}
	}

	@Override
	public String toString() {
		if (payload instanceof NodePayload.TokenData t) {
			return "Token#" + id + "(" + t.tokenType() + " \"" + t.lexeme() + "\" " + t.line() + ":" + t.column() + ")";
		}
		return tag + "#" + id;
	}
}
