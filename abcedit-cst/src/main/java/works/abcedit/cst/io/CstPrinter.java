package works.abcedit.cst.io;

import works.abcedit.cst.CstNode;
import works.abcedit.cst.NodePayload.TokenData;

/**
 * Turns a tree back into text by concatenating token lexemes in document order.
 * For a tree produced by {@link AbcTreeReader}, this reproduces the input exactly.
 */
public final class CstPrinter {
	private CstPrinter() { }

	public static String print(CstNode node) {
		StringBuilder sb = new StringBuilder();
		append(sb, node);
		return sb.toString();
	}

	private static void append(StringBuilder sb, CstNode node) {
		TokenData t = node.token();
		if (t != null) {
			sb.append(t.lexeme());
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			append(sb, c);
		}
	}

	/**
	 * An indented outline of the tree, one node per line. Handy in assertion messages.
	 */
	public static String outline(CstNode node) {
		StringBuilder sb = new StringBuilder();
		outline(sb, node, 0);
		return sb.toString();
	}

	private static void outline(StringBuilder sb, CstNode node, int depth) {
		sb.append("  ".repeat(depth)).append(node).append('\n');
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			outline(sb, c, depth + 1);
		}
	}
}
