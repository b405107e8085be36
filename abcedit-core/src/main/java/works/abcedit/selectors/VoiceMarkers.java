package works.abcedit.selectors;

import org.jetbrains.annotations.Nullable;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;

/**
 * Recognizes {@code V:} fields, whether on their own line or inline.
 */
public final class VoiceMarkers {
	private VoiceMarkers() { }

	public static boolean isVoiceMarker(CstNode node) {
		return (node.is(Tag.Info_line) || node.is(Tag.Inline_field)) && "V:".equals(fieldKey(node));
	}

	public static boolean isInlineVoiceMarker(CstNode node) {
		return node.is(Tag.Inline_field) && isVoiceMarker(node);
	}

	/**
	 * @return the field's key token lexeme, like {@code "K:"}, or null
	 */
	public static @Nullable String fieldKey(CstNode field) {
		CstNode header = childToken(field, TokenType.INF_HDR);
		return header == null ? null : header.lexeme();
	}

	/**
	 * @return the raw text after the key, not trimmed; empty if there is none
	 */
	public static String fieldValue(CstNode field) {
		CstNode value = childToken(field, TokenType.INFO_STR);
		return value == null ? "" : value.lexeme();
	}

	/**
	 * The voice id is the first word of the field's value;
	 * anything after it, like {@code clef=bass}, is a property.
	 *
	 * @return null if <code>node</code> isn't a voice marker or names no voice
	 */
	public static @Nullable String voiceId(CstNode node) {
		if (!isVoiceMarker(node)) {
			return null;
		}
		String value = fieldValue(node).trim();
		if (value.isEmpty()) {
			return null;
		}
		String[] words = value.split("\\s+", 2);
		return words[0];
	}

	private static @Nullable CstNode childToken(CstNode node, TokenType type) {
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			if (c.isToken(type)) {
				return c;
			}
		}
		return null;
	}
}
