package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;

/**
 * Shared by the transforms that merge adjacent equal durations.
 */
final class Consolidation {
	private Consolidation() { }

	/**
	 * @return the next sibling that isn't a space, or null
	 */
	static @Nullable CstNode nextMeaningfulSibling(CstNode node) {
		CstNode c = node.nextSibling();
		while (c != null && c.isToken(TokenType.WS)) {
			c = c.nextSibling();
		}
		return c;
	}

	/**
	 * Splits at barlines, dropping the barlines themselves and empty groups.
	 */
	static List<List<CstNode>> splitAtBarLines(List<CstNode> nodes) {
		List<List<CstNode>> result = new ArrayList<>();
		List<CstNode> current = new ArrayList<>();
		for (CstNode node : nodes) {
			if (node.is(Tag.BarLine)) {
				if (!current.isEmpty()) {
					result.add(current);
					current = new ArrayList<>();
				}
			} else {
				current.add(node);
			}
		}
		if (!current.isEmpty()) {
			result.add(current);
		}
		return result;
	}

	static boolean hasTie(CstNode node) {
		return TreeEdits.findTieChild(node) != null;
	}

	static void removeTie(CstNode node) {
		TreeEdits.ChildRef tie = TreeEdits.findTieChild(node);
		if (tie != null) {
			TreeEdits.removeChild(node, tie.prev(), tie.node());
		}
	}

	/**
	 * Appends a tie unless the node already has one.
	 */
	static void addTie(CstNode node, DocumentContext ctx) {
		if (!hasTie(node)) {
			TreeEdits.appendChild(node, TreeEdits.tie(ctx));
		}
	}

	/**
	 * @return the concatenated lexemes of the note's Pitch, like {@code "^F,"}, or null
	 */
	static @Nullable String pitchText(CstNode note) {
		TreeEdits.ChildRef pitch = TreeEdits.findChildByTag(note, Tag.Pitch);
		if (pitch == null) {
			return null;
		}
		StringBuilder sb = new StringBuilder();
		for (CstNode t = pitch.node().firstChild(); t != null; t = t.nextSibling()) {
			if (t.lexeme() != null) {
				sb.append(t.lexeme());
			}
		}
		return sb.length() == 0 ? null : sb.toString();
	}

	/**
	 * @return the chord's note pitches, sorted so that written order doesn't matter
	 */
	static List<String> chordPitchTexts(CstNode chord) {
		List<String> result = new ArrayList<>();
		for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Note)) {
				String text = pitchText(c);
				if (text != null) {
					result.add(text);
				}
			}
		}
		result.sort(null);
		return result;
	}
}
