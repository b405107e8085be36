package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;

/**
 * Selects bracketed constructs, either whole ("around") or just their
 * content between the brackets ("inside").
 * <p>
 * A cursor that names the construct itself, one of its brackets, or anything
 * within it selects the nearest enclosing construct of the requested kind.
 * Each construct is reported at most once per cursor.
 */
public final class DelimiterSelectors {
	private DelimiterSelectors() { }

	public enum Delimited {
		CHORD(Tag.Chord, TokenType.CHRD_LEFT_BRKT, TokenType.CHRD_RIGHT_BRKT),
		GRACE_GROUP(Tag.Grace_group, TokenType.GRC_GRP_LEFT_BRACE, TokenType.GRC_GRP_RGHT_BRACE),
		INLINE_FIELD(Tag.Inline_field, TokenType.INLN_FLD_LFT_BRKT, TokenType.INLN_FLD_RGT_BRKT);

		final Tag tag;
		final TokenType open;
		final TokenType close;

		Delimited(Tag tag, TokenType open, TokenType close) {
			this.tag = tag;
			this.open = open;
			this.close = close;
		}
	}

	public static Selection selectInsideChord(Selection input) {
		return selectInside(input, Delimited.CHORD);
	}

	public static Selection selectAroundChord(Selection input) {
		return selectAround(input, Delimited.CHORD);
	}

	public static Selection selectInsideGraceGroup(Selection input) {
		return selectInside(input, Delimited.GRACE_GROUP);
	}

	public static Selection selectAroundGraceGroup(Selection input) {
		return selectAround(input, Delimited.GRACE_GROUP);
	}

	public static Selection selectInsideInlineField(Selection input) {
		return selectInside(input, Delimited.INLINE_FIELD);
	}

	public static Selection selectAroundInlineField(Selection input) {
		return selectAround(input, Delimited.INLINE_FIELD);
	}

	public static Selection selectAround(Selection input, Delimited kind) {
		return select(input, kind, false);
	}

	/**
	 * Constructs with nothing between their brackets contribute no cursor.
	 */
	public static Selection selectInside(Selection input, Delimited kind) {
		return select(input, kind, true);
	}

	private static Selection select(Selection input, Delimited kind, boolean inside) {
		List<PSet<Long>> result = new ArrayList<>();
		for (PSet<Long> cursor : input.cursors()) {
			new Walker(kind, inside, cursor, new HashSet<>(), result).walk(input.root(), null);
		}
		LOGGER.debug("{} {}: {} cursors from {}", inside ? "Inside" : "Around", kind, result.size(), input.size());
		return input.withCursors(result);
	}

	private record Walker(Delimited kind, boolean inside, Set<Long> cursor, Set<Long> seen, List<PSet<Long>> out) {
		void walk(CstNode node, @Nullable CstNode enclosing) {
			CstNode target = node.is(kind.tag) ? node : enclosing;
			if (target != null && cursor.contains(node.id()) && seen.add(target.id())) {
				if (inside) {
					List<Long> ids = insideIds(target);
					if (!ids.isEmpty()) {
						out.add(Selection.cursorOf(ids));
					}
				} else {
					out.add(Selection.singletonCursor(target.id()));
				}
			}
			for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
				walk(c, target);
			}
		}

		/**
		 * The children after the first opening bracket and before the last closing one.
		 * An unclosed construct runs to its last child.
		 */
		List<Long> insideIds(CstNode target) {
			List<CstNode> children = target.children();
			int start = -1;
			int end = children.size();
			for (int i = 0; i < children.size(); i++) {
				CstNode c = children.get(i);
				if (start < 0 && c.isToken(kind.open)) {
					start = i;
				} else if (c.isToken(kind.close)) {
					end = i;
				}
			}
			List<Long> result = new ArrayList<>();
			for (int i = start + 1; i < end; i++) {
				result.add(children.get(i).id());
			}
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DelimiterSelectors.class);
}
