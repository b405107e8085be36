package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.rhythm.RhythmCodec;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

public final class ToRest {
	private ToRest() { }

	/**
	 * Turns every selected Note and Chord into a {@code z} rest of the same
	 * written length, in place, so cursors keep naming the same nodes.
	 */
	public static Selection toRest(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "toRest")) {
			List<CstNode> targets = SelectedNodes.all(input, n -> n.is(Tag.Note) || n.is(Tag.Chord));
			for (CstNode node : targets) {
				convert(ctx, node);
			}
			LOGGER.debug("Converted {} nodes to rests", targets.size());
			return input;
		}
	}

	/**
	 * Keeps the node's id. The tie is dropped; the rhythm, broken marker included, is kept.
	 * A chord without its own rhythm takes its first note's.
	 */
	public static void convert(DocumentContext ctx, CstNode node) {
		CstNode rhythm = RhythmCodec.rhythmChild(node);
		if (rhythm == null && node.is(Tag.Chord)) {
			CstNode firstNote = firstNote(node);
			if (firstNote != null) {
				rhythm = RhythmCodec.rhythmChild(firstNote);
			}
		}
		List<CstNode> children = new ArrayList<>();
		children.add(CstNode.syntheticToken(ctx, TokenType.REST, "z"));
		if (rhythm != null) {
			children.add(rhythm);
		}
		node.tag(Tag.Rest);
		node.setChildren(children);
	}

	static @Nullable CstNode firstNote(CstNode chord) {
		for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Note)) {
				return c;
			}
		}
		return null;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ToRest.class);
}
