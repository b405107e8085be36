package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.List;
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

public final class UnwrapSingle {
	private UnwrapSingle() { }

	/**
	 * Turns each selected chord holding exactly one note into that note.
	 * The chord node becomes the Note, keeping its id.
	 * The chord's rhythm, when it has one, replaces the note's.
	 */
	public static Selection unwrapSingle(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "unwrapSingle")) {
			int count = 0;
			for (CstNode chord : SelectedNodes.all(input, n -> n.is(Tag.Chord))) {
				List<CstNode> notes = new ArrayList<>();
				for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
					if (c.is(Tag.Note)) {
						notes.add(c);
					}
				}
				if (notes.size() == 1) {
					unwrap(chord, notes.get(0));
					count++;
				}
			}
			LOGGER.debug("Unwrapped {} chords", count);
			return input;
		}
	}

	static void unwrap(CstNode chord, CstNode note) {
		CstNode chordRhythm = RhythmCodec.rhythmChild(chord);
		TreeEdits.ChildRef chordTie = TreeEdits.findTieChild(chord);
		CstNode tie = chordTie == null ? null : chordTie.node();
		List<CstNode> children = new ArrayList<>();
		for (CstNode c = note.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Rhythm) && chordRhythm != null) {
				continue;
			}
			if (c.isToken(TokenType.TIE)) {
				if (tie == null) {
					tie = c;
				}
				continue;
			}
			children.add(c);
		}
		if (chordRhythm != null) {
			children.add(chordRhythm);
		}
		if (tie != null) {
			children.add(tie);
		}
		chord.tag(Tag.Note);
		chord.setChildren(children);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UnwrapSingle.class);
}
