package works.abcedit.selectors;

import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CursorFilterTest extends AbstractScoreTest {

	@Test
	void keepsMatchingCursors() {
		CstNode root = parseTune("CDE[CEG]z|");
		Selection notes = TypeSelectors.selectNotes(Selection.of(root));
		Selection kept = CursorFilter.filter(notes, n -> n.is(Tag.Note));
		assertEquals(notes.size(), kept.size());
		assertSame(root, kept.root());
		for (int i = 0; i < kept.size(); i++) {
			assertSame(notes.cursor(i), kept.cursor(i));
		}
	}

	@Test
	void dropsTheRest() {
		CstNode root = parseTune("CDE[CEG]z|");
		Selection notes = TypeSelectors.selectNotes(Selection.of(root));
		assertTrue(CursorFilter.filter(notes, n -> n.is(Tag.Chord)).isEmpty());
		assertTrue(CursorFilter.filter(notes, n -> false).isEmpty());
	}

	@Test
	void anyMatchingNodeKeepsTheCursor() {
		CstNode root = parseTune("C z D |");
		Selection input = select(root, first(root, Tag.Note), first(root, Tag.Rest));
		assertEquals(1, CursorFilter.filter(input, n -> n.is(Tag.Rest)).size());
	}

	@Test
	void emptySelection() {
		CstNode root = parseTune("C D |");
		assertTrue(CursorFilter.filter(Selection.empty(root), n -> true).isEmpty());
	}
}
