package works.abcedit.selectors;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.abcedit.selectors.ChordSelectors.selectAllButBottom;
import static works.abcedit.selectors.ChordSelectors.selectAllButTop;
import static works.abcedit.selectors.ChordSelectors.selectBottom;
import static works.abcedit.selectors.ChordSelectors.selectNthFromTop;
import static works.abcedit.selectors.ChordSelectors.selectTop;

class ChordSelectorsTest extends AbstractScoreTest {

	@Test
	void topAndBottom() {
		Selection all = Selection.of(parseTune("[CEG]2|"));
		assertEquals(List.of("G"), cursorTexts(selectTop(all)));
		assertEquals(List.of("C"), cursorTexts(selectBottom(all)));
		assertEquals(List.of("E"), cursorTexts(selectNthFromTop(all, 1)));
		assertEquals(List.of("C", "E"), cursorTexts(selectAllButTop(all)));
		assertEquals(List.of("E", "G"), cursorTexts(selectAllButBottom(all)));
	}

	@Test
	void writtenOrderDoesNotMatter() {
		Selection all = Selection.of(parseTune("[cE,G]|"));
		assertEquals(List.of("c"), cursorTexts(selectTop(all)));
		assertEquals(List.of("E,"), cursorTexts(selectBottom(all)));
	}

	@Test
	void accidentalsBreakTies() {
		Selection all = Selection.of(parseTune("[^F_G=F]|"));
		assertEquals(List.of("_G"), cursorTexts(selectTop(all)));
		assertEquals(List.of("=F"), cursorTexts(selectBottom(all)));
	}

	@Test
	void singleNoteChord() {
		Selection all = Selection.of(parseTune("[C]2|"));
		assertEquals(0, selectAllButTop(all).size());
		assertEquals(0, selectAllButBottom(all).size());
		assertEquals(List.of("C"), cursorTexts(selectTop(all)));
	}

	@Test
	void tooFewNotes() {
		Selection all = Selection.of(parseTune("[CEGc]2|"));
		assertEquals(0, selectNthFromTop(all, 5).size());
		assertEquals(List.of("C"), cursorTexts(selectNthFromTop(all, 3)));
		assertThrows(IllegalArgumentException.class, () -> selectNthFromTop(all, -1));
	}

	@Test
	void everyChordInScope() {
		Selection all = Selection.of(parseTune("[CEG]2 [FAc]2|"));
		assertEquals(4, selectAllButTop(all).size());
	}

	@Test
	void composesWithTypeSelectors() {
		Selection all = Selection.of(parseTune("[CEG]2 z2 [FAc]2 z2|"));
		assertEquals(List.of("G", "c"), cursorTexts(selectTop(TypeSelectors.selectChords(all))));
	}

	@Test
	void selectedNoteResolvesToItsChord() {
		CstNode root = parseTune("[CEG]2 [FAc]2|");
		CstNode e = nth(root, Tag.Note, 1);
		assertEquals(List.of("G"), cursorTexts(selectTop(select(root, e))));
	}

	@Test
	void notesOutsideChordsAreIgnored() {
		Selection all = Selection.of(parseTune("C D E|"));
		assertTrue(selectTop(all).isEmpty());
	}
}
