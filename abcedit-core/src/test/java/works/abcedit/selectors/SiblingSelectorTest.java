package works.abcedit.selectors;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiblingSelectorTest extends AbstractScoreTest {

	@Test
	void everythingAfter() {
		CstNode root = parseTune("C D E|");
		Selection result = SiblingSelector.selectSiblingsAfter(select(root, first(root, Tag.Note)), n -> true);
		assertEquals(List.of(" ", "D", " ", "E", "|", "\n"), cursorTexts(result));
	}

	@Test
	void stopsWhereThePredicateFails() {
		CstNode root = parseTune("C D E|");
		Selection result = SiblingSelector.selectSiblingsAfter(
			select(root, first(root, Tag.Note)), n -> !n.is(Tag.BarLine));
		assertEquals(List.of(" ", "D", " ", "E"), cursorTexts(result));
		assertTrue(SiblingSelector.selectSiblingsAfter(select(root, first(root, Tag.Note)), n -> false).isEmpty());
	}

	@Test
	void lastSiblingHasNothingAfter() {
		CstNode root = parseTune("C|");
		CstNode last = first(root, Tag.System).lastChild();
		assertTrue(SiblingSelector.selectSiblingsAfter(select(root, last), n -> true).isEmpty());
	}

	@Test
	void eachCursorWalksOnItsOwn() {
		CstNode root = parseTune("C D E|");
		Selection input = eachOf(root, List.of(nth(root, Tag.Note, 0), nth(root, Tag.Note, 2)));
		assertEquals(6 + 2, SiblingSelector.selectSiblingsAfter(input, n -> true).size());
	}

	@Test
	void chainsAreContiguous() {
		for (String text : new SelectionPropertiesTest.DocumentInjector().values()) {
			CstNode root = parse(text);
			for (CstNode note : all(root, Tag.Note)) {
				Selection result = SiblingSelector.selectSiblingsAfter(select(root, note), n -> true);
				CstNode s = note.nextSibling();
				for (int i = 0; i < result.size(); i++) {
					assertEquals(s.id(), result.cursor(i).iterator().next());
					s = s.nextSibling();
				}
				assertNull(s);
			}
		}
	}
}
