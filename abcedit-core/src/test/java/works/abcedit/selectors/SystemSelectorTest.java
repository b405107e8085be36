package works.abcedit.selectors;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.abcedit.selectors.SystemSelector.selectSystem;

class SystemSelectorTest extends AbstractScoreTest {

	@Test
	void selectsTheWholeLine() {
		CstNode root = parseTune("C D |\nE F |");
		CstNode e = nth(root, Tag.Note, 2);
		assertEquals(List.of("E F |\n"), cursorTexts(selectSystem(select(root, e))));
	}

	@Test
	void includesInfoLinesAbove() {
		CstNode root = parseTune("C D |\nT:Part B\n% comment\nE F |");
		CstNode e = nth(root, Tag.Note, 2);
		Selection system = selectSystem(select(root, e));
		assertEquals(1, system.size());
		assertTrue(system.cursor(0).contains(nth(root, Tag.Info_line, 2).id()));
		assertEquals(List.of("T:Part BE F |\n"), cursorTexts(system));
	}

	@Test
	void oneCursorPerTouchedLine() {
		CstNode root = parseTune("C D |\nE F |\nG A |");
		Selection system = selectSystem(select(root, nth(root, Tag.Note, 0), nth(root, Tag.Note, 5)));
		assertEquals(List.of("C D |\n", "G A |\n"), cursorTexts(system));
	}

	@Test
	void noMatchReturnsInput() {
		CstNode root = parseTune("C D |");
		Selection header = select(root, first(root, Tag.Info_line));
		assertSame(header, selectSystem(header));
		Selection empty = Selection.empty(root);
		assertSame(empty, selectSystem(empty));
	}
}
