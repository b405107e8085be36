package works.abcedit;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.pcollections.PSet;
import works.abcedit.cst.CstNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SelectionTest extends AbstractScoreTest {

	@Test
	void ofRootSelectsTheRoot() {
		CstNode root = parseTune("C |");
		Selection selection = Selection.of(root);
		assertEquals(1, selection.size());
		assertEquals(Set.of(root.id()), selection.cursor(0));
	}

	@Test
	void derivedSelectionsLeaveTheOriginalAlone() {
		CstNode root = parseTune("C |");
		Selection original = Selection.of(root, List.of(Set.of(1L, 2L)));
		Selection added = original.withCursor(Selection.singletonCursor(3L));
		Selection mapped = original.mapCursors(c -> c.minus(1L));

		assertEquals(List.of(Set.of(1L, 2L)), original.cursors());
		assertEquals(2, added.size());
		assertEquals(Set.of(2L), mapped.cursor(0));
		assertTrue(Selection.empty(root).isEmpty());
	}

	@Test
	void cursorOfKeepsEveryId() {
		PSet<Long> cursor = Selection.cursorOf(List.of(5L, 3L, 5L));
		assertEquals(Set.of(3L, 5L), cursor);
	}
}
