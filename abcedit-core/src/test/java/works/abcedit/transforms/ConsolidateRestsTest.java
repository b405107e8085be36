package works.abcedit.transforms;

import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ConsolidateRestsTest extends AbstractScoreTest {

	private String consolidated(String music) {
		CstNode root = parseTune(music);
		ConsolidateRests.consolidateRests(Selection.of(root), ctx);
		return printMusic(root);
	}

	@Test
	void merges() {
		assertEquals("z2  |", consolidated("z z |"));
		assertEquals("z2  z |", consolidated("z z z |"));
		assertEquals("z4    |", consolidated("z z z z |"));
		assertEquals("x  |", consolidated("x/ x/ |"));
	}

	@Test
	void leavesAlone() {
		assertEquals("z/3 z/3 |", consolidated("z/3 z/3 |"));
		assertEquals("z | z |", consolidated("z | z |"));
		assertEquals("z x |", consolidated("z x |"));
		assertEquals("z z2 |", consolidated("z z2 |"));
		assertEquals("z [V:2] z |", consolidated("z [V:2] z |"));
		assertEquals("z C z |", consolidated("z C z |"));
	}

	@Test
	void onlyTheFirstRestNeedsSelecting() {
		CstNode root = parseTune("C z z |");
		CstNode second = nth(root, Tag.Rest, 1);
		Selection result = ConsolidateRests.consolidateRests(select(root, first(root, Tag.Rest), second), ctx);
		assertEquals("C z2  |", printMusic(root));
		assertFalse(result.cursor(0).contains(second.id()));
	}
}
