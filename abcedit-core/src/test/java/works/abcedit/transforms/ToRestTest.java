package works.abcedit.transforms;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.walk.TreeWalk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.abcedit.selectors.TypeSelectors.selectChords;
import static works.abcedit.selectors.TypeSelectors.selectNonChordNotes;

class ToRestTest extends AbstractScoreTest {

	@Test
	void keepsRhythmAndDropsTies() {
		CstNode root = parseTune("C2 D- [CE]3 [D/F/] |");
		List<CstNode> targets = List.of(
			nth(root, Tag.Note, 0),
			nth(root, Tag.Note, 1),
			nth(root, Tag.Chord, 0),
			nth(root, Tag.Chord, 1));
		Selection input = eachOf(root, targets);
		assertSame(input, ToRest.toRest(input, ctx));
		assertEquals("z2 z z3 z/ |", printMusic(root));
		for (CstNode node : targets) {
			assertSame(node, TreeWalk.findById(root, node.id()));
			assertTrue(node.is(Tag.Rest));
		}
	}

	@Test
	void brokenRhythmIsKept() {
		CstNode root = parseTune("C>D E |");
		ToRest.toRest(selectNonChordNotes(Selection.of(root)), ctx);
		assertEquals("z>z z |", printMusic(root));
	}

	@Test
	void onlySelectedNodesChange() {
		CstNode root = parseTune("C [EG] A |");
		ToRest.toRest(selectChords(Selection.of(root)), ctx);
		assertEquals("C z A |", printMusic(root));
	}
}
