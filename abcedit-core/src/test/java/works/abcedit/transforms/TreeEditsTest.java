package works.abcedit.transforms;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.cst.exceptions.AbcProcessingException;
import works.abcedit.rhythm.Rational;
import works.abcedit.rhythm.RhythmCodec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TreeEditsTest extends AbstractScoreTest {

	@Test
	void findParent() {
		CstNode root = parseTune("C D |");
		CstNode system = first(root, Tag.System);
		CstNode d = nth(root, Tag.Note, 1);
		TreeEdits.ParentRef ref = TreeEdits.findParent(root, d);
		assertNotNull(ref);
		assertSame(system, ref.parent());
		assertEquals(" ", ref.prev().lexeme());
		assertSame(ref.prev(), TreeEdits.findPrev(system, d));
		assertNull(TreeEdits.findParent(root, root));
		assertNull(TreeEdits.findPrev(system, root));
	}

	@Test
	void removeAndInsert() {
		CstNode root = parseTune("C D |");
		CstNode system = first(root, Tag.System);
		CstNode d = nth(root, Tag.Note, 1);
		TreeEdits.ParentRef ref = TreeEdits.findParent(root, d);
		TreeEdits.removeChild(system, ref.prev(), d);
		assertEquals("C  |", printMusic(root));
		TreeEdits.insertAfter(system, null, d);
		assertEquals("DC  |", printMusic(root));
	}

	@Test
	void replaceWithSequenceKeepingTheOriginal() {
		CstNode root = parseTune("C D |");
		CstNode system = first(root, Tag.System);
		CstNode c = nth(root, Tag.Note, 0);
		CstNode d = nth(root, Tag.Note, 1);
		CstNode copy = TreeEdits.cloneWithFreshIds(c, ctx);
		TreeEdits.replaceWithSequence(system, TreeEdits.findPrev(system, d), d, List.of(d, TreeEdits.ws(ctx), copy));
		assertEquals("C D C |", printMusic(root));
		TreeEdits.replaceWithSequence(system, null, c, List.of());
		assertEquals(" D C |", printMusic(root));
	}

	@Test
	void replaceRhythm() {
		CstNode root = parseTune("C- D2 |");
		CstNode c = nth(root, Tag.Note, 0);
		CstNode d = nth(root, Tag.Note, 1);
		TreeEdits.replaceRhythm(c, RhythmCodec.rationalToRhythm(ctx, Rational.of(3, 2), null));
		TreeEdits.replaceRhythm(d, null);
		assertEquals("C3/2- D |", printMusic(root));
		TreeEdits.replaceRhythm(d, RhythmCodec.rationalToRhythm(ctx, Rational.of(4), null));
		assertEquals("C3/2- D4 |", printMusic(root));
	}

	@Test
	void idsStayUnique() {
		CstNode root = parseTune("C D |");
		CstNode system = first(root, Tag.System);
		CstNode c = nth(root, Tag.Note, 0);
		CstNode fresh = TreeEdits.cloneWithFreshIds(c, ctx);
		assertNotEquals(c.id(), fresh.id());
		TreeEdits.insertAfter(system, c, fresh);
		TreeEdits.checkUniqueIds(root);

		CstNode kept = TreeEdits.cloneKeepingIds(c);
		assertEquals(c.id(), kept.id());
		TreeEdits.insertAfter(system, c, kept);
		assertThrows(AbcProcessingException.class, () -> TreeEdits.checkUniqueIds(root));
		TreeEdits.reassignIds(kept, ctx);
		TreeEdits.checkUniqueIds(root);
		assertEquals("CCC D |", printMusic(root));
	}

	@Test
	void builtFields() {
		assertEquals("[V:1]", print(TreeEdits.inlineField(ctx, "V:", "1")));
		assertEquals("[V:]", print(TreeEdits.inlineField(ctx, "V:", "")));
		assertEquals("V:T1 clef=bass", print(TreeEdits.infoLine(ctx, "V:", "T1 clef=bass")));
		assertEquals("-", print(TreeEdits.tie(ctx)));
	}
}
