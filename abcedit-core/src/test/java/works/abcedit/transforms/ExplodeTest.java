package works.abcedit.transforms;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ExplodeTest extends AbstractScoreTest {

	@Test
	void onePartPerChordNote() {
		CstNode root = parseTune("[CEG]2 |");
		Explode.explode3(select(root, first(root, Tag.Chord)), ctx);
		assertEquals("[CEG]2 |\nG2 |\nE2 |\nC2 |", printMusic(root));
		TreeEdits.checkUniqueIds(root);
	}

	@Test
	void missingChordNotesBecomeRests() {
		CstNode root = parseTune("[CE] |");
		Explode.explode(select(root, first(root, Tag.Chord)), ctx, 3);
		assertEquals("[CE] |\nE |\nC |\nz |", printMusic(root));
	}

	@Test
	void lowerPartsRestUnderTheMelody() {
		CstNode root = parseTune("A B C D |");
		Explode.explode2(select(root, first(root, Tag.Note)), ctx);
		assertEquals("A B C D |\nA B C D |\nz4    |", printMusic(root));
	}

	@Test
	void restsStayInEveryPart() {
		CstNode root = parseTune("[CE] z [DF] |");
		Explode.explode2(select(root, first(root, Tag.Rest)), ctx);
		assertEquals("[CE] z [DF] |\nE z F |\nC z D |", printMusic(root));
	}

	@Test
	void beamsAreFollowed() {
		CstNode root = parseTune("[CE]AB |");
		Explode.explode2(select(root, first(root, Tag.Beam)), ctx);
		assertEquals("[CE]AB |\nEAB |\nCz2 |", printMusic(root));
	}

	@Test
	void graceNotesOnlyInTopPart() {
		CstNode root = parseTune("{g}[CE] |");
		Explode.explode2(select(root, first(root, Tag.Chord)), ctx);
		assertEquals("{g}[CE] |\n{g}E |\nC |", printMusic(root));
	}

	@Test
	void onlySelectedLines() {
		CstNode root = parseTune("C D |\n[CE] F |");
		Explode.explode2(select(root, first(root, Tag.Chord)), ctx);
		assertEquals("C D |\n[CE] F |\nE F |\nC z |", printMusic(root));
	}

	@Test
	void cursorsNameTheNewLines() {
		CstNode root = parseTune("[CE] z [DF] |");
		Selection result = Explode.explode2(Selection.of(root), ctx);
		assertEquals(List.of("E z F |\n", "C z D |\n"), cursorTexts(result));
	}

	@Test
	void noPartsChangesNothing() {
		CstNode root = parseTune("[CE] |");
		Selection input = select(root, first(root, Tag.Chord));
		assertSame(input, Explode.explode(input, ctx, 0));
		assertEquals("[CE] |", printMusic(root));
	}
}
