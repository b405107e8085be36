package works.abcedit.selectors;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.walk.TreeWalk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.abcedit.selectors.DelimiterSelectors.selectAroundChord;
import static works.abcedit.selectors.DelimiterSelectors.selectAroundGraceGroup;
import static works.abcedit.selectors.DelimiterSelectors.selectAroundInlineField;
import static works.abcedit.selectors.DelimiterSelectors.selectInsideChord;
import static works.abcedit.selectors.DelimiterSelectors.selectInsideGraceGroup;
import static works.abcedit.selectors.DelimiterSelectors.selectInsideInlineField;

class DelimiterSelectorsTest extends AbstractScoreTest {
	static final String MUSIC = "[CEG]2 {ga}B [K:G] |";

	@Test
	void chord() {
		CstNode root = parseTune(MUSIC);
		CstNode e = nth(root, Tag.Note, 1);
		assertEquals(List.of("[CEG]2"), cursorTexts(selectAroundChord(select(root, e))));
		assertEquals(List.of("CEG"), cursorTexts(selectInsideChord(select(root, e))));
	}

	@Test
	void bracketSelectsItsChord() {
		CstNode root = parseTune(MUSIC);
		CstNode bracket = first(first(root, Tag.Chord), Tag.Token);
		assertEquals(List.of("[CEG]2"), cursorTexts(selectAroundChord(select(root, bracket))));
	}

	@Test
	void graceGroup() {
		CstNode root = parseTune(MUSIC);
		CstNode g = nth(root, Tag.Note, 3);
		assertEquals(List.of("{ga}"), cursorTexts(selectAroundGraceGroup(select(root, g))));
		assertEquals(List.of("ga"), cursorTexts(selectInsideGraceGroup(select(root, g))));
	}

	@Test
	void inlineField() {
		CstNode root = parseTune(MUSIC);
		CstNode value = TreeWalk.findByTag(root, Tag.Token).stream()
			.filter(t -> t.isToken(TokenType.INFO_STR) && "G".equals(t.lexeme()))
			.findFirst()
			.orElseThrow();
		assertEquals(List.of("[K:G]"), cursorTexts(selectAroundInlineField(select(root, value))));
		assertEquals(List.of("K:G"), cursorTexts(selectInsideInlineField(select(root, value))));
	}

	@Test
	void eachConstructOncePerCursor() {
		CstNode root = parseTune(MUSIC);
		CstNode c = nth(root, Tag.Note, 0);
		CstNode e = nth(root, Tag.Note, 1);
		assertEquals(1, selectAroundChord(select(root, c, e)).size());
		assertEquals(2, selectAroundChord(eachOf(root, List.of(c, e))).size());
	}

	@Test
	void nothingEnclosing() {
		CstNode root = parseTune(MUSIC);
		CstNode b = nth(root, Tag.Note, 5);
		assertEquals(0, selectAroundChord(select(root, b)).size());
		assertEquals(0, selectInsideGraceGroup(select(root, root)).size());
	}
}
