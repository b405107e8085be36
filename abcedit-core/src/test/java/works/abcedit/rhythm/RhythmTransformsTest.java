package works.abcedit.rhythm;

import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.junit.InjectFrom;
import works.abcedit.junit.InjectedTest;
import works.abcedit.junit.ParameterInjector;
import works.abcedit.walk.TreeWalk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.abcedit.selectors.TypeSelectors.selectChords;
import static works.abcedit.selectors.TypeSelectors.selectNotes;

@InjectFrom({
	RhythmTransformsTest.MusicInjector.class,
	RhythmTransformsTest.FactorInjector.class,
})
class RhythmTransformsTest extends AbstractScoreTest {

	@Test
	void setRhythm() {
		CstNode root = parseTune("C D2 E/ |");
		Selection notes = selectNotes(Selection.of(root));
		assertSame(notes, RhythmTransforms.setRhythm(notes, ctx, Rational.of(2)));
		assertEquals("C2 D2 E2 |", printMusic(root));
	}

	@Test
	void multiplyAndDivide() {
		CstNode root = parseTune("C D/ E3/2 |");
		RhythmTransforms.multiplyRhythm(selectNotes(Selection.of(root)), ctx, 2);
		assertEquals("C2 D E3 |", printMusic(root));
		RhythmTransforms.divideRhythm(selectNotes(Selection.of(root)), ctx, 4);
		assertEquals("C/ D/4 E3/4 |", printMusic(root));
	}

	@Test
	void addClampsAndSkipsUnchanged() {
		CstNode root = parseTune("C D2 E3/2 |");
		RhythmTransforms.addToRhythm(selectNotes(Selection.of(root)), ctx, Rational.of(-1));
		assertEquals("C D E/ |", printMusic(root));
	}

	@Test
	void brokenMarkerIsKept() {
		CstNode root = parseTune("C>D E2<F |");
		RhythmTransforms.multiplyRhythm(selectNotes(Selection.of(root)), ctx, 2);
		assertEquals("C2>D2 E4<F2 |", printMusic(root));
		RhythmTransforms.setRhythm(selectNotes(Selection.of(root)), ctx, Rational.ONE);
		assertEquals("C>D E<F |", printMusic(root));
	}

	@Test
	void rhythmGoesBeforeTheTie() {
		CstNode root = parseTune("C-C |");
		RhythmTransforms.setRhythm(select(root, first(root, Tag.Note)), ctx, Rational.of(2));
		assertEquals("C2-C |", printMusic(root));
	}

	@Test
	void chordsAndRests() {
		CstNode root = parseTune("[CE]2 z |");
		CstNode rest = first(root, Tag.Rest);
		RhythmTransforms.multiplyRhythm(selectChords(Selection.of(root)), ctx, 2);
		RhythmTransforms.setRhythm(select(root, rest), ctx, Rational.of(4));
		assertEquals("[CE]4 z4 |", printMusic(root));
	}

	@Test
	void otherNodesAreIgnored() {
		CstNode root = parseTune("C D | E |");
		RhythmTransforms.setRhythm(select(root, first(root, Tag.BarLine)), ctx, Rational.of(2));
		assertEquals("C D | E |", printMusic(root));
	}

	@Test
	void factorMustBePositive() {
		Selection notes = selectNotes(Selection.of(parseTune("C |")));
		assertThrows(IllegalArgumentException.class, () -> RhythmTransforms.divideRhythm(notes, ctx, 0));
		assertThrows(IllegalArgumentException.class, () -> RhythmTransforms.multiplyRhythm(notes, ctx, -2));
	}

	@Test
	void zeroLengthStaysZero() {
		CstNode root = parseTune("B0 C |");
		RhythmTransforms.divideRhythm(selectNotes(Selection.of(root)), ctx, 2);
		assertEquals("B0 C/ |", printMusic(root));
		RhythmTransforms.multiplyRhythm(selectNotes(Selection.of(root)), ctx, 2);
		assertEquals("B0 C |", printMusic(root));
	}

	@Test
	void settingZeroStillGivesOne() {
		CstNode root = parseTune("C2 D |");
		RhythmTransforms.setRhythm(selectNotes(Selection.of(root)), ctx, Rational.ZERO);
		assertEquals("C D |", printMusic(root));
	}

	@Test
	void hugeFactorsDoNotOverflow() {
		long factor = 4_000_000_000_000_000_000L;
		CstNode root = parseTune("C/3 D |");
		RhythmTransforms.divideRhythm(selectNotes(Selection.of(root)), ctx, factor);
		assertEquals("C/12000000000000000000 D/4000000000000000000 |", printMusic(root));
		RhythmTransforms.multiplyRhythm(selectNotes(Selection.of(root)), ctx, factor);
		assertEquals("C/3 D |", printMusic(root));
	}

	@Test
	void countsLongerThanALong() {
		CstNode root = parseTune("C99999999999999999999 D |");
		RhythmTransforms.divideRhythm(selectNotes(Selection.of(root)), ctx, 3);
		assertEquals("C33333333333333333333 D/3 |", printMusic(root));
		RhythmTransforms.multiplyRhythm(selectNotes(Selection.of(root)), ctx, 3);
		assertEquals("C99999999999999999999 D |", printMusic(root));
	}

	@InjectedTest
	void divideThenMultiplyRestoresText(String music, int factor) {
		CstNode root = parseTune(music);
		Selection durations = eachOf(root, durationNodes(root));
		RhythmTransforms.divideRhythm(durations, ctx, factor);
		RhythmTransforms.multiplyRhythm(durations, ctx, factor);
		assertEquals(music, printMusic(root));
	}

	private static List<CstNode> durationNodes(CstNode root) {
		List<CstNode> result = new ArrayList<>();
		TreeWalk.forEach(root, n -> {
			if (n.is(Tag.Note) || n.is(Tag.Rest)) {
				result.add(n);
			}
		});
		return result;
	}

	record MusicInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType() == String.class;
		}

		@Override
		public List<String> values() {
			return List.of(
				"C D2 E/ F3/2 |",
				"z2 G3 A/4 |",
				"C>D E2<F |",
				"B0 z0 C/3 |");
		}
	}

	record FactorInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType() == int.class;
		}

		@Override
		public List<Integer> values() {
			return List.of(1, 2, 3, 4);
		}
	}
}
