package works.abcedit.transforms;

import org.junit.jupiter.api.Test;
import works.abcedit.AbstractScoreTest;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.abcedit.transforms.VoiceMarkerConversion.voiceInfoLineToInline;
import static works.abcedit.transforms.VoiceMarkerConversion.voiceInlineToInfoLine;

class VoiceMarkerConversionTest extends AbstractScoreTest {
	static final String LINES = "X:1\nK:C\nV:1\nCDE|\nV:2 clef=bass\nC,D,E,|\n";
	static final String INLINE = "X:1\nK:C\n[V:1] CDE|\n[V:2 clef=bass] C,D,E,|\n";

	@Test
	void lineToInline() {
		CstNode root = parse(LINES);
		voiceInfoLineToInline(Selection.of(root), ctx);
		assertEquals(INLINE, print(root));
		TreeEdits.checkUniqueIds(root);
	}

	@Test
	void inlineToLine() {
		CstNode root = parse(INLINE);
		voiceInlineToInfoLine(Selection.of(root), ctx);
		assertEquals(LINES, print(root));
	}

	@Test
	void roundTrip() {
		CstNode root = parse(LINES);
		voiceInfoLineToInline(Selection.of(root), ctx);
		voiceInlineToInfoLine(Selection.of(root), ctx);
		assertEquals(LINES, print(root));
	}

	@Test
	void onlySelectedMarkers() {
		CstNode root = parse(LINES);
		voiceInfoLineToInline(select(root, nth(root, Tag.Info_line, 3)), ctx);
		assertEquals("X:1\nK:C\nV:1\nCDE|\n[V:2 clef=bass] C,D,E,|\n", print(root));
	}

	@Test
	void musicBeforeTheFieldStays() {
		CstNode root = parse("X:1\nK:C\nC D [V:2] E F|\n");
		voiceInlineToInfoLine(Selection.of(root), ctx);
		assertEquals("X:1\nK:C\nC D\nV:2\nE F|\n", print(root));
	}

	@Test
	void trailingVoiceLine() {
		CstNode root = parse("X:1\nK:C\nC|\nV:2\n");
		voiceInfoLineToInline(Selection.of(root), ctx);
		assertEquals("X:1\nK:C\nC|\n[V:2]\n", print(root));
	}

	@Test
	void headerLinesAreNotConverted() {
		String text = "X:1\nV:1\nK:C\nC|\n";
		CstNode root = parse(text);
		voiceInfoLineToInline(Selection.of(root), ctx);
		assertEquals(text, print(root));
	}

	@Test
	void otherFieldsAreNotConverted() {
		String text = "X:1\nK:C\nC [K:G] D|\n";
		CstNode root = parse(text);
		voiceInlineToInfoLine(Selection.of(root), ctx);
		assertEquals(text, print(root));
	}
}
