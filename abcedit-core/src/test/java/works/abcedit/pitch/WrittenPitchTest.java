package works.abcedit.pitch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import works.abcedit.AbstractScoreTest;
import works.abcedit.cst.Tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class WrittenPitchTest extends AbstractScoreTest {

	private WrittenPitch read(String note) {
		WrittenPitch result = WrittenPitch.of(first(parseTune(note + " |"), Tag.Pitch));
		assertNotNull(result);
		return result;
	}

	@ParameterizedTest
	@CsvSource({
		"C, 0, 4",
		"c, 0, 5",
		"'G,', 4, 3",
		"'B,,', 6, 2",
		"a, 5, 5",
	})
	void stepAndOctave(String note, int step, int octave) {
		WrittenPitch pitch = read(note);
		assertEquals(step, pitch.step());
		assertEquals(octave, pitch.octave());
		assertEquals(note, pitch.lexeme());
	}

	@Test
	void apostropheRaisesTheOctave() {
		WrittenPitch pitch = read("d'");
		assertEquals(1, pitch.step());
		assertEquals(6, pitch.octave());
		assertEquals("d'", pitch.lexeme());
	}

	@Test
	void midi() {
		assertEquals(60, read("C").midi());
		assertEquals(72, read("c").midi());
		assertEquals(62, read("^^C").midi());
		assertEquals(59, read("_C").midi());
		assertEquals(60, read("=C").midi());
		assertEquals(47, read("B,,").midi());
	}

	@Test
	void spellingFromMidi() {
		assertEquals("^C", WrittenPitch.fromMidi(61, false).lexeme());
		assertEquals("_D", WrittenPitch.fromMidi(61, true).lexeme());
		assertEquals("B,", WrittenPitch.fromMidi(59, false).lexeme());
		assertEquals("c'", WrittenPitch.fromMidi(84, true).lexeme());
		assertEquals("C,", WrittenPitch.fromMidi(48, false).lexeme());
	}

	@ParameterizedTest
	@CsvSource({
		"C, 2, E",
		"A, 2, c",
		"c, -2, A",
		"B, 1, c",
		"c, -1, B",
		"G, 4, d",
		"D, -4, 'G,'",
		"^C, 2, ^E",
	})
	void diatonicSteps(String note, int steps, String expected) {
		assertEquals(expected, read(note).stepDiatonic(steps).lexeme());
	}
}
