package works.abcedit.cst.exceptions;

import org.junit.jupiter.api.Test;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.io.AbcTreeReader;
import works.abcedit.cst.io.ReaderSettings;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AbcExceptionTest {
	@Test
	void strictReadingFailsAsAFormatProblem() {
		AbcTreeReader reader = new AbcTreeReader(
			DocumentContext.builder().name("strict").build(),
			ReaderSettings.builder().strict(true).build());
		AbcFormatException e = assertThrows(AbcFormatException.class, () -> reader.read("X:1\nK:C\nC ] D\n"));
		assertThat(e.getMessage(), containsString("2:2"));
		assertSame(AbcSyntaxException.class, e.getClass());
	}

	@Test
	void causeIsKept() {
		NumberFormatException cause = new NumberFormatException("x");
		assertSame(cause, new AbcContentException("bad meter", cause).getCause());
		assertSame(cause, new AbcProcessingException(cause).getCause());
	}
}
