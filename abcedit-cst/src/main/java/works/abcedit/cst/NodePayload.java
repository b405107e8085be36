package works.abcedit.cst;

import static java.util.Objects.requireNonNull;

/**
 * What a {@link CstNode} carries besides its structure.
 * Leaves carry {@link TokenData}; interior nodes carry {@link Empty}.
 */
public sealed interface NodePayload {
	/**
	 * Line and column of a token that doesn't come from the source text.
	 */
	int SYNTHETIC = -1;

	/**
	 * @param line zero-based, or {@link #SYNTHETIC}
	 * @param column zero-based, or {@link #SYNTHETIC}
	 */
	record TokenData(String lexeme, TokenType tokenType, int line, int column) implements NodePayload {
		public TokenData {
			requireNonNull(lexeme);
			requireNonNull(tokenType);
		}

		public boolean isSynthetic() {
			return line < 0 || column < 0;
		}

		public TokenData withLexeme(String newLexeme) {
			return new TokenData(newLexeme, tokenType, line, column);
		}
	}

	record Empty() implements NodePayload {
		public static final Empty INSTANCE = new Empty();
	}
}
