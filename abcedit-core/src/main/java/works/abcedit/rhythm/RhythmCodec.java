package works.abcedit.rhythm;

import java.math.BigInteger;
import org.jetbrains.annotations.Nullable;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;

/**
 * Converts between {@link Tag#Rhythm} nodes and {@link Rational} multiples
 * of the unit note length.
 * <p>
 * A missing numerator means 1. A run of <code>k</code> slashes with no
 * denominator means <code>2^k</code>; an explicit denominator wins.
 * Broken rhythm markers don't change the written value and are ignored here.
 */
public final class RhythmCodec {
	private RhythmCodec() { }

	/**
	 * @param rhythm a Rhythm node, or null for the implicit 1/1
	 */
	public static Rational rhythmToRational(@Nullable CstNode rhythm) {
		if (rhythm == null) {
			return Rational.ONE;
		}
		BigInteger numerator = BigInteger.ONE;
		BigInteger denominator = BigInteger.ONE;
		int separators = 0;
		boolean explicitDenominator = false;
		for (CstNode t = rhythm.firstChild(); t != null; t = t.nextSibling()) {
			TokenType type = t.tokenType();
			if (type == TokenType.RHY_NUMER) {
				numerator = parseCount(t.lexeme());
			} else if (type == TokenType.RHY_SEP) {
				separators++;
			} else if (type == TokenType.RHY_DENOM) {
				denominator = parseCount(t.lexeme());
				explicitDenominator = true;
			}
		}
		if (!explicitDenominator && separators > 0) {
			denominator = BigInteger.ONE.shiftLeft(separators);
		}
		if (denominator.signum() == 0) {
			denominator = BigInteger.ONE;
		}
		return new Rational(numerator, denominator);
	}

	/**
	 * @return the written duration of a Note, Chord, Rest or y-spacer, from its Rhythm child
	 */
	public static Rational writtenRhythm(CstNode node) {
		return rhythmToRational(rhythmChild(node));
	}

	/**
	 * Builds a Rhythm node from synthetic tokens.
	 *
	 * @param broken a broken rhythm marker to keep, like {@code ">"}, or null
	 * @return null when the value is 1/1 and there's no marker, since then no Rhythm node is needed
	 */
	public static @Nullable CstNode rationalToRhythm(DocumentContext ctx, Rational value, @Nullable String broken) {
		boolean isOne = value.isOne();
		if (isOne && broken == null) {
			return null;
		}
		CstNode result = CstNode.branch(ctx, Tag.Rhythm);
		if (!isOne) {
			BigInteger n = value.numerator();
			BigInteger d = value.denominator();
			boolean unitNumerator = n.equals(BigInteger.ONE);
			boolean wholeNumber = d.equals(BigInteger.ONE);
			if (!unitNumerator || wholeNumber) {
				result.appendChild(CstNode.syntheticToken(ctx, TokenType.RHY_NUMER, n.toString()));
			}
			if (!wholeNumber) {
				result.appendChild(CstNode.syntheticToken(ctx, TokenType.RHY_SEP, "/"));
				if (!unitNumerator || !d.equals(TWO)) {
					result.appendChild(CstNode.syntheticToken(ctx, TokenType.RHY_DENOM, d.toString()));
				}
			}
		}
		if (broken != null) {
			result.appendChild(CstNode.syntheticToken(ctx, TokenType.RHY_BRKN, broken));
		}
		return result;
	}

	/**
	 * @return the text of the encoding, like {@code "3/4"}, or empty for 1/1
	 */
	public static String encode(Rational value) {
		BigInteger n = value.numerator();
		BigInteger d = value.denominator();
		if (d.equals(BigInteger.ONE)) {
			return n.equals(BigInteger.ONE) ? "" : n.toString();
		}
		if (n.equals(BigInteger.ONE)) {
			return d.equals(TWO) ? "/" : "/" + d;
		}
		return n + "/" + d;
	}

	/**
	 * @return the broken rhythm marker of <code>rhythm</code>, or null if it has none
	 */
	public static @Nullable String brokenMarker(@Nullable CstNode rhythm) {
		if (rhythm == null) {
			return null;
		}
		for (CstNode t = rhythm.firstChild(); t != null; t = t.nextSibling()) {
			if (t.isToken(TokenType.RHY_BRKN)) {
				return t.lexeme();
			}
		}
		return null;
	}

	public static @Nullable CstNode rhythmChild(CstNode node) {
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Rhythm)) {
				return c;
			}
		}
		return null;
	}

	/**
	 * The reader only produces digit runs here, so this is exact for any length.
	 */
	private static BigInteger parseCount(@Nullable String lexeme) {
		if (lexeme == null || lexeme.isEmpty()) {
			return BigInteger.ONE;
		}
		return new BigInteger(lexeme);
	}

	private static final BigInteger TWO = BigInteger.valueOf(2);
}
