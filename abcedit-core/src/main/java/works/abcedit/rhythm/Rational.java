package works.abcedit.rhythm;

import java.math.BigInteger;

/**
 * An exact fraction, always stored in lowest terms with a positive denominator.
 * Arithmetic never overflows.
 */
public record Rational(BigInteger numerator, BigInteger denominator) implements Comparable<Rational> {
	public static final Rational ZERO = of(0);
	public static final Rational ONE = of(1);

	/**
	 * @throws ArithmeticException if <code>denominator</code> is zero
	 */
	public Rational {
		if (denominator.signum() == 0) {
			throw new ArithmeticException("Zero denominator: " + numerator + "/0");
		}
		if (denominator.signum() < 0) {
			numerator = numerator.negate();
			denominator = denominator.negate();
		}
		BigInteger gcd = numerator.gcd(denominator);
		if (!gcd.equals(BigInteger.ONE)) {
			numerator = numerator.divide(gcd);
			denominator = denominator.divide(gcd);
		}
	}

	public static Rational of(long numerator, long denominator) {
		return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
	}

	public static Rational of(long whole) {
		return new Rational(BigInteger.valueOf(whole), BigInteger.ONE);
	}

	public Rational add(Rational other) {
		return new Rational(
			numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
			denominator.multiply(other.denominator));
	}

	public Rational subtract(Rational other) {
		return add(other.negate());
	}

	public Rational multiply(Rational other) {
		return new Rational(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
	}

	public Rational multiply(long factor) {
		return new Rational(numerator.multiply(BigInteger.valueOf(factor)), denominator);
	}

	/**
	 * @throws ArithmeticException if <code>other</code> is zero
	 */
	public Rational divide(Rational other) {
		return new Rational(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
	}

	/**
	 * @throws ArithmeticException if <code>divisor</code> is zero
	 */
	public Rational divide(long divisor) {
		return new Rational(numerator, denominator.multiply(BigInteger.valueOf(divisor)));
	}

	public Rational negate() {
		return new Rational(numerator.negate(), denominator);
	}

	public Rational min(Rational other) {
		return compareTo(other) <= 0 ? this : other;
	}

	public boolean isPositive() {
		return numerator.signum() > 0;
	}

	public boolean isZero() {
		return numerator.signum() == 0;
	}

	public boolean isOne() {
		return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
	}

	/**
	 * True for durations like 1/8, 1, 2 and 4, which need no tie to write.
	 */
	public boolean isPowerOfTwo() {
		return isPowerOfTwo(numerator) && isPowerOfTwo(denominator);
	}

	/**
	 * Rounds half up.
	 *
	 * @throws ArithmeticException if the result doesn't fit in a long
	 */
	public long round() {
		BigInteger twice = numerator.shiftLeft(1).add(denominator);
		BigInteger[] qr = twice.divideAndRemainder(denominator.shiftLeft(1));
		BigInteger floor = qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
		return floor.longValueExact();
	}

	@Override
	public int compareTo(Rational other) {
		return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
	}

	@Override
	public String toString() {
		return numerator + "/" + denominator;
	}

	static boolean isPowerOfTwo(BigInteger n) {
		return n.signum() > 0 && n.bitCount() == 1;
	}
}
