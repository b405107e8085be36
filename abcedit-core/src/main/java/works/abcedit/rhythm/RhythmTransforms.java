package works.abcedit.rhythm;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.transforms.SelectedNodes;
import works.abcedit.transforms.TreeEdits;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

/**
 * Rhythm edits applied to every selected Note, Chord, Rest and y-spacer.
 * <p>
 * Setting or adding a value that isn't positive gives 1/1. Dividing and
 * multiplying keep a zero duration, like the {@code B0} of slash notation,
 * at zero, so they stay exact inverses. Broken rhythm markers are kept.
 * Each method returns its input, since cursors still name the same nodes.
 */
public final class RhythmTransforms {
	private RhythmTransforms() { }

	static final Set<Tag> RHYTHM_PARENTS = EnumSet.of(Tag.Note, Tag.Chord, Tag.Rest, Tag.YSPACER);

	public static Selection setRhythm(Selection input, DocumentContext ctx, Rational value) {
		return apply(input, ctx, "setRhythm", false, old -> positiveOrOne(value));
	}

	/**
	 * @param factor positive
	 */
	public static Selection divideRhythm(Selection input, DocumentContext ctx, long factor) {
		requirePositive(factor);
		return apply(input, ctx, "divideRhythm", false, old -> old.divide(factor));
	}

	/**
	 * @param factor positive
	 */
	public static Selection multiplyRhythm(Selection input, DocumentContext ctx, long factor) {
		requirePositive(factor);
		return apply(input, ctx, "multiplyRhythm", false, old -> old.multiply(factor));
	}

	/**
	 * Adds <code>amount</code>, which may be negative. Nodes whose rhythm
	 * would come out unchanged are left exactly as written.
	 */
	public static Selection addToRhythm(Selection input, DocumentContext ctx, Rational amount) {
		return apply(input, ctx, "addToRhythm", true, old -> positiveOrOne(old.add(amount)));
	}

	/**
	 * Rewrites the Rhythm child of one node.
	 * A value of 1/1 removes the Rhythm entirely unless it carries a broken rhythm marker.
	 * Negative values are written as 1/1; zero is written as {@code 0}.
	 */
	public static void setNodeRhythm(DocumentContext ctx, CstNode node, Rational value) {
		Rational written = value.numerator().signum() < 0 ? Rational.ONE : value;
		String broken = RhythmCodec.brokenMarker(RhythmCodec.rhythmChild(node));
		TreeEdits.replaceRhythm(node, RhythmCodec.rationalToRhythm(ctx, written, broken));
	}

	private static Selection apply(Selection input, DocumentContext ctx, String operation, boolean skipUnchanged, UnaryOperator<Rational> change) {
		try (MDCScope ignored = setupMDC(ctx, operation)) {
			List<CstNode> nodes = SelectedNodes.all(input, n -> RHYTHM_PARENTS.contains(n.tag()));
			int changed = 0;
			for (CstNode node : nodes) {
				Rational old = RhythmCodec.writtenRhythm(node);
				Rational updated = change.apply(old);
				if (!skipUnchanged || !updated.equals(old)) {
					setNodeRhythm(ctx, node, updated);
					changed++;
				}
			}
			LOGGER.debug("Changed {} of {} selected rhythms", changed, nodes.size());
			return input;
		}
	}

	private static Rational positiveOrOne(Rational value) {
		return value.isPositive() ? value : Rational.ONE;
	}

	private static void requirePositive(long factor) {
		if (factor <= 0) {
			throw new IllegalArgumentException("Factor must be positive: " + factor);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RhythmTransforms.class);
}
