package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.context.ContextSnapshot;
import works.abcedit.context.DocumentSnapshots;
import works.abcedit.context.PositionedSnapshot;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.NodePayload.TokenData;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.rhythm.BrokenRhythm;
import works.abcedit.rhythm.Rational;
import works.abcedit.rhythm.RhythmCodec;
import works.abcedit.scope.Scopes;
import works.abcedit.selectors.VoiceMarkers;
import works.abcedit.walk.TreeWalk;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

/**
 * Rewrites selected music as rhythm slashes: stemless quarter notes
 * ({@code B0} on a treble staff) on the middle line of the staff.
 * <p>
 * Each measure's selected content is replaced by as many slashes as the
 * content fills quarter notes, at least one, and never more than the meter
 * allows. Barlines, annotations and inline fields other than voice markers
 * stay where they are. Each cursor's slashes are bracketed by
 * <code>[K: style=rhythm]</code> and <code>[K: style=normal]</code>.
 * <p>
 * Selecting anything inside a line element, like a note in a beam or chord,
 * selects the whole element, since slashes can't be beamed.
 */
public final class SlashNotation {
	private SlashNotation() { }

	private static final Rational QUARTER = Rational.of(1, 4);

	public static Selection toSlashNotation(Selection input, DocumentContext ctx, DocumentSnapshots snapshots) {
		try (MDCScope ignored = setupMDC(ctx, "toSlashNotation")) {
			int measures = 0;
			for (PSet<Long> cursor : input.cursors()) {
				if (cursor.isEmpty()) {
					continue;
				}
				measures += convertCursor(input.root(), ctx, snapshots, SelectedNodes.expandContainers(input.root(), cursor));
			}
			LOGGER.debug("Converted {} measures to slash notation", measures);
			return input;
		}
	}

	private static int convertCursor(CstNode root, DocumentContext ctx, DocumentSnapshots snapshots, Set<Long> selected) {
		List<Measure> measures = collectMeasures(root, selected);
		if (measures.isEmpty()) {
			return 0;
		}
		long startPos = Long.MAX_VALUE;
		long endPos = Long.MIN_VALUE;
		for (Measure m : measures) {
			for (CstNode node : m.nodes) {
				long pos = position(node);
				if (pos >= 0) {
					startPos = Math.min(startPos, pos);
					endPos = Math.max(endPos, pos);
				}
			}
		}
		List<PositionedSnapshot> inRange = startPos <= endPos
			? snapshots.rangeSnapshots(startPos, endPos + 1)
			: Collections.emptyList();

		List<Measure> split = new ArrayList<>();
		for (Measure m : measures) {
			split.addAll(splitBySnapshot(m, inRange));
		}

		List<CstNode> slashes = new ArrayList<>();
		CstNode firstParent = null;
		CstNode lastParent = null;
		for (Measure m : split) {
			List<CstNode> replacement = replaceWithSlashes(ctx, m);
			if (!replacement.isEmpty()) {
				if (firstParent == null) {
					firstParent = m.parent;
				}
				lastParent = m.parent;
				slashes.addAll(replacement);
			}
		}
		if (slashes.isEmpty()) {
			return split.size();
		}
		CstNode first = slashes.get(0);
		TreeEdits.insertBefore(firstParent, TreeEdits.findPrev(firstParent, first), first, styleMarker(ctx, "rhythm"));
		TreeEdits.insertAfter(lastParent, slashes.get(slashes.size() - 1), styleMarker(ctx, "normal"));
		return split.size();
	}

	/**
	 * A run of selected line elements with no barline between them.
	 */
	private static final class Measure {
		final CstNode parent;
		final List<CstNode> nodes = new ArrayList<>();
		ContextSnapshot snapshot = ContextSnapshot.DEFAULT;

		Measure(CstNode parent) {
			this.parent = parent;
		}
	}

	/**
	 * Measures never span lines, so each one belongs to a single {@link Tag#System}.
	 */
	private static List<Measure> collectMeasures(CstNode root, Set<Long> selected) {
		List<Measure> result = new ArrayList<>();
		for (CstNode system : TreeWalk.findByTag(root, Tag.System)) {
			Measure current = new Measure(system);
			for (CstNode c = system.firstChild(); c != null; c = c.nextSibling()) {
				if (c.is(Tag.BarLine)) {
					flush(current, result);
					current = new Measure(system);
				} else if (isCandidate(c) && (selected.contains(c.id()) || Scopes.hasDescendantInScope(c, selected))) {
					current.nodes.add(c);
				}
			}
			flush(current, result);
		}
		return result;
	}

	private static void flush(Measure measure, List<Measure> into) {
		if (!measure.nodes.isEmpty()) {
			into.add(measure);
		}
	}

	private static boolean isCandidate(CstNode node) {
		switch (node.tag()) {
			case Token:
			case Comment:
			case Line_continuation:
			case Voice_overlay:
				return false;
			default:
				return true;
		}
	}

	/**
	 * Assigns each node the snapshot in effect at its position,
	 * starting a new measure wherever that changes.
	 */
	private static List<Measure> splitBySnapshot(Measure measure, List<PositionedSnapshot> inRange) {
		if (inRange.isEmpty()) {
			return List.of(measure);
		}
		List<Measure> result = new ArrayList<>();
		Measure current = null;
		int currentIndex = -1;
		for (CstNode node : measure.nodes) {
			long pos = position(node);
			int index = pos < 0 ? Math.max(currentIndex, 0) : snapshotIndex(inRange, pos);
			if (current == null || index != currentIndex) {
				current = new Measure(measure.parent);
				current.snapshot = inRange.get(index).snapshot();
				currentIndex = index;
				result.add(current);
			}
			current.nodes.add(node);
		}
		return result;
	}

	private static int snapshotIndex(List<PositionedSnapshot> inRange, long pos) {
		int result = 0;
		for (int i = 1; i < inRange.size(); i++) {
			if (inRange.get(i).pos() <= pos) {
				result = i;
			}
		}
		return result;
	}

	/**
	 * @return the encoded position of the node's first token, or -1 if it has none
	 */
	private static long position(CstNode node) {
		TokenData token = TreeWalk.positioned(TreeWalk.firstToken(node));
		return token == null ? -1 : DocumentSnapshots.encode(token.line(), token.column());
	}

	/**
	 * Whitespace between two replaced nodes goes with them.
	 *
	 * @return the slash notes, in order
	 */
	private static List<CstNode> replaceWithSlashes(DocumentContext ctx, Measure measure) {
		Set<CstNode> removed = Collections.newSetFromMap(new IdentityHashMap<>());
		for (CstNode node : measure.nodes) {
			if (!isPreserved(node)) {
				removed.add(node);
			}
		}
		if (removed.isEmpty()) {
			return List.of();
		}
		List<CstNode> slashes = new ArrayList<>();
		long count = slashCount(measure);
		String pitch = measure.snapshot.clef().slashPitch();
		List<CstNode> slashRun = new ArrayList<>();
		for (long i = 0; i < count; i++) {
			if (i > 0) {
				slashRun.add(TreeEdits.ws(ctx));
			}
			CstNode slash = slashNote(ctx, pitch);
			slashRun.add(slash);
			slashes.add(slash);
		}

		List<CstNode> children = measure.parent.children();
		List<CstNode> result = new ArrayList<>();
		boolean inserted = false;
		for (int i = 0; i < children.size(); i++) {
			CstNode c = children.get(i);
			if (removed.contains(c)) {
				if (!inserted) {
					result.addAll(slashRun);
					inserted = true;
				}
			} else if (!(c.isToken(TokenType.WS) && removedOnBothSides(children, i, removed))) {
				result.add(c);
			}
		}
		measure.parent.setChildren(result);
		return slashes;
	}

	private static boolean removedOnBothSides(List<CstNode> children, int index, Set<CstNode> removed) {
		CstNode before = null;
		for (int i = index - 1; i >= 0 && before == null; i--) {
			if (!children.get(i).isToken(TokenType.WS)) {
				before = children.get(i);
			}
		}
		CstNode after = null;
		for (int i = index + 1; i < children.size() && after == null; i++) {
			if (!children.get(i).isToken(TokenType.WS)) {
				after = children.get(i);
			}
		}
		return before != null && after != null && removed.contains(before) && removed.contains(after);
	}

	private static boolean isPreserved(CstNode node) {
		switch (node.tag()) {
			case BarLine:
			case Annotation:
				return true;
			case Inline_field:
				return !VoiceMarkers.isVoiceMarker(node);
			default:
				return false;
		}
	}

	/**
	 * One slash per quarter note, rounded, counting no more than a full measure.
	 */
	private static long slashCount(Measure measure) {
		Rational actual = duration(measure.nodes, measure.snapshot);
		Rational target = actual.min(measure.snapshot.meter());
		return Math.max(1, target.divide(QUARTER).round());
	}

	/**
	 * Broken rhythm carries from one note to the next, but never out of the given nodes.
	 */
	static Rational duration(List<CstNode> nodes, ContextSnapshot snapshot) {
		Rational total = Rational.ZERO;
		Rational[] pending = {null};
		for (CstNode node : nodes) {
			switch (node.tag()) {
				case Note:
					total = total.add(soundingDuration(RhythmCodec.rhythmChild(node), snapshot, pending));
					break;
				case Chord: {
					CstNode rhythm = RhythmCodec.rhythmChild(node);
					CstNode firstNote = ToRest.firstNote(node);
					if (rhythm == null && firstNote != null) {
						rhythm = RhythmCodec.rhythmChild(firstNote);
					}
					total = total.add(soundingDuration(rhythm, snapshot, pending));
					break;
				}
				case Rest:
					total = total.add(restDuration(RhythmCodec.rhythmChild(node), snapshot, pending));
					break;
				case Beam:
					total = total.add(duration(node.children(), snapshot));
					break;
				case MultiMeasureRest:
					total = total.add(snapshot.meter().multiply(barCount(node)));
					break;
				case BarLine:
					pending[0] = null;
					break;
				default:
					break;
			}
		}
		return total;
	}

	/**
	 * A note or chord of zero length still takes a quarter note's room.
	 */
	private static Rational soundingDuration(@Nullable CstNode rhythm, ContextSnapshot snapshot, Rational[] pending) {
		Rational duration = snapshot.noteLength().multiply(RhythmCodec.rhythmToRational(rhythm));
		if (duration.isZero()) {
			return QUARTER;
		}
		return applyBroken(duration, rhythm, pending);
	}

	private static Rational restDuration(@Nullable CstNode rhythm, ContextSnapshot snapshot, Rational[] pending) {
		Rational duration = snapshot.noteLength().multiply(RhythmCodec.rhythmToRational(rhythm));
		if (pending[0] != null) {
			duration = duration.multiply(pending[0]);
			pending[0] = null;
		}
		return duration;
	}

	private static Rational applyBroken(Rational duration, @Nullable CstNode rhythm, Rational[] pending) {
		Rational result = duration;
		if (pending[0] != null) {
			result = result.multiply(pending[0]);
			pending[0] = null;
		}
		String marker = RhythmCodec.brokenMarker(rhythm);
		if (marker != null) {
			BrokenRhythm broken = BrokenRhythm.of(marker);
			result = result.multiply(broken.first());
			pending[0] = broken.second();
		}
		return result;
	}

	private static long barCount(CstNode multiMeasureRest) {
		for (CstNode c = multiMeasureRest.firstChild(); c != null; c = c.nextSibling()) {
			if (c.isToken(TokenType.RHY_NUMER)) {
				try {
					return Long.parseLong(c.lexeme());
				} catch (NumberFormatException e) {
					LOGGER.warn("Unreadable bar count {}; counting one bar", c.lexeme(), e);
					return 1;
				}
			}
		}
		return 1;
	}

	/**
	 * @param pitch a note letter, optionally followed by octave marks, like {@code "A,"}
	 */
	private static CstNode slashNote(DocumentContext ctx, String pitch) {
		CstNode pitchNode = CstNode.branch(ctx, Tag.Pitch,
			CstNode.syntheticToken(ctx, TokenType.NOTE_LETTER, pitch.substring(0, 1)));
		if (pitch.length() > 1) {
			pitchNode.appendChild(CstNode.syntheticToken(ctx, TokenType.OCTAVE, pitch.substring(1)));
		}
		return CstNode.branch(ctx, Tag.Note, pitchNode,
			CstNode.branch(ctx, Tag.Rhythm, CstNode.syntheticToken(ctx, TokenType.RHY_NUMER, "0")));
	}

	private static CstNode styleMarker(DocumentContext ctx, String style) {
		return TreeEdits.inlineField(ctx, "K:", " style=" + style);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SlashNotation.class);
}
