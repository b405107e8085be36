package works.abcedit.pitch;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.scope.Scopes;
import works.abcedit.transforms.SelectedNodes;
import works.abcedit.transforms.TreeEdits;
import works.abcedit.transforms.TreeEdits.ChildRef;
import works.abcedit.transforms.TreeEdits.ParentRef;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

/**
 * Pitch edits applied to every selected note.
 * <p>
 * A note is selected if its id is in a cursor, if it sits in a selected
 * chord or grace group, or if it is anywhere inside a selected container
 * such as a beam, line or tune. Key signatures are not consulted:
 * pitches are read and written exactly as spelled.
 * Each method returns its input, since cursors still name the same nodes.
 */
public final class PitchTransforms {
	private PitchTransforms() { }

	/**
	 * Moves each note by <code>semitones</code>, spelling black keys with sharps.
	 */
	public static Selection transpose(Selection input, DocumentContext ctx, int semitones) {
		if (semitones == 0) {
			return input;
		}
		try (MDCScope ignored = setupMDC(ctx, "transpose")) {
			int changed = 0;
			for (CstNode note : selectedNotes(input)) {
				CstNode pitchNode = pitchOf(note);
				WrittenPitch pitch = pitchNode == null ? null : WrittenPitch.of(pitchNode);
				if (pitch != null) {
					respell(ctx, pitchNode, WrittenPitch.fromMidi(pitch.midi() + semitones, false));
					changed++;
				}
			}
			LOGGER.debug("Transposed {} notes by {}", changed, semitones);
			return input;
		}
	}

	/**
	 * Respells sharpened notes with flats and flattened notes with sharps.
	 * Notes without an accidental, or with a natural, are left alone;
	 * double accidentals may come out as a plain letter.
	 */
	public static Selection enharmonize(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "enharmonize")) {
			int changed = 0;
			for (CstNode note : selectedNotes(input)) {
				CstNode pitchNode = pitchOf(note);
				WrittenPitch pitch = pitchNode == null ? null : WrittenPitch.of(pitchNode);
				if (pitch == null || pitch.accidental() == null || pitch.alteration() == 0) {
					continue;
				}
				int midi = pitch.midi();
				if (midi < 0 || midi > 127) {
					continue;
				}
				respell(ctx, pitchNode, WrittenPitch.fromMidi(midi, pitch.alteration() > 0));
				changed++;
			}
			LOGGER.debug("Enharmonized {} notes", changed);
			return input;
		}
	}

	/**
	 * Raises each note's accidental one step: flat to none, none or natural to sharp,
	 * sharp to double sharp. A double sharp stays as it is.
	 */
	public static Selection addSharp(Selection input, DocumentContext ctx) {
		return addAccidental(input, ctx, "addSharp", 1);
	}

	/**
	 * The mirror image of {@link #addSharp}.
	 */
	public static Selection addFlat(Selection input, DocumentContext ctx) {
		return addAccidental(input, ctx, "addFlat", -1);
	}

	/**
	 * Adds a note <code>steps</code> scale degrees away from each selected note,
	 * keeping its accidental. A lone note becomes a two-note chord that takes over
	 * its rhythm and tie; in a chord, the new notes follow the existing ones.
	 * Grace notes are skipped.
	 *
	 * @param steps 2 for a third above, -4 for a fifth below, and so on
	 */
	public static Selection harmonize(Selection input, DocumentContext ctx, int steps) {
		if (steps == 0) {
			return input;
		}
		try (MDCScope ignored = setupMDC(ctx, "harmonize")) {
			CstNode root = input.root();
			Set<Long> ids = SelectedNodes.expandContainers(root, Scopes.collectCursorIds(input.cursors()));
			List<CstNode> chords = new ArrayList<>();
			List<CstNode> notes = new ArrayList<>();
			collectHarmonyTargets(root, ids, chords, notes);
			for (CstNode chord : chords) {
				harmonizeChord(ctx, chord, steps);
			}
			for (CstNode note : notes) {
				ParentRef ref = TreeEdits.findParent(root, note);
				if (ref == null) {
					continue;
				}
				if (ref.parent().is(Tag.Chord)) {
					CstNode harmony = harmonyNote(ctx, note, steps);
					if (harmony != null) {
						TreeEdits.insertAfter(ref.parent(), note, harmony);
					}
				} else {
					wrapInChord(ctx, ref, note, steps);
				}
			}
			LOGGER.debug("Harmonized {} chords and {} notes by {} steps", chords.size(), notes.size(), steps);
			return input;
		}
	}

	/**
	 * @return the selected notes in document order, each once
	 */
	static List<CstNode> selectedNotes(Selection input) {
		CstNode root = input.root();
		Set<Long> ids = SelectedNodes.expandContainers(root, Scopes.collectCursorIds(input.cursors()));
		List<CstNode> result = new ArrayList<>();
		collectNotes(root, ids, false, result);
		return result;
	}

	private static void collectNotes(CstNode node, Set<Long> ids, boolean inherited, List<CstNode> out) {
		boolean selected = inherited || ids.contains(node.id());
		if (node.is(Tag.Note)) {
			if (selected) {
				out.add(node);
			}
			return;
		}
		boolean passDown = selected && (node.is(Tag.Chord) || node.is(Tag.Grace_group));
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			collectNotes(c, ids, passDown, out);
		}
	}

	private static void collectHarmonyTargets(CstNode node, Set<Long> ids, List<CstNode> chords, List<CstNode> notes) {
		if (node.is(Tag.Grace_group)) {
			return;
		}
		if (node.is(Tag.Chord) && ids.contains(node.id())) {
			chords.add(node);
			return;
		}
		if (node.is(Tag.Note)) {
			if (ids.contains(node.id())) {
				notes.add(node);
			}
			return;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			collectHarmonyTargets(c, ids, chords, notes);
		}
	}

	private static Selection addAccidental(Selection input, DocumentContext ctx, String operation, int direction) {
		try (MDCScope ignored = setupMDC(ctx, operation)) {
			int changed = 0;
			for (CstNode note : selectedNotes(input)) {
				CstNode pitchNode = pitchOf(note);
				if (pitchNode != null && shiftAccidental(ctx, pitchNode, direction)) {
					changed++;
				}
			}
			LOGGER.debug("Changed the accidental of {} notes", changed);
			return input;
		}
	}

	/**
	 * Rewrites only the accidental token, so the letter and octave keep their source positions.
	 *
	 * @return false if the accidental was already at the limit
	 */
	private static boolean shiftAccidental(DocumentContext ctx, CstNode pitchNode, int direction) {
		ChildRef letter = TreeEdits.findChildToken(pitchNode, TokenType.NOTE_LETTER);
		if (letter == null) {
			return false;
		}
		ChildRef existing = TreeEdits.findChildToken(pitchNode, TokenType.ACCIDENTAL);
		WrittenPitch pitch = WrittenPitch.of(pitchNode);
		int current = pitch == null ? 0 : pitch.alteration();
		int updated = current + direction;
		if (Math.abs(updated) > 2) {
			return false;
		}
		if (updated == 0) {
			// Only reachable from a sharp or flat, so there is a token to remove
			TreeEdits.removeChild(pitchNode, existing.prev(), existing.node());
			return true;
		}
		CstNode token = CstNode.syntheticToken(ctx, TokenType.ACCIDENTAL, (updated > 0 ? "^" : "_").repeat(Math.abs(updated)));
		if (existing == null) {
			TreeEdits.insertBefore(pitchNode, letter.prev(), letter.node(), token);
		} else {
			TreeEdits.replaceChild(pitchNode, existing.prev(), existing.node(), token);
		}
		return true;
	}

	private static void harmonizeChord(DocumentContext ctx, CstNode chord, int steps) {
		CstNode last = null;
		List<CstNode> harmonies = new ArrayList<>();
		for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Note)) {
				last = c;
				CstNode harmony = harmonyNote(ctx, c, steps);
				if (harmony != null) {
					harmonies.add(harmony);
				}
			}
		}
		for (CstNode harmony : harmonies) {
			TreeEdits.insertAfter(chord, last, harmony);
			last = harmony;
		}
	}

	private static void wrapInChord(DocumentContext ctx, ParentRef ref, CstNode note, int steps) {
		CstNode harmony = harmonyNote(ctx, note, steps);
		if (harmony == null) {
			return;
		}
		CstNode rhythm = detach(note, TreeEdits.findRhythmChild(note));
		CstNode tie = detach(note, TreeEdits.findTieChild(note));
		CstNode chord = CstNode.branch(ctx, Tag.Chord);
		TreeEdits.replaceChild(ref.parent(), ref.prev(), note, chord);
		TreeEdits.appendChild(chord, CstNode.syntheticToken(ctx, TokenType.CHRD_LEFT_BRKT, "["));
		TreeEdits.appendChild(chord, note);
		TreeEdits.appendChild(chord, harmony);
		TreeEdits.appendChild(chord, CstNode.syntheticToken(ctx, TokenType.CHRD_RIGHT_BRKT, "]"));
		if (rhythm != null) {
			TreeEdits.appendChild(chord, rhythm);
		}
		if (tie != null) {
			TreeEdits.appendChild(chord, tie);
		}
	}

	private static @Nullable CstNode detach(CstNode parent, @Nullable ChildRef ref) {
		if (ref == null) {
			return null;
		}
		TreeEdits.removeChild(parent, ref.prev(), ref.node());
		return ref.node();
	}

	/**
	 * @return a new note with just a pitch, or null if <code>note</code> has no readable pitch
	 */
	private static @Nullable CstNode harmonyNote(DocumentContext ctx, CstNode note, int steps) {
		CstNode pitchNode = pitchOf(note);
		WrittenPitch pitch = pitchNode == null ? null : WrittenPitch.of(pitchNode);
		if (pitch == null) {
			return null;
		}
		return CstNode.branch(ctx, Tag.Note, pitch.stepDiatonic(steps).toNode(ctx));
	}

	private static @Nullable CstNode pitchOf(CstNode note) {
		ChildRef ref = TreeEdits.findChildByTag(note, Tag.Pitch);
		return ref == null ? null : ref.node();
	}

	/**
	 * Keeps the Pitch node, and with it its id, replacing only its tokens.
	 */
	private static void respell(DocumentContext ctx, CstNode pitchNode, WrittenPitch pitch) {
		pitchNode.setChildren(List.of(pitch.tokens(ctx)));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PitchTransforms.class);
}
