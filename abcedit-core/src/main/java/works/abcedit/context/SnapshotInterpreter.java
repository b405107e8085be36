package works.abcedit.context;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.NodePayload.TokenData;
import works.abcedit.cst.Tag;
import works.abcedit.cst.exceptions.AbcContentException;
import works.abcedit.cst.io.ReaderSettings;
import works.abcedit.rhythm.Rational;
import works.abcedit.selectors.VoiceMarkers;
import works.abcedit.walk.TreeWalk;

/**
 * Derives {@link DocumentSnapshots} from a tree: one snapshot per tune for its
 * header, and one for each {@code M:}, {@code L:}, {@code K:} or {@code V:} field
 * in a tune body, whether on its own line or inline.
 * <p>
 * Voices keep separate contexts. Switching to a voice restores the context
 * it had when it was last left, or the tune's header context for a voice
 * that hasn't appeared yet, with the clef given by its header declaration.
 * <p>
 * A field value that can't be interpreted is logged and ignored, or with
 * {@link ReaderSettings#isStrict()}, throws {@link AbcContentException}.
 */
public final class SnapshotInterpreter {
	private static final Rational THREE_QUARTERS = Rational.of(3, 4);

	private final ReaderSettings settings;

	public SnapshotInterpreter(ReaderSettings settings) {
		this.settings = settings;
	}

	public static DocumentSnapshots snapshotsOf(CstNode root) {
		return new SnapshotInterpreter(ReaderSettings.DEFAULT).interpret(root);
	}

	public DocumentSnapshots interpret(CstNode root) {
		List<PositionedSnapshot> result = new ArrayList<>();
		HeaderState fileDefaults = new HeaderState(ContextSnapshot.DEFAULT);
		for (CstNode section = root.firstChild(); section != null; section = section.nextSibling()) {
			if (section.is(Tag.File_header)) {
				for (CstNode c = section.firstChild(); c != null; c = c.nextSibling()) {
					if (c.is(Tag.Info_line)) {
						applyHeaderField(fileDefaults, c);
					}
				}
			} else if (section.is(Tag.Tune)) {
				interpretTune(section, fileDefaults.copy(), result);
			}
		}
		LOGGER.debug("Found {} context snapshots", result.size());
		return new DocumentSnapshots(result);
	}

	private void interpretTune(CstNode tune, HeaderState header, List<PositionedSnapshot> result) {
		CstNode headerNode = null;
		CstNode body = null;
		for (CstNode c = tune.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Tune_header)) {
				headerNode = c;
			} else if (c.is(Tag.Tune_Body)) {
				body = c;
			}
		}
		if (headerNode != null) {
			for (CstNode c = headerNode.firstChild(); c != null; c = c.nextSibling()) {
				if (c.is(Tag.Info_line)) {
					applyHeaderField(header, c);
				}
			}
		}
		ContextSnapshot base = header.resolved();
		TokenData start = TreeWalk.positioned(TreeWalk.firstToken(tune));
		if (start != null) {
			result.add(new PositionedSnapshot(DocumentSnapshots.encode(start.line(), start.column()), base));
		}
		if (body == null) {
			return;
		}

		Map<String, ContextSnapshot> voices = new HashMap<>();
		String[] currentVoice = {""};
		ContextSnapshot[] current = {base};
		TreeWalk.forEach(body, node -> {
			if (!node.is(Tag.Info_line) && !node.is(Tag.Inline_field)) {
				return;
			}
			String key = VoiceMarkers.fieldKey(node);
			if (key == null) {
				return;
			}
			String value = VoiceMarkers.fieldValue(node);
			ContextSnapshot next;
			if ("V:".equals(key)) {
				String voiceId = VoiceMarkers.voiceId(node);
				if (voiceId == null) {
					return;
				}
				voices.put(currentVoice[0], current[0]);
				currentVoice[0] = voiceId;
				next = voices.get(voiceId);
				if (next == null) {
					Clef declared = header.voiceClefs.get(voiceId);
					next = declared == null ? base : base.withClef(declared);
				}
				next = applyClef(next, value);
			} else {
				next = applyBodyField(current[0], key, value);
				if (next == null) {
					return;
				}
			}
			current[0] = next;
			TokenData position = TreeWalk.positioned(TreeWalk.firstToken(node));
			if (position != null) {
				result.add(new PositionedSnapshot(DocumentSnapshots.encode(position.line(), position.column()), next));
			}
		});
	}

	private void applyHeaderField(HeaderState state, CstNode field) {
		String key = VoiceMarkers.fieldKey(field);
		String value = VoiceMarkers.fieldValue(field);
		if ("L:".equals(key)) {
			parseNoteLength(value).ifPresent(length -> {
				state.snapshot = state.snapshot.withNoteLength(length);
				state.noteLengthGiven = true;
			});
		} else if ("V:".equals(key)) {
			String voiceId = VoiceMarkers.voiceId(field);
			Clef clef = clefOf(value);
			if (voiceId != null && clef != null) {
				state.voiceClefs.put(voiceId, clef);
			}
		} else if (key != null) {
			ContextSnapshot next = applyBodyField(state.snapshot, key, value);
			if (next != null) {
				state.snapshot = next;
			}
		}
	}

	/**
	 * @return the updated context, or null if this field doesn't affect it
	 */
	private @Nullable ContextSnapshot applyBodyField(ContextSnapshot current, String key, String value) {
		switch (key) {
			case "M:":
				return current.withMeter(parseMeter(value).orElse(current.meter()));
			case "L:":
				return current.withNoteLength(parseNoteLength(value).orElse(current.noteLength()));
			case "K:":
				return applyClef(applyKey(current, value), value);
			default:
				return null;
		}
	}

	/**
	 * The key is the first word that isn't a clef name or a <code>name=value</code> property.
	 */
	private static ContextSnapshot applyKey(ContextSnapshot current, String value) {
		for (String word : words(value)) {
			if (!word.contains("=") && Clef.parse(word).isEmpty()) {
				return current.withKey(word);
			}
		}
		return current;
	}

	private ContextSnapshot applyClef(ContextSnapshot current, String value) {
		Clef clef = clefOf(value);
		return clef == null ? current : current.withClef(clef);
	}

	private @Nullable Clef clefOf(String value) {
		for (String word : words(value)) {
			if (word.startsWith("clef=")) {
				String name = word.substring("clef=".length());
				Optional<Clef> clef = Clef.parse(name);
				if (clef.isEmpty()) {
					contentError("Unrecognized clef: " + name);
				}
				return clef.orElse(null);
			}
		}
		return null;
	}

	/**
	 * Accepts {@code C}, {@code C|}, {@code none}, and fractions whose
	 * numerator may be a sum, like {@code (2+3)/8}.
	 *
	 * @return the length of one measure in whole notes
	 */
	Optional<Rational> parseMeter(String value) {
		String text = value.trim();
		switch (text) {
			case "C":
			case "none":
				return Optional.of(Rational.ONE);
			case "C|":
				return Optional.of(Rational.of(2, 2));
			default:
				break;
		}
		int slash = text.indexOf('/');
		if (slash > 0) {
			String numerator = text.substring(0, slash).trim();
			if (numerator.startsWith("(") && numerator.endsWith(")")) {
				numerator = numerator.substring(1, numerator.length() - 1);
			}
			long n = 0;
			boolean valid = true;
			for (String part : numerator.split("\\+")) {
				long p = parsePositive(part);
				if (p <= 0) {
					valid = false;
					break;
				}
				n += p;
			}
			long d = parsePositive(text.substring(slash + 1));
			if (valid && d > 0) {
				return Optional.of(Rational.of(n, d));
			}
		}
		contentError("Unrecognized meter: " + text);
		return Optional.empty();
	}

	Optional<Rational> parseNoteLength(String value) {
		String text = value.trim();
		int slash = text.indexOf('/');
		long n = parsePositive(slash < 0 ? text : text.substring(0, slash));
		long d = slash < 0 ? 1 : parsePositive(text.substring(slash + 1));
		if (n > 0 && d > 0) {
			return Optional.of(Rational.of(n, d));
		}
		contentError("Unrecognized note length: " + text);
		return Optional.empty();
	}

	/**
	 * @return the value, or -1 if it isn't a positive integer
	 */
	private static long parsePositive(String text) {
		String trimmed = text.trim();
		if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
			return -1;
		}
		try {
			long result = Long.parseLong(trimmed);
			return result > 0 ? result : -1;
		} catch (NumberFormatException e) {
			LOGGER.debug("Number out of range: {}", trimmed, e);
			return -1;
		}
	}

	private void contentError(String message) {
		if (settings.isStrict()) {
			throw new AbcContentException(message);
		}
		LOGGER.warn("{}; keeping the previous value", message);
	}

	private static List<String> words(String value) {
		String trimmed = value.trim();
		return trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+"));
	}

	/**
	 * Context accumulated from header fields, before the default note length is settled.
	 */
	private static final class HeaderState {
		ContextSnapshot snapshot;
		boolean noteLengthGiven;
		final Map<String, Clef> voiceClefs = new HashMap<>();

		HeaderState(ContextSnapshot snapshot) {
			this.snapshot = snapshot;
		}

		HeaderState copy() {
			HeaderState result = new HeaderState(snapshot);
			result.noteLengthGiven = noteLengthGiven;
			result.voiceClefs.putAll(voiceClefs);
			return result;
		}

		/**
		 * Without an {@code L:}, the unit is a sixteenth for meters below 3/4, else an eighth.
		 */
		ContextSnapshot resolved() {
			if (noteLengthGiven) {
				return snapshot;
			}
			Rational length = snapshot.meter().compareTo(THREE_QUARTERS) < 0 ? Rational.of(1, 16) : Rational.of(1, 8);
			return snapshot.withNoteLength(length);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotInterpreter.class);
}
