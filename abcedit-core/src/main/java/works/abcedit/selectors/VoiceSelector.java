package works.abcedit.selectors;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.Tag;
import works.abcedit.scope.Scopes;
import works.abcedit.walk.TreeWalk;

/**
 * Selects the content belonging to one or more voices.
 * <p>
 * The voice in effect changes at every {@code V:} field, whether on its own
 * line or inline; the field itself belongs to the voice it starts.
 * Content before any voice marker belongs to the default voice, named {@code ""}.
 */
public final class VoiceSelector {
	private VoiceSelector() { }

	public static final String DEFAULT_VOICE = "";

	/**
	 * @param voiceIds voice ids separated by spaces, commas or tabs;
	 *                 {@code default} names the default voice
	 * @return one cursor per contiguous run of a matching voice,
	 * or <code>input</code> itself if no node matched
	 */
	public static Selection selectVoices(Selection input, String voiceIds) {
		Set<String> targets = parseTargets(voiceIds);
		if (targets.isEmpty()) {
			return input;
		}
		boolean hasScope = Scopes.hasMeaningfulScope(input);
		Set<Long> scope = hasScope
			? Scopes.expandScopeToDescendants(input.root(), Scopes.collectCursorIds(input.cursors()))
			: Set.of();

		Runs runs = new Runs(targets, scope, hasScope);
		for (CstNode tune : TreeWalk.findByTag(input.root(), Tag.Tune)) {
			CstNode body = TreeWalk.findFirstByTag(tune, Tag.Tune_Body);
			if (body != null) {
				runs.currentVoice = initialVoice(tune);
				runs.walk(body);
				runs.flush();
			}
		}
		if (runs.cursors.isEmpty()) {
			LOGGER.debug("No content for voices {}", targets);
			return input;
		}
		return input.withCursors(runs.cursors);
	}

	static Set<String> parseTargets(String voiceIds) {
		Set<String> result = new LinkedHashSet<>();
		for (String word : voiceIds.split("[ ,\t]+")) {
			if (!word.isEmpty()) {
				result.add(word.equals("default") ? DEFAULT_VOICE : word);
			}
		}
		if (result.size() > 1) {
			result.remove(DEFAULT_VOICE);
		}
		return result;
	}

	/**
	 * A header that declares voices but has no {@code K:} line leaves the body
	 * in the last voice it declared. Otherwise each tune starts in the default voice.
	 */
	private static String initialVoice(CstNode tune) {
		CstNode header = TreeWalk.findFirstByTag(tune, Tag.Tune_header);
		if (header == null) {
			return DEFAULT_VOICE;
		}
		String lastVoice = null;
		for (CstNode c = header.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Info_line) && "K:".equals(VoiceMarkers.fieldKey(c))) {
				return DEFAULT_VOICE;
			}
			String id = VoiceMarkers.voiceId(c);
			if (id != null) {
				lastVoice = id;
			}
		}
		return lastVoice == null ? DEFAULT_VOICE : lastVoice;
	}

	private static final class Runs {
		final Set<String> targets;
		final Set<Long> scope;
		final boolean hasScope;
		final List<PSet<Long>> cursors = new ArrayList<>();
		final List<Long> run = new ArrayList<>();
		String currentVoice = DEFAULT_VOICE;
		@Nullable String runVoice = null;

		Runs(Set<String> targets, Set<Long> scope, boolean hasScope) {
			this.targets = targets;
			this.scope = scope;
			this.hasScope = hasScope;
		}

		void walk(CstNode container) {
			for (CstNode c = container.firstChild(); c != null; c = c.nextSibling()) {
				if (c.is(Tag.System) || c.is(Tag.Music_code)) {
					walk(c);
					continue;
				}
				String id = VoiceMarkers.voiceId(c);
				if (id != null) {
					currentVoice = id;
				}
				if (!targets.contains(currentVoice) || !Scopes.isInScope(c, scope, hasScope)) {
					flush();
					continue;
				}
				if (runVoice != null && !runVoice.equals(currentVoice)) {
					flush();
				}
				run.add(c.id());
				runVoice = currentVoice;
			}
		}

		void flush() {
			if (!run.isEmpty()) {
				cursors.add(Selection.cursorOf(run));
				run.clear();
			}
			runVoice = null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(VoiceSelector.class);
}
