package works.abcedit.transforms;

import java.util.Map;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.selectors.TuneSelector;
import works.abcedit.selectors.VoiceMarkers;
import works.abcedit.walk.TreeWalk;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

public final class AddVoice {
	private AddVoice() { }

	/**
	 * Declares a voice in the header of every tune the selection touches,
	 * or of every tune when the selection is the whole document.
	 * The new {@code V:} line goes just before {@code K:}, or at the end of a header that has none.
	 */
	public static Selection addVoice(Selection input, DocumentContext ctx, String voiceId, VoiceParams params) {
		try (MDCScope ignored = setupMDC(ctx, "addVoice")) {
			Map<Long, CstNode> index = TreeWalk.buildIdIndex(input.root());
			int added = 0;
			for (PSet<Long> cursor : TuneSelector.selectTune(input).cursors()) {
				for (Long id : cursor) {
					CstNode header = TreeWalk.findFirstByTag(index.get(id), Tag.Tune_header);
					if (header != null) {
						addToHeader(ctx, header, voiceId, params);
						added++;
					}
				}
			}
			LOGGER.debug("Declared voice {} in {} tunes", voiceId, added);
			return input;
		}
	}

	/**
	 * @return true if <code>header</code> has a {@code V:} line for <code>voiceId</code>
	 */
	public static boolean isDeclared(CstNode header, String voiceId) {
		for (CstNode c = header.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Info_line) && voiceId.equals(VoiceMarkers.voiceId(c))) {
				return true;
			}
		}
		return false;
	}

	static void addToHeader(DocumentContext ctx, CstNode header, String voiceId, VoiceParams params) {
		CstNode line = TreeEdits.infoLine(ctx, "V:", params.fieldValue(voiceId));
		CstNode prev = null;
		for (CstNode c = header.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Info_line) && "K:".equals(VoiceMarkers.fieldKey(c))) {
				TreeEdits.insertBefore(header, prev, c, line);
				TreeEdits.insertAfter(header, line, TreeEdits.eol(ctx));
				return;
			}
			prev = c;
		}
		CstNode last = header.lastChild();
		if (last != null && !last.isToken(TokenType.EOL)) {
			TreeEdits.appendChild(header, TreeEdits.eol(ctx));
		}
		TreeEdits.appendChild(header, line);
		TreeEdits.appendChild(header, TreeEdits.eol(ctx));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AddVoice.class);
}
