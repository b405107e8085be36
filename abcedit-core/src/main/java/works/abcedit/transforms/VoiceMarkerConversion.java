package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.selectors.VoiceMarkers;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

/**
 * Switches voice markers in tune bodies between their two spellings:
 * a {@code V:} line of its own, and a {@code [V:]} field at the start of a music line.
 * <p>
 * The field's value is carried over verbatim, so converting one way and then
 * back reproduces the original text. Header {@code V:} lines are never converted.
 */
public final class VoiceMarkerConversion {
	private VoiceMarkerConversion() { }

	/**
	 * Moves each selected body {@code V:} line onto the start of the next music line.
	 * If no music line follows directly, the field gets a line of its own.
	 */
	public static Selection voiceInfoLineToInline(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "voiceInfoLineToInline")) {
			CstNode root = input.root();
			List<CstNode> lines = selected(input, n -> n.is(Tag.Info_line));
			int converted = 0;
			for (CstNode line : lines) {
				TreeEdits.ParentRef ref = TreeEdits.findParent(root, line);
				if (ref == null || !ref.parent().is(Tag.Tune_Body)) {
					continue;
				}
				CstNode body = ref.parent();
				boolean hadEol = false;
				CstNode next = line.nextSibling();
				while (next != null && next.isToken() && next.tokenType().isWhitespace()) {
					hadEol |= next.isToken(TokenType.EOL);
					next = next.nextSibling();
				}
				// Unlink the line along with its line ending
				if (ref.prev() == null) {
					body.firstChild(next);
				} else {
					ref.prev().nextSibling(next);
				}
				line.nextSibling(null);

				CstNode field = TreeEdits.inlineField(ctx, "V:", VoiceMarkers.fieldValue(line));
				if (next != null && next.is(Tag.System)) {
					TreeEdits.insertAfter(next, null, field);
					TreeEdits.insertAfter(next, field, TreeEdits.ws(ctx));
				} else {
					CstNode system = CstNode.branch(ctx, Tag.System, field);
					if (hadEol || next != null) {
						system.appendChild(TreeEdits.eol(ctx));
					}
					if (next == null) {
						TreeEdits.appendChild(body, system);
					} else {
						TreeEdits.insertBefore(body, TreeEdits.findPrev(body, next), next, system);
					}
				}
				converted++;
			}
			LOGGER.debug("Converted {} voice lines to inline fields", converted);
			return input;
		}
	}

	/**
	 * Moves each selected {@code [V:]} field in a tune body onto a line of its own.
	 * Music before the field stays on its line; music after it moves to a new line
	 * following the {@code V:} line.
	 */
	public static Selection voiceInlineToInfoLine(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "voiceInlineToInfoLine")) {
			CstNode root = input.root();
			List<CstNode> fields = selected(input, n -> n.is(Tag.Inline_field));
			int converted = 0;
			for (CstNode field : fields) {
				TreeEdits.ParentRef systemRef = TreeEdits.findParent(root, field);
				if (systemRef == null || !systemRef.parent().is(Tag.System)) {
					continue;
				}
				CstNode system = systemRef.parent();
				TreeEdits.ParentRef bodyRef = TreeEdits.findParent(root, system);
				if (bodyRef == null || !bodyRef.parent().is(Tag.Tune_Body)) {
					continue;
				}
				split(ctx, bodyRef.parent(), bodyRef.prev(), system, field);
				converted++;
			}
			LOGGER.debug("Converted {} inline voice fields to lines", converted);
			return input;
		}
	}

	private static void split(DocumentContext ctx, CstNode body, @Nullable CstNode systemPrev, CstNode system, CstNode field) {
		List<CstNode> before = new ArrayList<>();
		List<CstNode> after = new ArrayList<>();
		CstNode eol = null;
		boolean seenField = false;
		for (CstNode c : system.children()) {
			if (c == field) {
				seenField = true;
			} else if (c.isToken(TokenType.EOL)) {
				eol = c;
			} else if (seenField) {
				after.add(c);
			} else {
				before.add(c);
			}
		}
		trimTrailingSpace(before);
		trimLeadingSpace(after);

		List<CstNode> replacement = new ArrayList<>();
		boolean keepBefore = !before.isEmpty();
		if (keepBefore) {
			before.add(TreeEdits.eol(ctx));
			system.setChildren(before);
			replacement.add(system);
		}
		replacement.add(TreeEdits.infoLine(ctx, "V:", VoiceMarkers.fieldValue(field)));
		if (after.isEmpty()) {
			if (eol != null) {
				replacement.add(eol);
			}
		} else {
			replacement.add(TreeEdits.eol(ctx));
			if (eol != null) {
				after.add(eol);
			}
			CstNode rest = keepBefore ? CstNode.branch(ctx, Tag.System) : system;
			rest.setChildren(after);
			replacement.add(rest);
		}
		TreeEdits.replaceWithSequence(body, systemPrev, system, replacement);
	}

	private static void trimTrailingSpace(List<CstNode> nodes) {
		while (!nodes.isEmpty() && nodes.get(nodes.size() - 1).isToken(TokenType.WS)) {
			nodes.remove(nodes.size() - 1);
		}
	}

	private static void trimLeadingSpace(List<CstNode> nodes) {
		while (!nodes.isEmpty() && nodes.get(0).isToken(TokenType.WS)) {
			nodes.remove(0);
		}
	}

	private static List<CstNode> selected(Selection input, Predicate<CstNode> kind) {
		Set<Long> ids = new HashSet<>();
		for (Set<Long> cursor : input.cursors()) {
			ids.addAll(SelectedNodes.expandContainers(input.root(), cursor));
		}
		return SelectedNodes.inCursor(input.root(), ids, n -> kind.test(n) && VoiceMarkers.isVoiceMarker(n));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(VoiceMarkerConversion.class);
}
