package works.abcedit.transforms;

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
import works.abcedit.walk.TreeWalk;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

/**
 * Starts a new voice from selected notes.
 * <p>
 * Every music line holding a selected node is copied onto a new line right
 * after it, led by a <code>[V:name]</code> field. In the copy, unselected notes
 * become rests of the same length, chords keep only their selected notes, and
 * grace notes leading into anything unselected are dropped. Selecting a chord,
 * beam or line selects everything in it.
 */
public final class InsertVoiceLine {
	private InsertVoiceLine() { }

	public static Selection insertVoiceLine(Selection input, DocumentContext ctx, String voiceName) {
		try (MDCScope ignored = setupMDC(ctx, "insertVoiceLine")) {
			Set<Long> cursorIds = Scopes.collectCursorIds(input.cursors());
			if (cursorIds.isEmpty()) {
				return input;
			}
			Set<Long> selected = Scopes.expandScopeToDescendants(input.root(), cursorIds);
			int lines = 0;
			for (CstNode tune : TreeWalk.findByTag(input.root(), Tag.Tune)) {
				CstNode body = TreeWalk.findFirstByTag(tune, Tag.Tune_Body);
				if (body == null) {
					continue;
				}
				List<CstNode> systems = new ArrayList<>();
				for (CstNode c = body.firstChild(); c != null; c = c.nextSibling()) {
					if (c.is(Tag.System) && Scopes.hasDescendantInScope(c, selected)) {
						systems.add(c);
					}
				}
				if (systems.isEmpty()) {
					continue;
				}
				CstNode header = TreeWalk.findFirstByTag(tune, Tag.Tune_header);
				if (header != null && !AddVoice.isDeclared(header, voiceName)) {
					AddVoice.addToHeader(ctx, header, voiceName, VoiceParams.NONE);
				}
				// Last line first, so earlier insertions don't disturb later ones
				for (int i = systems.size() - 1; i >= 0; i--) {
					duplicate(ctx, body, systems.get(i), voiceName, selected);
					lines++;
				}
			}
			LOGGER.debug("Inserted {} lines of voice {}", lines, voiceName);
			return input;
		}
	}

	private static void duplicate(DocumentContext ctx, CstNode body, CstNode system, String voiceName, Set<Long> selected) {
		List<CstNode> children = new ArrayList<>();
		children.add(TreeEdits.inlineField(ctx, "V:", voiceName));
		children.add(TreeEdits.ws(ctx));
		for (CstNode c = system.firstChild(); c != null; c = c.nextSibling()) {
			if (!c.isToken(TokenType.EOL)) {
				// Original ids for now, so the copy can be checked against the selection
				children.add(TreeEdits.cloneKeepingIds(c));
			}
		}
		children.add(TreeEdits.eol(ctx));
		CstNode copy = CstNode.branch(ctx, Tag.System);
		copy.setChildren(children);

		removeUnselectedGraceGroups(copy, selected);
		for (CstNode c = copy.firstChild(); c != null; c = c.nextSibling()) {
			keepSelected(ctx, c, selected);
		}
		TreeEdits.reassignIds(copy, ctx);

		CstNode last = system.lastChild();
		if (last == null || !last.isToken(TokenType.EOL)) {
			TreeEdits.appendChild(system, TreeEdits.eol(ctx));
		}
		TreeEdits.insertAfter(body, system, copy);
	}

	/**
	 * A grace group goes when the note it leads into does.
	 * Grace groups leading into nothing are kept.
	 */
	private static void removeUnselectedGraceGroups(CstNode parent, Set<Long> selected) {
		CstNode prev = null;
		CstNode c = parent.firstChild();
		while (c != null) {
			CstNode next = c.nextSibling();
			if (c.is(Tag.Grace_group)) {
				CstNode target = graceTarget(c);
				if (target != null && !isKept(target, selected)) {
					TreeEdits.removeChild(parent, prev, c);
					c = next;
					continue;
				}
			} else if (c.is(Tag.Beam) || c.is(Tag.Tuplet)) {
				removeUnselectedGraceGroups(c, selected);
			}
			prev = c;
			c = next;
		}
	}

	/**
	 * @return the next Note, Chord or Rest, skipping decorations, annotations,
	 * fields and bare tokens; null if something else comes first
	 */
	private static @Nullable CstNode graceTarget(CstNode graceGroup) {
		for (CstNode c = graceGroup.nextSibling(); c != null; c = c.nextSibling()) {
			switch (c.tag()) {
				case Note: case Chord: case Rest:
					return c;
				case Decoration: case Annotation: case ChordSymbol: case Inline_field: case Token:
					break;
				default:
					return null;
			}
		}
		return null;
	}

	private static boolean isKept(CstNode target, Set<Long> selected) {
		if (target.is(Tag.Note)) {
			return selected.contains(target.id());
		} else if (target.is(Tag.Chord)) {
			return hasSelectedNote(target, selected);
		}
		return false;
	}

	private static void keepSelected(DocumentContext ctx, CstNode node, Set<Long> selected) {
		if (node.is(Tag.Note)) {
			if (!selected.contains(node.id())) {
				ToRest.convert(ctx, node);
			}
			return;
		} else if (node.is(Tag.Chord)) {
			if (!hasSelectedNote(node, selected)) {
				ToRest.convert(ctx, node);
			} else {
				List<CstNode> kept = new ArrayList<>();
				for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
					if (!c.is(Tag.Note) || selected.contains(c.id())) {
						kept.add(c);
					}
				}
				node.setChildren(kept);
			}
			return;
		} else if (node.is(Tag.Grace_group)) {
			return;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			keepSelected(ctx, c, selected);
		}
	}

	private static boolean hasSelectedNote(CstNode chord, Set<Long> selected) {
		for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Note) && selected.contains(c.id())) {
				return true;
			}
		}
		return false;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InsertVoiceLine.class);
}
