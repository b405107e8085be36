package works.abcedit.transforms;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.pcollections.PSet;
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
 * Splits chordal lines into one line per part.
 * <p>
 * Every music line holding a selected node gets <code>partCount</code> copies
 * inserted after it, top part first. Part 0 takes the highest written note of
 * each chord and keeps standalone notes and grace notes; part <i>n</i> takes the
 * <i>n</i>th note down, turns standalone notes into rests and drops grace notes.
 * A chord with too few notes becomes a rest. Adjacent rests in each copy are
 * then consolidated. The original line is left as it was.
 */
public final class Explode {
	private Explode() { }

	/**
	 * @return one cursor per inserted line, holding every node in it
	 */
	public static Selection explode(Selection input, DocumentContext ctx, int partCount) {
		if (partCount < 1) {
			return input;
		}
		try (MDCScope ignored = setupMDC(ctx, "explode")) {
			Set<Long> cursorIds = Scopes.collectCursorIds(input.cursors());
			if (cursorIds.isEmpty()) {
				return input;
			}
			Set<Long> selected = Scopes.expandScopeToDescendants(input.root(), cursorIds);
			List<PSet<Long>> result = new ArrayList<>();
			for (CstNode body : TreeWalk.findByTag(input.root(), Tag.Tune_Body)) {
				List<CstNode> systems = new ArrayList<>();
				for (CstNode c = body.firstChild(); c != null; c = c.nextSibling()) {
					if (c.is(Tag.System) && Scopes.hasDescendantInScope(c, selected)) {
						systems.add(c);
					}
				}
				for (CstNode system : systems) {
					CstNode last = system.lastChild();
					if (last == null || !last.isToken(TokenType.EOL)) {
						TreeEdits.appendChild(system, TreeEdits.eol(ctx));
					}
					CstNode anchor = system;
					for (int part = 0; part < partCount; part++) {
						CstNode copy = extractPart(ctx, system, part);
						TreeEdits.insertAfter(body, anchor, copy);
						result.add(Selection.cursorOf(descendantIds(copy)));
						anchor = copy;
					}
				}
			}
			LOGGER.debug("Exploded into {} lines of {} parts", result.size(), partCount);
			return input.withCursors(result);
		}
	}

	public static Selection explode2(Selection input, DocumentContext ctx) {
		return explode(input, ctx, 2);
	}

	public static Selection explode3(Selection input, DocumentContext ctx) {
		return explode(input, ctx, 3);
	}

	public static Selection explode4(Selection input, DocumentContext ctx) {
		return explode(input, ctx, 4);
	}

	private static CstNode extractPart(DocumentContext ctx, CstNode system, int part) {
		List<CstNode> children = new ArrayList<>();
		for (CstNode c = system.firstChild(); c != null; c = c.nextSibling()) {
			children.add(TreeEdits.cloneWithFreshIds(c, ctx));
		}
		CstNode copy = CstNode.branch(ctx, Tag.System);
		copy.setChildren(children);
		if (part > 0) {
			removeGraceGroups(copy);
		}
		keepPart(ctx, copy, part);
		ConsolidateRests.consolidateRests(Selection.of(copy), ctx);
		return copy;
	}

	private static void keepPart(DocumentContext ctx, CstNode parent, int part) {
		for (CstNode c = parent.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Chord)) {
				keepChordNote(ctx, c, part);
			} else if (c.is(Tag.Note)) {
				if (part > 0) {
					ToRest.convert(ctx, c);
				}
			} else if (c.is(Tag.Beam) || c.is(Tag.Tuplet)) {
				keepPart(ctx, c, part);
			}
		}
	}

	/**
	 * Counts from the last written note, which is taken as the top one.
	 */
	private static void keepChordNote(DocumentContext ctx, CstNode chord, int part) {
		List<CstNode> notes = new ArrayList<>();
		for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
			if (c.is(Tag.Note)) {
				notes.add(c);
			}
		}
		int index = notes.size() - 1 - part;
		if (index < 0) {
			ToRest.convert(ctx, chord);
			return;
		}
		CstNode keep = notes.get(index);
		List<CstNode> kept = new ArrayList<>();
		for (CstNode c = chord.firstChild(); c != null; c = c.nextSibling()) {
			if (!c.is(Tag.Note) || c == keep) {
				kept.add(c);
			}
		}
		chord.setChildren(kept);
		UnwrapSingle.unwrap(chord, keep);
	}

	private static void removeGraceGroups(CstNode parent) {
		CstNode prev = null;
		CstNode c = parent.firstChild();
		while (c != null) {
			CstNode next = c.nextSibling();
			if (c.is(Tag.Grace_group)) {
				TreeEdits.removeChild(parent, prev, c);
			} else {
				if (c.is(Tag.Beam) || c.is(Tag.Tuplet)) {
					removeGraceGroups(c);
				}
				prev = c;
			}
			c = next;
		}
	}

	private static Set<Long> descendantIds(CstNode system) {
		Set<Long> result = new HashSet<>();
		TreeWalk.forEach(system, n -> result.add(n.id()));
		result.remove(system.id());
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Explode.class);
}
