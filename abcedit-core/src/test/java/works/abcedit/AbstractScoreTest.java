package works.abcedit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.io.AbcTreeReader;
import works.abcedit.cst.io.CstPrinter;
import works.abcedit.logback.DocumentLogFilter;
import works.abcedit.logback.DocumentLogFilter.LogController;
import works.abcedit.walk.TreeWalk;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Parsing, printing and lookup helpers for tests that edit a score.
 * Each test gets a fresh {@link DocumentContext} named after it,
 * and a {@link LogController} for silencing warnings it provokes on purpose.
 */
public abstract class AbstractScoreTest {
	protected DocumentContext ctx;
	protected final LogController logController = new LogController();

	@BeforeEach
	void setupContext(TestInfo testInfo) {
		ctx = DocumentContext.builder()
			.name(testInfo.getDisplayName())
			.build();
		DocumentLogFilter.register(ctx, logController);
	}

	@AfterEach
	void tearDownContext() {
		DocumentLogFilter.unregister(ctx);
	}

	protected CstNode parse(String text) {
		return AbcTreeReader.read(text, ctx);
	}

	/**
	 * Wraps music lines in a minimal tune.
	 */
	protected CstNode parseTune(String music) {
		return parse("X:1\nK:C\n" + music + "\n");
	}

	protected static String print(CstNode node) {
		return CstPrinter.print(node);
	}

	/**
	 * @return the printed body of a tune made by {@link #parseTune}, without the trailing newline
	 */
	protected static String printMusic(CstNode root) {
		String text = print(root);
		assertTrue(text.startsWith("X:1\nK:C\n"), () -> "Unexpected header: " + text);
		String music = text.substring("X:1\nK:C\n".length());
		return music.endsWith("\n") ? music.substring(0, music.length() - 1) : music;
	}

	protected static List<CstNode> all(CstNode root, Tag tag) {
		return TreeWalk.findByTag(root, tag);
	}

	protected static CstNode nth(CstNode root, Tag tag, int index) {
		List<CstNode> matches = all(root, tag);
		assertTrue(index < matches.size(), () -> "Only " + matches.size() + " " + tag + " nodes");
		return matches.get(index);
	}

	protected static CstNode first(CstNode root, Tag tag) {
		return nth(root, tag, 0);
	}

	/**
	 * @return a selection with one cursor holding all the given nodes
	 */
	protected static Selection select(CstNode root, CstNode... nodes) {
		List<Long> ids = new ArrayList<>();
		for (CstNode n : nodes) {
			ids.add(n.id());
		}
		return Selection.of(root, List.of(Selection.cursorOf(ids)));
	}

	/**
	 * @return a selection with one singleton cursor per node
	 */
	protected static Selection eachOf(CstNode root, List<CstNode> nodes) {
		return Selection.of(root, nodes.stream()
			.map(n -> Selection.singletonCursor(n.id()))
			.collect(Collectors.toList()));
	}

	/**
	 * The text of each cursor: its outermost nodes printed in document order, concatenated.
	 */
	protected static List<String> cursorTexts(Selection selection) {
		List<String> result = new ArrayList<>();
		for (Set<Long> cursor : selection.cursors()) {
			StringBuilder sb = new StringBuilder();
			appendSelected(selection.root(), cursor, sb);
			result.add(sb.toString());
		}
		return result;
	}

	private static void appendSelected(CstNode node, Set<Long> cursor, StringBuilder sb) {
		if (cursor.contains(node.id())) {
			sb.append(print(node));
			return;
		}
		for (CstNode c = node.firstChild(); c != null; c = c.nextSibling()) {
			appendSelected(c, cursor, sb);
		}
	}
}
