package works.abcedit.cst.io;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;

import static works.abcedit.cst.TokenType.COMMENT;
import static works.abcedit.cst.TokenType.DIRECTIVE;
import static works.abcedit.cst.TokenType.EOL;
import static works.abcedit.cst.TokenType.INFO_STR;
import static works.abcedit.cst.TokenType.INF_HDR;
import static works.abcedit.cst.TokenType.WS;
import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

/**
 * Reads ABC text into a lossless {@link CstNode} tree rooted at a
 * {@link Tag#File_structure} node.
 * <p>
 * The text is first split into physical lines, then into sections
 * separated by blank lines. Each section becomes a {@link Tag#File_header}
 * or a {@link Tag#Tune}; the blank lines themselves become tokens directly
 * under the root.
 * <p>
 * Every character of the input lands in exactly one token,
 * so {@link CstPrinter#print} of the result returns the input.
 */
public final class AbcTreeReader {
	private final DocumentContext ctx;
	private final ReaderSettings settings;

	public AbcTreeReader(DocumentContext ctx, ReaderSettings settings) {
		this.ctx = ctx;
		this.settings = settings;
	}

	public static CstNode read(String text, DocumentContext ctx) {
		return new AbcTreeReader(ctx, ReaderSettings.DEFAULT).read(text);
	}

	public CstNode read(String text) {
		try (MDCScope ignored = setupMDC(ctx, "read")) {
			List<SourceLine> lines = splitLines(text);
			CstNode root = CstNode.branch(ctx, Tag.File_structure);
			List<SourceLine> section = new ArrayList<>();
			int sections = 0;
			boolean first = true;
			for (SourceLine line : lines) {
				if (line.isBlank()) {
					if (!section.isEmpty()) {
						root.appendChild(section(section, first));
						sections++;
						first = false;
						section.clear();
					}
					appendLineTokens(root, line, WS);
				} else {
					section.add(line);
				}
			}
			if (!section.isEmpty()) {
				root.appendChild(section(section, first));
				sections++;
			}
			LOGGER.debug("Read {} lines into {} sections", lines.size(), sections);
			return root;
		}
	}

	private CstNode section(List<SourceLine> lines, boolean first) {
		boolean startsWithX = lines.get(0).content().startsWith("X:");
		boolean hasMusic = lines.stream().anyMatch(l -> l.kind() == LineKind.MUSIC);
		if (first && !startsWithX && !hasMusic) {
			CstNode header = CstNode.branch(ctx, Tag.File_header);
			lines.forEach(l -> appendHeaderLine(header, l));
			return header;
		}
		return tune(lines);
	}

	private CstNode tune(List<SourceLine> lines) {
		int headerEnd = headerLength(lines);
		CstNode header = CstNode.branch(ctx, Tag.Tune_header);
		for (SourceLine line : lines.subList(0, headerEnd)) {
			appendHeaderLine(header, line);
		}
		CstNode body = CstNode.branch(ctx, Tag.Tune_Body);
		for (SourceLine line : lines.subList(headerEnd, lines.size())) {
			if (line.kind() == LineKind.MUSIC) {
				CstNode system = CstNode.branch(ctx, Tag.System);
				for (CstNode element : new MusicLineParser(ctx, settings, line.content(), line.number()).parse()) {
					system.appendChild(element);
				}
				if (!line.eol().isEmpty()) {
					system.appendChild(eolToken(line));
				}
				body.appendChild(system);
			} else {
				appendHeaderLine(body, line);
			}
		}
		return CstNode.branch(ctx, Tag.Tune, header, body);
	}

	/**
	 * The header runs up to and including the {@code K:} line.
	 * Without one, it stops at the first line that isn't a field, comment or directive.
	 */
	private static int headerLength(List<SourceLine> lines) {
		for (int i = 0; i < lines.size(); i++) {
			SourceLine line = lines.get(i);
			if (line.kind() == LineKind.MUSIC) {
				return i;
			}
			if (line.content().startsWith("K:")) {
				return i + 1;
			}
		}
		return lines.size();
	}

	/**
	 * Appends a non-music line's node, followed by its EOL token, to <code>parent</code>.
	 */
	private void appendHeaderLine(CstNode parent, SourceLine line) {
		String content = line.content();
		switch (line.kind()) {
			case INFO: {
				CstNode info = CstNode.branch(ctx, Tag.Info_line,
					CstNode.token(ctx, INF_HDR, content.substring(0, 2), line.number(), 0));
				if (content.length() > 2) {
					info.appendChild(CstNode.token(ctx, INFO_STR, content.substring(2), line.number(), 2));
				}
				parent.appendChild(info);
				break;
			}
			case COMMENT:
				parent.appendChild(CstNode.branch(ctx, Tag.Comment,
					CstNode.token(ctx, COMMENT, content, line.number(), 0)));
				break;
			case DIRECTIVE:
				parent.appendChild(CstNode.branch(ctx, Tag.Directive,
					CstNode.token(ctx, DIRECTIVE, content, line.number(), 0)));
				break;
			default:
				throw new AssertionError("Music line outside a tune body: " + line);
		}
		if (!line.eol().isEmpty()) {
			parent.appendChild(eolToken(line));
		}
	}

	private void appendLineTokens(CstNode parent, SourceLine line, TokenType contentType) {
		if (!line.content().isEmpty()) {
			parent.appendChild(CstNode.token(ctx, contentType, line.content(), line.number(), 0));
		}
		if (!line.eol().isEmpty()) {
			parent.appendChild(eolToken(line));
		}
	}

	private CstNode eolToken(SourceLine line) {
		return CstNode.token(ctx, EOL, line.eol(), line.number(), line.content().length());
	}

	static List<SourceLine> splitLines(String text) {
		List<SourceLine> result = new ArrayList<>();
		int start = 0;
		int number = 0;
		while (start < text.length()) {
			int nl = text.indexOf('\n', start);
			if (nl < 0) {
				result.add(new SourceLine(number, text.substring(start), ""));
				break;
			}
			int contentEnd = (nl > start && text.charAt(nl - 1) == '\r') ? nl - 1 : nl;
			result.add(new SourceLine(number, text.substring(start, contentEnd), text.substring(contentEnd, nl + 1)));
			start = nl + 1;
			number++;
		}
		return result;
	}

	enum LineKind { INFO, COMMENT, DIRECTIVE, MUSIC }

	record SourceLine(int number, String content, String eol) {
		boolean isBlank() {
			return content.isBlank();
		}

		LineKind kind() {
			if (content.startsWith("%%")) {
				return LineKind.DIRECTIVE;
			} else if (content.startsWith("%")) {
				return LineKind.COMMENT;
			} else if (content.length() >= 2 && content.charAt(1) == ':'
				&& (MusicLineParser.isLetter(content.charAt(0)) || content.charAt(0) == '+')) {
				return LineKind.INFO;
			}
			return LineKind.MUSIC;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbcTreeReader.class);
}
