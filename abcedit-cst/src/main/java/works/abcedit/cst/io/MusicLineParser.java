package works.abcedit.cst.io;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.cst.Tag;
import works.abcedit.cst.TokenType;
import works.abcedit.cst.exceptions.AbcSyntaxException;

import static works.abcedit.cst.TokenType.ACCIDENTAL;
import static works.abcedit.cst.TokenType.ANNOTATION;
import static works.abcedit.cst.TokenType.BARLINE;
import static works.abcedit.cst.TokenType.CHORD_SYMBOL;
import static works.abcedit.cst.TokenType.CHRD_LEFT_BRKT;
import static works.abcedit.cst.TokenType.CHRD_RIGHT_BRKT;
import static works.abcedit.cst.TokenType.COMMENT;
import static works.abcedit.cst.TokenType.DECORATION;
import static works.abcedit.cst.TokenType.GRC_GRP_LEFT_BRACE;
import static works.abcedit.cst.TokenType.GRC_GRP_RGHT_BRACE;
import static works.abcedit.cst.TokenType.GRC_GRP_SLSH;
import static works.abcedit.cst.TokenType.INFO_STR;
import static works.abcedit.cst.TokenType.INF_HDR;
import static works.abcedit.cst.TokenType.INLN_FLD_LFT_BRKT;
import static works.abcedit.cst.TokenType.INLN_FLD_RGT_BRKT;
import static works.abcedit.cst.TokenType.INVALID;
import static works.abcedit.cst.TokenType.LINE_CONT;
import static works.abcedit.cst.TokenType.LPAREN;
import static works.abcedit.cst.TokenType.MMREST;
import static works.abcedit.cst.TokenType.NOTE_LETTER;
import static works.abcedit.cst.TokenType.OCTAVE;
import static works.abcedit.cst.TokenType.REST;
import static works.abcedit.cst.TokenType.RHY_BRKN;
import static works.abcedit.cst.TokenType.RHY_DENOM;
import static works.abcedit.cst.TokenType.RHY_NUMER;
import static works.abcedit.cst.TokenType.RHY_SEP;
import static works.abcedit.cst.TokenType.RPAREN;
import static works.abcedit.cst.TokenType.TIE;
import static works.abcedit.cst.TokenType.TUPLET_COLON;
import static works.abcedit.cst.TokenType.TUPLET_LPAREN;
import static works.abcedit.cst.TokenType.TUPLET_P;
import static works.abcedit.cst.TokenType.TUPLET_Q;
import static works.abcedit.cst.TokenType.TUPLET_R;
import static works.abcedit.cst.TokenType.VOICE_OVRLAY;
import static works.abcedit.cst.TokenType.WS;

/**
 * Splits the text of one music line into element nodes.
 * <p>
 * Works on a char array with a single position index,
 * and never looks past the end of the line.
 * Every character ends up in exactly one token,
 * so printing the result reproduces the line.
 */
final class MusicLineParser {
	private final DocumentContext ctx;
	private final ReaderSettings settings;
	private final char[] chars;
	private final int line;
	private int pos = 0;

	MusicLineParser(DocumentContext ctx, ReaderSettings settings, String content, int line) {
		this.ctx = ctx;
		this.settings = settings;
		this.chars = content.toCharArray();
		this.line = line;
	}

	/**
	 * @return the line's top-level nodes, with beamed runs already grouped
	 */
	List<CstNode> parse() {
		List<CstNode> elements = new ArrayList<>();
		while (pos < chars.length) {
			elements.add(parseElement());
		}
		return groupBeams(elements);
	}

	private int peek() {
		return pos < chars.length ? chars[pos] : -1;
	}

	private int peek(int offset) {
		int i = pos + offset;
		return i < chars.length ? chars[i] : -1;
	}

	private CstNode parseElement() {
		int c = peek();
		switch (c) {
			case ' ', '\t': return whitespace();
			case '%': return single(Tag.Comment, COMMENT, chars.length - pos);
			case '\\': return single(Tag.Line_continuation, LINE_CONT, 1);
			case '&': return single(Tag.Voice_overlay, VOICE_OVRLAY, 1);
			case '"': return quoted();
			case '!', '+': return delimitedDecoration((char) c);
			case '.', '~', 'H', 'L', 'M', 'O', 'P', 'S', 'T', 'u', 'v':
				return single(Tag.Decoration, DECORATION, 1);
			case '[': return openBracket();
			case '{': return graceGroup();
			case '|', ':': return barLine();
			case '(': return openParen();
			case ')': return token(RPAREN, 1);
			case 'z', 'x': return rest();
			case 'Z', 'X': return multiMeasureRest();
			case 'y': return ySpacer();
			default:
				CstNode note = note();
				return note != null ? note : error();
		}
	}

	private CstNode whitespace() {
		int start = pos;
		while (peek() == ' ' || peek() == '\t') {
			pos++;
		}
		return tokenFrom(WS, start);
	}

	private CstNode token(TokenType type, int length) {
		int start = pos;
		pos += length;
		return tokenFrom(type, start);
	}

	private CstNode tokenFrom(TokenType type, int start) {
		return CstNode.token(ctx, type, new String(chars, start, pos - start), line, start);
	}

	private CstNode single(Tag tag, TokenType type, int length) {
		return CstNode.branch(ctx, tag, token(type, length));
	}

	private CstNode error() {
		int column = pos;
		char c = chars[pos];
		if (settings.isStrict()) {
			throw new AbcSyntaxException("Unexpected character '" + c + "' at " + line + ":" + column);
		}
		if (settings.isWarnOnErrors()) {
			LOGGER.warn("Unexpected character '{}' at {}:{}", c, line, column);
		}
		return single(Tag.ErrorExpr, INVALID, 1);
	}

	private CstNode quoted() {
		int end = indexOf('"', pos + 1);
		int length = (end < 0 ? chars.length : end + 1) - pos;
		int first = peek(1);
		if (first == '^' || first == '_' || first == '<' || first == '>' || first == '@') {
			return single(Tag.Annotation, ANNOTATION, length);
		} else {
			return single(Tag.ChordSymbol, CHORD_SYMBOL, length);
		}
	}

	private CstNode delimitedDecoration(char delimiter) {
		int end = indexOf(delimiter, pos + 1);
		if (end < 0) {
			return error();
		}
		return single(Tag.Decoration, DECORATION, end + 1 - pos);
	}

	private CstNode openBracket() {
		int next = peek(1);
		if (isLetter(next) && peek(2) == ':') {
			return inlineField();
		} else if (next == '|' || isDigit(next)) {
			return barLine();
		}
		CstNode chord = chord();
		return chord != null ? chord : error();
	}

	private CstNode inlineField() {
		CstNode result = CstNode.branch(ctx, Tag.Inline_field);
		result.appendChild(token(INLN_FLD_LFT_BRKT, 1));
		result.appendChild(token(INF_HDR, 2));
		int end = indexOf(']', pos);
		int contentEnd = end < 0 ? chars.length : end;
		if (contentEnd > pos) {
			result.appendChild(token(INFO_STR, contentEnd - pos));
		}
		if (end >= 0) {
			result.appendChild(token(INLN_FLD_RGT_BRKT, 1));
		}
		return result;
	}

	/**
	 * @return null, with the position unchanged, if there's no well-formed chord here
	 */
	private @Nullable CstNode chord() {
		int start = pos;
		CstNode result = CstNode.branch(ctx, Tag.Chord);
		result.appendChild(token(CHRD_LEFT_BRKT, 1));
		int notes = 0;
		while (peek() != ']') {
			CstNode item = chordItem();
			if (item == null) {
				pos = start;
				return null;
			}
			if (item.is(Tag.Note)) {
				notes++;
			}
			result.appendChild(item);
		}
		if (notes == 0) {
			pos = start;
			return null;
		}
		result.appendChild(token(CHRD_RIGHT_BRKT, 1));
		appendRhythmAndTie(result);
		return result;
	}

	private @Nullable CstNode chordItem() {
		int c = peek();
		if (c == ' ' || c == '\t') {
			return whitespace();
		} else if (c == '"') {
			return quoted();
		} else if (c == '!' && indexOf('!', pos + 1) >= 0) {
			return delimitedDecoration('!');
		} else if (c == '.' || c == '~') {
			return single(Tag.Decoration, DECORATION, 1);
		}
		return note();
	}

	private CstNode graceGroup() {
		int start = pos;
		CstNode result = CstNode.branch(ctx, Tag.Grace_group);
		result.appendChild(token(GRC_GRP_LEFT_BRACE, 1));
		if (peek() == '/') {
			result.appendChild(token(GRC_GRP_SLSH, 1));
		}
		int notes = 0;
		while (peek() != '}') {
			CstNode item = peek() == '[' ? chord() : chordItem();
			if (item == null) {
				pos = start;
				return error();
			}
			if (item.is(Tag.Note) || item.is(Tag.Chord)) {
				notes++;
			}
			result.appendChild(item);
		}
		if (notes == 0) {
			pos = start;
			return error();
		}
		result.appendChild(token(GRC_GRP_RGHT_BRACE, 1));
		return result;
	}

	private CstNode barLine() {
		int start = pos;
		if (peek() == '[') {
			pos++;
		}
		while (peek() == '|' || peek() == ':') {
			pos++;
		}
		if (peek() == ']' && pos > start) {
			pos++;
		}
		if (isDigit(peek())) {
			// Volta brackets: |1 :|2 [1,3 [2-4
			while (isDigit(peek()) || ((peek() == ',' || peek() == '-') && isDigit(peek(1)))) {
				pos++;
			}
		}
		return CstNode.branch(ctx, Tag.BarLine, tokenFrom(BARLINE, start));
	}

	private CstNode openParen() {
		if (!isDigit(peek(1))) {
			return token(LPAREN, 1);
		}
		CstNode result = CstNode.branch(ctx, Tag.Tuplet);
		result.appendChild(token(TUPLET_LPAREN, 1));
		result.appendChild(digits(TUPLET_P));
		if (peek() == ':') {
			result.appendChild(token(TUPLET_COLON, 1));
			if (isDigit(peek())) {
				result.appendChild(digits(TUPLET_Q));
			}
			if (peek() == ':') {
				result.appendChild(token(TUPLET_COLON, 1));
				if (isDigit(peek())) {
					result.appendChild(digits(TUPLET_R));
				}
			}
		}
		return result;
	}

	private CstNode rest() {
		CstNode result = CstNode.branch(ctx, Tag.Rest, token(REST, 1));
		CstNode rhythm = rhythm();
		if (rhythm != null) {
			result.appendChild(rhythm);
		}
		return result;
	}

	private CstNode multiMeasureRest() {
		CstNode result = CstNode.branch(ctx, Tag.MultiMeasureRest, token(MMREST, 1));
		if (isDigit(peek())) {
			result.appendChild(digits(RHY_NUMER));
		}
		return result;
	}

	private CstNode ySpacer() {
		CstNode result = CstNode.branch(ctx, Tag.YSPACER, token(TokenType.YSPACER, 1));
		CstNode rhythm = rhythm();
		if (rhythm != null) {
			result.appendChild(rhythm);
		}
		return result;
	}

	/**
	 * @return null, with the position unchanged, if there's no note here
	 */
	private @Nullable CstNode note() {
		int start = pos;
		CstNode pitch = CstNode.branch(ctx, Tag.Pitch);
		int accidentalStart = pos;
		if (peek() == '=') {
			pos++;
		} else if (peek() == '^' || peek() == '_') {
			int c = peek();
			pos++;
			if (peek() == c) {
				pos++;
			}
		}
		if (!isNoteLetter(peek())) {
			pos = start;
			return null;
		}
		if (pos > accidentalStart) {
			pitch.appendChild(tokenFrom(ACCIDENTAL, accidentalStart));
		}
		pitch.appendChild(token(NOTE_LETTER, 1));
		int octaveStart = pos;
		while (peek() == '\'' || peek() == ',') {
			pos++;
		}
		if (pos > octaveStart) {
			pitch.appendChild(tokenFrom(OCTAVE, octaveStart));
		}
		CstNode result = CstNode.branch(ctx, Tag.Note, pitch);
		appendRhythmAndTie(result);
		return result;
	}

	private void appendRhythmAndTie(CstNode node) {
		CstNode rhythm = rhythm();
		if (rhythm != null) {
			node.appendChild(rhythm);
		}
		if (peek() == '-') {
			node.appendChild(token(TIE, 1));
		}
	}

	private @Nullable CstNode rhythm() {
		int start = pos;
		CstNode result = CstNode.branch(ctx, Tag.Rhythm);
		if (isDigit(peek())) {
			result.appendChild(digits(RHY_NUMER));
		}
		if (peek() == '/') {
			while (peek() == '/') {
				result.appendChild(token(RHY_SEP, 1));
			}
			if (isDigit(peek())) {
				result.appendChild(digits(RHY_DENOM));
			}
		}
		if (peek() == '<' || peek() == '>') {
			int brokenStart = pos;
			int c = peek();
			while (peek() == c) {
				pos++;
			}
			result.appendChild(tokenFrom(RHY_BRKN, brokenStart));
		}
		return pos > start ? result : null;
	}

	private CstNode digits(TokenType type) {
		int start = pos;
		while (isDigit(peek())) {
			pos++;
		}
		return tokenFrom(type, start);
	}

	private int indexOf(char c, int from) {
		for (int i = from; i < chars.length; i++) {
			if (chars[i] == c) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Wraps each maximal run of adjacent beamable elements
	 * holding at least two notes or chords in a {@link Tag#Beam} node.
	 */
	private List<CstNode> groupBeams(List<CstNode> elements) {
		List<CstNode> result = new ArrayList<>();
		List<CstNode> run = new ArrayList<>();
		for (CstNode element : elements) {
			if (isBeamable(element)) {
				run.add(element);
			} else {
				flushRun(run, result);
				result.add(element);
			}
		}
		flushRun(run, result);
		return result;
	}

	private void flushRun(List<CstNode> run, List<CstNode> into) {
		long notes = run.stream().filter(n -> n.is(Tag.Note) || n.is(Tag.Chord)).count();
		if (notes >= 2) {
			CstNode beam = CstNode.branch(ctx, Tag.Beam);
			beam.setChildren(run);
			into.add(beam);
		} else {
			into.addAll(run);
		}
		run.clear();
	}

	private static boolean isBeamable(CstNode node) {
		switch (node.tag()) {
			case Note: case Chord: case Grace_group: case Decoration: case Annotation: case ChordSymbol:
				return true;
			default:
				return false;
		}
	}

	static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	static boolean isLetter(int c) {
		return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
	}

	static boolean isNoteLetter(int c) {
		return (c >= 'A' && c <= 'G') || (c >= 'a' && c <= 'g');
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MusicLineParser.class);
}
