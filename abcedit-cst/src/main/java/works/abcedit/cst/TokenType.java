package works.abcedit.cst;

public enum TokenType {
	NOTE_LETTER,
	ACCIDENTAL,
	OCTAVE,
	RHY_NUMER,
	RHY_SEP,
	RHY_DENOM,
	RHY_BRKN,
	TIE,
	REST,
	MMREST,
	YSPACER,
	WS,
	EOL,
	INF_HDR,
	INFO_STR,
	INLN_FLD_LFT_BRKT,
	INLN_FLD_RGT_BRKT,
	CHRD_LEFT_BRKT,
	CHRD_RIGHT_BRKT,
	GRC_GRP_LEFT_BRACE,
	GRC_GRP_RGHT_BRACE,
	GRC_GRP_SLSH,
	BARLINE,
	TUPLET_LPAREN,
	TUPLET_P,
	TUPLET_COLON,
	TUPLET_Q,
	TUPLET_R,
	LPAREN,
	RPAREN,
	DECORATION,
	ANNOTATION,
	CHORD_SYMBOL,
	VOICE_OVRLAY,
	LINE_CONT,
	COMMENT,
	DIRECTIVE,
	SYMBOL,
	INVALID,
	;

	/**
	 * @return true for tokens that carry no musical meaning.
	 */
	public boolean isWhitespace() {
		return this == WS || this == EOL;
	}
}
