package works.abcedit.cst;

/**
 * The syntactic kind of a {@link CstNode}.
 * <p>
 * Names follow the ABC standard's terminology, which is why they
 * don't follow Java's constant naming convention.
 */
public enum Tag {
	File_structure,
	File_header,
	Tune,
	Tune_header,
	Tune_Body,
	System,
	Music_code,
	Info_line,
	Comment,
	Directive,
	Note,
	Pitch,
	Rhythm,
	Rest,
	Chord,
	Beam,
	Grace_group,
	BarLine,
	Decoration,
	Annotation,
	ChordSymbol,
	Inline_field,
	MultiMeasureRest,
	YSPACER,
	Tuplet,
	Voice_overlay,
	Line_continuation,
	Symbol,
	ErrorExpr,

	/**
	 * A leaf. Every node with this tag carries {@link NodePayload.TokenData}.
	 */
	Token,
}
