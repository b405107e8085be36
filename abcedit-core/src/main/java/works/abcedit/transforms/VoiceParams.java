package works.abcedit.transforms;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Optional properties written after the id of a new {@code V:} line.
 */
@Value
@Builder
public class VoiceParams {
	public static final VoiceParams NONE = VoiceParams.builder().build();

	/**
	 * Written quoted, as <code>name="..."</code>.
	 */
	@Nullable String name;
	@Nullable String clef;

	/**
	 * In semitones.
	 */
	@Nullable Integer transpose;

	/**
	 * @return the text after {@code V:}, like <code>T1 name="Trumpet" clef=treble</code>
	 */
	public String fieldValue(String voiceId) {
		StringBuilder sb = new StringBuilder(voiceId);
		if (name != null) {
			sb.append(" name=\"").append(name).append('"');
		}
		if (clef != null) {
			sb.append(" clef=").append(clef);
		}
		if (transpose != null) {
			sb.append(" transpose=").append(transpose);
		}
		return sb.toString();
	}
}
