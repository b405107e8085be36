package works.abcedit.context;

/**
 * @param pos the start position, from {@link DocumentSnapshots#encode}
 */
public record PositionedSnapshot(long pos, ContextSnapshot snapshot) { }
