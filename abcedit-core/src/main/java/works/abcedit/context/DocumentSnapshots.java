package works.abcedit.context;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Every context change in a document, sorted by position.
 * A snapshot stays in effect until the next one starts.
 */
public final class DocumentSnapshots {
	private final List<PositionedSnapshot> snapshots;

	public DocumentSnapshots(List<PositionedSnapshot> snapshots) {
		List<PositionedSnapshot> sorted = new ArrayList<>(snapshots);
		sorted.sort(Comparator.comparingLong(PositionedSnapshot::pos));
		this.snapshots = List.copyOf(sorted);
	}

	public static DocumentSnapshots empty() {
		return new DocumentSnapshots(List.of());
	}

	/**
	 * Linearizes a source position. Positions compare the same way
	 * their encodings do, as long as both are non-negative.
	 */
	public static long encode(int line, int column) {
		return ((long) line << 32) | (column & 0xFFFFFFFFL);
	}

	public List<PositionedSnapshot> all() {
		return snapshots;
	}

	public boolean isEmpty() {
		return snapshots.isEmpty();
	}

	/**
	 * @return the snapshot in effect at <code>startPos</code>, followed by every
	 * snapshot that starts inside <code>[startPos, endPos)</code>. When nothing is in
	 * effect yet at <code>startPos</code>, the first snapshot stands in for it.
	 */
	public List<PositionedSnapshot> rangeSnapshots(long startPos, long endPos) {
		if (snapshots.isEmpty()) {
			return List.of();
		}
		int base = Math.max(0, floorIndex(startPos));
		int end = base + 1;
		while (end < snapshots.size() && snapshots.get(end).pos() < endPos) {
			end++;
		}
		return snapshots.subList(base, end);
	}

	/**
	 * @return the last index whose position is at or before <code>pos</code>, or -1
	 */
	private int floorIndex(long pos) {
		int lo = 0;
		int hi = snapshots.size() - 1;
		int result = -1;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			if (snapshots.get(mid).pos() <= pos) {
				result = mid;
				lo = mid + 1;
			} else {
				hi = mid - 1;
			}
		}
		return result;
	}

	@Override
	public String toString() {
		return "DocumentSnapshots" + snapshots;
	}
}
