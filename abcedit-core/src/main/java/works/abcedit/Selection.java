package works.abcedit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.pcollections.HashTreePSet;
import org.pcollections.PSet;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.abcedit.cst.CstNode;

import static java.util.Objects.requireNonNull;

/**
 * A tree plus an ordered list of cursors into it.
 * Each cursor is a set of node ids meant to be treated as one unit:
 * a measure, a note, a run of one voice.
 * <p>
 * Cursors are persistent collections, so selectors and transforms
 * can build new selections without disturbing the ones they were given.
 * The tree itself is shared and mutable.
 */
public record Selection(CstNode root, PVector<PSet<Long>> cursors) {
	public Selection {
		requireNonNull(root);
		requireNonNull(cursors);
	}

	/**
	 * @return a selection whose single cursor holds the root, meaning "the whole document"
	 */
	public static Selection of(CstNode root) {
		return new Selection(root, TreePVector.singleton(HashTreePSet.singleton(root.id())));
	}

	public static Selection of(CstNode root, Collection<? extends Set<Long>> cursors) {
		List<PSet<Long>> list = new ArrayList<>();
		for (Set<Long> c : cursors) {
			list.add(HashTreePSet.from(c));
		}
		return new Selection(root, TreePVector.from(list));
	}

	public static Selection empty(CstNode root) {
		return new Selection(root, TreePVector.empty());
	}

	public Selection withCursors(Collection<? extends Set<Long>> newCursors) {
		return Selection.of(root, newCursors);
	}

	public Selection withCursor(PSet<Long> cursor) {
		return new Selection(root, cursors.plus(cursor));
	}

	public Selection mapCursors(Function<PSet<Long>, PSet<Long>> f) {
		List<PSet<Long>> result = new ArrayList<>(cursors.size());
		for (PSet<Long> c : cursors) {
			result.add(f.apply(c));
		}
		return new Selection(root, TreePVector.from(result));
	}

	public int size() {
		return cursors.size();
	}

	public boolean isEmpty() {
		return cursors.isEmpty();
	}

	public PSet<Long> cursor(int index) {
		return cursors.get(index);
	}

	public static PSet<Long> cursorOf(Collection<Long> ids) {
		return HashTreePSet.from(ids);
	}

	public static PSet<Long> singletonCursor(long id) {
		return HashTreePSet.singleton(id);
	}
}
