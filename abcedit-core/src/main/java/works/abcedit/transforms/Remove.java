package works.abcedit.transforms;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.abcedit.Selection;
import works.abcedit.cst.CstNode;
import works.abcedit.cst.DocumentContext;
import works.abcedit.logging.MappedDiagnosticContext.MDCScope;
import works.abcedit.scope.Scopes;

import static works.abcedit.logging.MappedDiagnosticContext.setupMDC;

public final class Remove {
	private Remove() { }

	/**
	 * Detaches every selected node, with its subtree, from the tree.
	 * The root itself is never removed.
	 *
	 * @return the input's cursors minus the ids of everything removed; cursors left empty are dropped
	 */
	public static Selection remove(Selection input, DocumentContext ctx) {
		try (MDCScope ignored = setupMDC(ctx, "remove")) {
			CstNode root = input.root();
			List<CstNode> selected = SelectedNodes.all(input, n -> n != root);
			Set<Long> removed = new HashSet<>();
			for (CstNode node : selected) {
				if (removed.contains(node.id())) {
					// Already gone with an ancestor
					continue;
				}
				TreeEdits.ParentRef ref = TreeEdits.findParent(root, node);
				if (ref != null) {
					Scopes.collectDescendantIds(node, removed);
					TreeEdits.removeChild(ref.parent(), ref.prev(), node);
				}
			}
			LOGGER.debug("Removed {} selected nodes, {} in total", selected.size(), removed.size());
			return input.withCursors(input.cursors().stream()
				.map(c -> c.minusAll(removed))
				.filter(c -> !c.isEmpty())
				.toList());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Remove.class);
}
