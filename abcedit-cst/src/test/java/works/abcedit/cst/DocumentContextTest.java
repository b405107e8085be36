package works.abcedit.cst;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentContextTest {
	@Test
	void idsIncrease() {
		DocumentContext ctx = DocumentContext.builder().firstId(100).build();
		assertEquals(100, ctx.nextId());
		assertEquals(101, ctx.nextId());
		assertEquals(102, ctx.peekNextId());
	}

	@Test
	void contextsAreIndependent() {
		DocumentContext a = DocumentContext.create();
		DocumentContext b = DocumentContext.create();
		a.nextId();
		a.nextId();
		assertEquals(0, b.nextId());
		assertNotEquals(a.instanceID(), b.instanceID());
	}

	@Test
	void negativeFirstIdRejected() {
		assertThrows(IllegalArgumentException.class, () -> DocumentContext.builder().firstId(-1));
	}

	@Test
	void tokenNodesNeedTokenData() {
		assertThrows(IllegalArgumentException.class, () -> new CstNode(1, Tag.Token, NodePayload.Empty.INSTANCE));
	}

	@Test
	void setChildrenRelinks() {
		DocumentContext ctx = DocumentContext.create();
		CstNode parent = CstNode.branch(ctx, Tag.System);
		CstNode a = CstNode.syntheticToken(ctx, TokenType.WS, " ");
		CstNode b = CstNode.syntheticToken(ctx, TokenType.EOL, "\n");
		parent.appendChild(a).appendChild(b);
		assertEquals(b, parent.lastChild());

		parent.setChildren(List.of(b, a));
		assertEquals(b, parent.firstChild());
		assertEquals(a, b.nextSibling());
		assertNull(a.nextSibling());
	}
}
