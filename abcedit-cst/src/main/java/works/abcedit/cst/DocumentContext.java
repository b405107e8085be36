package works.abcedit.cst;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Per-document state shared by everything that creates nodes:
 * the id counter, plus identification used for logging.
 * <p>
 * Ids are assigned in increasing order and never reused,
 * so a cursor that refers to a detached node can't accidentally
 * pick up a different node later.
 */
public final class DocumentContext {
	private final String name;
	private final String instanceID;
	private final AtomicLong nextId;

	private DocumentContext(String name, long firstId) {
		this.name = name;
		this.instanceID = UUID.randomUUID().toString();
		this.nextId = new AtomicLong(firstId);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static DocumentContext create() {
		return builder().build();
	}

	public String name() {
		return name;
	}

	/**
	 * @return an identifier unique to this object, suitable for correlating log lines
	 */
	public String instanceID() {
		return instanceID;
	}

	public long nextId() {
		return nextId.getAndIncrement();
	}

	/**
	 * @return the id that the next call to {@link #nextId()} will return
	 */
	public long peekNextId() {
		return nextId.get();
	}

	@Override
	public String toString() {
		return "DocumentContext(" + name + ", " + instanceID + ")";
	}

	public static class Builder {
		private String name = "untitled";
		private long firstId = 0;

		Builder() { }

		public Builder name(String name) {
			this.name = requireNonNull(name);
			return this;
		}

		public Builder firstId(long firstId) {
			if (firstId < 0) {
				throw new IllegalArgumentException("firstId must not be negative: " + firstId);
			}
			this.firstId = firstId;
			return this;
		}

		public DocumentContext build() {
			return new DocumentContext(name, firstId);
		}

		@Override
		public String toString() {
			return "DocumentContext.Builder(name=" + name + ", firstId=" + firstId + ")";
		}
	}
}
