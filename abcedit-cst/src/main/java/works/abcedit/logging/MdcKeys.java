package works.abcedit.logging;

public final class MdcKeys {
	private MdcKeys() { }

	public static final String DOCUMENT_NAME = "abcedit.document.name";
	public static final String DOCUMENT_INSTANCE_ID = "abcedit.document.instanceID";
	public static final String OPERATION = "abcedit.operation";
}
