package pycs;

/**
 * Base of the errors a driver is expected to report to the user, such as a bad
 * code generation option. The prefix names the stage that failed.
 */
public abstract class PyCsException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public PyCsException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public PyCsException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
