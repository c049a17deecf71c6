package pycs;

public class CodeGenOptionException extends PyCsException {

	private static final long serialVersionUID = 4470351617301870252L;
	private static final String prefix = "Option Error";

	public CodeGenOptionException(String msg) {
		super(prefix, msg);
	}

	public CodeGenOptionException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}

}
