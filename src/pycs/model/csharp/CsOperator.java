package pycs.model.csharp;

public enum CsOperator {
	// grouped by precedence
	LOG_OR("||"),
	LOG_AND("&&"),

	BIT_OR("|"),
	BIT_XOR("^"),
	BIT_AND("&"),

	EQUAL("=="),
	NOT_EQUAL("!="),

	LESS_THAN("<"),
	LESS_THAN_OR_EQUAL("<="),
	GREATER_THAN(">"),
	GREATER_THAN_OR_EQUAL(">="),
	IS("is"),
	AS("as"),

	SHL("<<"),
	SHR(">>"),

	ADD("+"),
	SUB("-"),

	MUL("*"),
	DIV("/"),
	MOD("%"),

	// null coalescing, the translation of Python's "x or default" on references
	COALESCE("??"),

	ASSIGN("="),
	ADD_ASSIGN("+="),
	SUB_ASSIGN("-="),
	MUL_ASSIGN("*="),
	DIV_ASSIGN("/="),
	MOD_ASSIGN("%="),
	;

	private final String token;

	CsOperator(String token) {
		this.token = token;
	}

	public String getToken() {
		return token;
	}
}
