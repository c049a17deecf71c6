package pycs.model.csharp;

public enum CsMemberAttribute {
	PUBLIC("public"),
	PROTECTED("protected"),
	PRIVATE("private"),
	STATIC("static"),
	ABSTRACT("abstract"),
	OVERRIDE("override"),
	// sealed members; the renderer omits it on constructors
	FINAL("sealed"),
	;

	private final String keyword;

	CsMemberAttribute(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
