package pycs.model.csharp.builder;

public interface KeywordTable {

	// true if name collides with a reserved word of the target language
	boolean needsEscaping(String name);

}
