package pycs.model.csharp.builder;

import pycs.InternalCompilerError;

import java.io.Closeable;
import java.util.Deque;

/**
 * One frame of the code generator's context stack. Opening the frame makes its context current;
 * closing it restores whatever was current before. Frames must be closed in reverse order of
 * opening, which try-with-resources guarantees on every exit path.
 */
public class CsScopeBuilder implements Closeable {

	private final Deque<CsScopeBuilder> frames;
	private final CsCodeGenContext context;
	private boolean closed;

	CsScopeBuilder(Deque<CsScopeBuilder> frames, CsCodeGenContext context) {
		this.frames = frames;
		this.context = context;
		this.closed = false;
		frames.push(this);
	}

	public CsCodeGenContext getContext() {
		return context;
	}

	public boolean isClosed() {
		return closed;
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		if (frames.peek() != this) {
			throw new InternalCompilerError("code generation scopes closed out of order");
		}
		frames.pop();
		closed = true;
	}

}
