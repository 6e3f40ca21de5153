package rgv.model.ivl;

import java.util.Objects;

public class IVLSeqDrop extends IVLExpression {
	private final IVLExpression seq;
	private final IVLExpression count;

	public IVLSeqDrop(IVLExpression seq, IVLExpression count) {
		this.seq = seq;
		this.count = count;
	}

	public IVLExpression getSeq() {
		return seq;
	}

	public IVLExpression getCount() {
		return count;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLSeqDrop that = (IVLSeqDrop) o;
		return Objects.equals(seq, that.seq) &&
				Objects.equals(count, that.count);
	}

	@Override
	public int hashCode() {
		return Objects.hash(seq, count);
	}
}
