package rgv.model.ivl;

import java.util.Objects;

public class IVLSeqIndex extends IVLExpression {
	private final IVLExpression seq;
	private final IVLExpression index;

	public IVLSeqIndex(IVLExpression seq, IVLExpression index) {
		this.seq = seq;
		this.index = index;
	}

	public IVLExpression getSeq() {
		return seq;
	}

	public IVLExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLSeqIndex that = (IVLSeqIndex) o;
		return Objects.equals(seq, that.seq) &&
				Objects.equals(index, that.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(seq, index);
	}
}
