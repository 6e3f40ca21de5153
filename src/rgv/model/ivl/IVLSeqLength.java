package rgv.model.ivl;

import java.util.Objects;

public class IVLSeqLength extends IVLExpression {
	private final IVLExpression seq;

	public IVLSeqLength(IVLExpression seq) {
		this.seq = seq;
	}

	public IVLExpression getSeq() {
		return seq;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLSeqLength that = (IVLSeqLength) o;
		return Objects.equals(seq, that.seq);
	}

	@Override
	public int hashCode() {
		return Objects.hash(seq);
	}
}
