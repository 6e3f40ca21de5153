package rgv.trans.passes.atomicity;

public enum AtomicityKind {
	NONATOMIC,
	ATOMIC,
}
