package rgv.verifier;

import rgv.model.ivl.IVLProgram;

import java.util.List;

/**
 * The external proof engine. Implementations report every failed proof obligation of the
 * program; an empty list means the program verified.
 */
@FunctionalInterface
public interface Verifier {
	List<VerificationFailure> verify(IVLProgram program);
}
