package com.phillippitts.answercoach.service.oracle;

import com.phillippitts.answercoach.domain.CoverageVerdict;

/**
 * External classifier judging how completely one bullet is addressed by the answer so far.
 *
 * <p>Implementations may block (network calls); callers bound them with a timeout through
 * {@link OracleInvoker}. They signal any failure, including output outside the contract, with
 * {@link com.phillippitts.answercoach.exception.OracleUnavailableException}.
 */
@FunctionalInterface
public interface CoverageOracle {

    /**
     * @param bulletText     canonical text of the bullet
     * @param fullAnswerText reconstructed answer, follow-up questions included as tagged context
     * @return {@code COVERED | PARTIAL | INCOMPLETE}, or {@code COVERED | UNCOVERED} for binary oracles
     */
    CoverageVerdict classify(String bulletText, String fullAnswerText);

    /**
     * Wraps an oracle so its verdicts are collapsed to the binary scale.
     *
     * @param delegate ternary or binary oracle
     * @return oracle answering only {@code COVERED | UNCOVERED}
     */
    static CoverageOracle binary(CoverageOracle delegate) {
        return (bulletText, fullAnswerText) -> {
            CoverageVerdict verdict = delegate.classify(bulletText, fullAnswerText);
            return verdict == null ? null : verdict.toBinary();
        };
    }
}
