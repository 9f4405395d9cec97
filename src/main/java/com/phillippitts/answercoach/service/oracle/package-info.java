/**
 * Contracts for the external classifiers and the invoker that runs them.
 *
 * <p>Adapters throw {@link com.phillippitts.answercoach.exception.OracleUnavailableException};
 * {@link com.phillippitts.answercoach.service.oracle.OracleInvoker} turns any failure into an
 * empty result so callers apply their conservative fallback.
 *
 * <p>Implementations live in {@code oracle.offline} (no network) and {@code oracle.gemini}.
 */
package com.phillippitts.answercoach.service.oracle;
