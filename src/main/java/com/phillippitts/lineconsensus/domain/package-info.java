/**
 * Domain models of the line-consensus service.
 *
 * <p>All models are immutable records. Inputs come from the extraction layer
 * ({@link com.phillippitts.lineconsensus.domain.LineRecord},
 * {@link com.phillippitts.lineconsensus.domain.UserExtract}); outputs are
 * {@link com.phillippitts.lineconsensus.domain.ConsensusRecord} lists grouped per frame in a
 * {@link com.phillippitts.lineconsensus.domain.SubjectReduction}.
 *
 * <p>Line records are deliberately not validated on construction: a malformed record fails
 * when it is read, which aborts only the subject that contains it.
 *
 * @since 1.0
 */
package com.phillippitts.lineconsensus.domain;
