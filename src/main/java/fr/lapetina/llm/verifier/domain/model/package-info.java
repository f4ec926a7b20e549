/**
 * Value objects shared by every layer of the verifier.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.verifier.domain.model.Provider} and {@link fr.lapetina.llm.verifier.domain.model.Model} - What gets verified</li>
 *   <li>{@link fr.lapetina.llm.verifier.domain.model.ProbeResult} - Outcome of a single probe</li>
 *   <li>{@link fr.lapetina.llm.verifier.domain.model.VerificationResult} - Scored aggregate of one verification</li>
 *   <li>{@link fr.lapetina.llm.verifier.domain.model.TaxonomyError} - Classified error with its {@link fr.lapetina.llm.verifier.domain.model.ErrorType}</li>
 * </ul>
 *
 * <p>All types are immutable records or enums and safe to share between threads.
 */
package fr.lapetina.llm.verifier.domain.model;
