/**
 * LLM verifier - probes OpenAI-compatible chat endpoints and scores what they actually support.
 *
 * <p>Each (provider, model) pair is checked for existence, responsiveness and streaming, plus
 * optional features such as function calling, vision and embeddings. Probe outcomes are folded into
 * a 0-100 score and a capability category, cached, stored, and announced as events that the
 * notification queue fans out to chat and mail channels.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.verifier.VerifierFactory} - Builds a fully wired verifier from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.verifier.LlmVerifierApplication} - Standalone process verifying on a schedule</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (VerifierFactory factory = VerifierFactory.create("config.yaml").start()) {
 *     VerificationResult result = factory.getOrchestrator().verify("openai", "gpt-4o").join();
 *     System.out.println(result.score() + " " + result.category().getLabel());
 * }
 * }</pre>
 *
 * @see fr.lapetina.llm.verifier.VerifierFactory
 * @see fr.lapetina.llm.verifier.orchestrator.VerificationOrchestrator
 */
package fr.lapetina.llm.verifier;
