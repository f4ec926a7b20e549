/**
 * YAML configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code probe} - Timeouts, responsiveness ceilings, default feature set</li>
 *   <li>{@code providers} and {@code models} - What to verify</li>
 *   <li>{@code concurrency} - Probe workers and circuit breaker</li>
 *   <li>{@code cache} - TTLs and the optional Redis tier</li>
 *   <li>{@code scoring} - Score weights and latency bands</li>
 *   <li>{@code notifications} - Queue sizing and Slack, Telegram, email channels</li>
 *   <li>{@code scheduler} - Periodic re-verification interval</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <p>Credentials may be given as {@code env:NAME}; see
 * {@link fr.lapetina.llm.verifier.infrastructure.config.CredentialResolver}.
 */
package fr.lapetina.llm.verifier.infrastructure.config;
