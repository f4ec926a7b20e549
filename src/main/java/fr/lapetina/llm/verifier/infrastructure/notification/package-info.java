/**
 * Bounded notification queue built on the LMAX Disruptor.
 *
 * <p>Events from the verifier are rendered once per channel and published into a ring buffer.
 * A fixed set of workers drains it; a full ring makes {@code send} wait up to its timeout and then
 * fail with {@link fr.lapetina.llm.verifier.infrastructure.notification.QueueFullException}
 * rather than drop silently.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>CRITICAL and ERROR - every channel</li>
 *   <li>WARNING - every channel except heavy ones</li>
 *   <li>INFO - the single lightest channel</li>
 * </ul>
 *
 * @see fr.lapetina.llm.verifier.infrastructure.notification.NotificationDispatcher
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.llm.verifier.infrastructure.notification;
