package fr.lapetina.llm.verifier.infrastructure.notification;

/**
 * How intrusive a channel is for its recipients. Routing sends low-severity
 * events to light channels only.
 */
public enum ChannelWeight {
    /** Chat webhooks, cheap to ignore */
    LIGHT,

    /** Direct messages */
    STANDARD,

    /** Email and other inbox-bound channels */
    HEAVY
}
