package fr.lapetina.llm.verifier.domain.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns one decoded {@code data:} payload into content and a finish signal.
 * This is the only part of stream parsing that differs between provider families.
 */
@FunctionalInterface
public interface EventDecoder {

    Decoded decode(JsonNode event);

    /**
     * @param content  incremental text, empty when none
     * @param finished true when the provider signalled the end of the stream
     * @param error    provider error carried inside the stream, null otherwise
     */
    record Decoded(String content, boolean finished, String error) {
        public Decoded {
            if (content == null) {
                content = "";
            }
        }

        public static Decoded of(String content, boolean finished) {
            return new Decoded(content, finished, null);
        }

        public static Decoded error(String error) {
            return new Decoded("", false, error);
        }
    }
}
