package fr.lapetina.llm.verifier.domain.model;

/**
 * One decoded event from a server-sent-event stream.
 *
 * @param content incremental text, empty when the event carried none
 * @param finish  true on the terminal chunk
 * @param error   decode error for this line only, null otherwise
 */
public record StreamingChunk(String content, boolean finish, String error) {

    public StreamingChunk {
        if (content == null) {
            content = "";
        }
    }

    public static StreamingChunk content(String content) {
        return new StreamingChunk(content, false, null);
    }

    public static StreamingChunk terminal() {
        return new StreamingChunk("", true, null);
    }

    public static StreamingChunk error(String error) {
        return new StreamingChunk("", false, error);
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    public boolean isError() {
        return error != null;
    }
}
