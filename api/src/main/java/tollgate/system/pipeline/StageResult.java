package tollgate.system.pipeline;

import jakarta.ws.rs.core.Response;

/**
 * What a stage decided about a request.
 *
 * @param halted   true to stop the pipeline and answer with {@code response}
 * @param response the response to send when halted, null otherwise
 */
public record StageResult(boolean halted, Response response) {

    private static final StageResult PROCEED = new StageResult(false, null);

    public StageResult {
        if (halted && response == null) {
            throw new IllegalArgumentException("A halting stage must provide a response");
        }
    }

    public static StageResult proceed() {
        return PROCEED;
    }

    public static StageResult halt(Response response) {
        return new StageResult(true, response);
    }
}
