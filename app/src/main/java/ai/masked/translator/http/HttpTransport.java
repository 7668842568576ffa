package ai.masked.translator.http;

/**
 * Synchronous HTTP client used by the translation pipeline.
 */
public interface HttpTransport {

    /**
     * Sends the call, or only describes it when {@link HttpCall#dryRun()} is set.
     * HTTP error statuses are returned, not thrown.
     *
     * @throws ai.masked.translator.translate.TransportException on network failure
     */
    HttpExchange request(HttpCall call);
}
