package ai.masked.translator.model;

/**
 * Vendor-specific translation of a prepared document into a wire request, and of
 * the vendor's reply back into text. Implementations are selected by the vendor tag
 * of a {@link ModelConfig}.
 */
public interface ModelDriver {

    /**
     * @throws ai.masked.translator.translate.MissingConfigException when a required
     *         setting or per-call variable is absent; raised before any network activity
     */
    DriverRequest buildRequest(ModelConfig config, String preparedText, DriverOptions options);

    /**
     * @throws ai.masked.translator.translate.ResponseFormatException when the body carries
     *         no usable translation
     */
    DriverResponse parseResponse(ModelConfig config, String rawBody);
}
