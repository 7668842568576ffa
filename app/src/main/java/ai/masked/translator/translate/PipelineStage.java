package ai.masked.translator.translate;

/**
 * States of a single translation run, in execution order.
 */
public enum PipelineStage {
    START,
    PRE_VALIDATE,
    MASK,
    BUILD_REQUEST,
    AUTHENTICATE,
    TRANSMIT,
    PARSE_RESPONSE,
    UNMASK,
    POST_VALIDATE,
    NORMALIZE_USAGE,
    DONE,
    ERRORED
}
