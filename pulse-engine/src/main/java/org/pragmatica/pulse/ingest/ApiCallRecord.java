package org.pragmatica.pulse.ingest;

/**
 * An unvalidated record describing one whole API call. Fans out into latency, error and volume events keyed by
 * the calling user.
 *
 * @param timestamp  Optional client timestamp in ISO-8601 form
 * @param userId     Calling user
 * @param latencyMs  Time taken to serve the call, in milliseconds
 * @param tokensUsed Tokens consumed by the call
 * @param error      Whether the call failed
 */
public record ApiCallRecord(String timestamp, String userId, Double latencyMs, Long tokensUsed, Boolean error) {
    public static ApiCallRecord apiCallRecord(String userId, double latencyMs, long tokensUsed, boolean error) {
        return new ApiCallRecord(null, userId, latencyMs, tokensUsed, error);
    }
}
