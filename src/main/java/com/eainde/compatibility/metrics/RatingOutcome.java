package com.eainde.compatibility.metrics;

/**
 * What became of one oracle rating reply: either a parsed record or the reason it
 * could not be parsed. Malformed text never leaves the extractor in any other form.
 */
public final class RatingOutcome {

    private final MetricsRecord metrics;
    private final String parseError;

    private RatingOutcome(MetricsRecord metrics, String parseError) {
        this.metrics = metrics;
        this.parseError = parseError;
    }

    public static RatingOutcome parsed(MetricsRecord metrics) {
        return new RatingOutcome(metrics, null);
    }

    public static RatingOutcome parseError(String reason) {
        return new RatingOutcome(null, reason);
    }

    public boolean isParsed() {
        return metrics != null;
    }

    /** The parsed record, or the neutral default after a parse error. */
    public MetricsRecord metricsOrDefault() {
        return isParsed() ? metrics : MetricsRecord.neutralDefault();
    }

    public String getParseError() {
        return parseError;
    }

    @Override
    public String toString() {
        return isParsed() ? "Parsed[" + metrics + "]" : "ParseError[" + parseError + "]";
    }
}
