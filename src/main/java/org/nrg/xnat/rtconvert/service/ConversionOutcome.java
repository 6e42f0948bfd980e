package org.nrg.xnat.rtconvert.service;

import org.nrg.xnat.rtconvert.report.ConversionWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one request in a batch. Failed requests carry no mask.
 */
public final class ConversionOutcome {

    public enum Status {
        SUCCESS,
        WARNING,
        ERROR
    }

    private final String requestId;
    private final Status status;
    private final ConversionState state;
    private final List<ConversionWarning> warnings;
    private final String errorMessage;
    private final MaskConversion result;

    private ConversionOutcome(String requestId, Status status, ConversionState state, List<ConversionWarning> warnings,
                              String errorMessage, MaskConversion result) {
        this.requestId = requestId;
        this.status = status;
        this.state = state;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.errorMessage = errorMessage;
        this.result = result;
    }

    static ConversionOutcome completed(MaskConversion result, ConversionState state) {
        Status status = result.getWarnings().isEmpty() ? Status.SUCCESS : Status.WARNING;
        return new ConversionOutcome(result.getRequestId(), status, state, result.getWarnings(), null, result);
    }

    static ConversionOutcome failed(String requestId, ConversionState state, String errorMessage) {
        return new ConversionOutcome(requestId, Status.ERROR, state, Collections.<ConversionWarning>emptyList(),
                errorMessage, null);
    }

    public String getRequestId() {
        return requestId;
    }

    public Status getStatus() {
        return status;
    }

    public ConversionState getState() {
        return state;
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * The produced volume and mask, or null when the request failed.
     */
    public MaskConversion getResult() {
        return result;
    }

    public boolean isSuccessful() {
        return status != Status.ERROR;
    }

    @Override
    public String toString() {
        return "ConversionOutcome[" + requestId + " " + status + " " + state
                + (errorMessage != null ? ": " + errorMessage : "") + "]";
    }
}
