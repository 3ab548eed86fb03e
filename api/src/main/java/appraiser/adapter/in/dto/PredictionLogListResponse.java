package appraiser.adapter.in.dto;

import java.util.List;

import appraiser.core.model.audit.PredictionLogPage;

/**
 * One page of the caller's audit trail. {@code total} counts all of the caller's entries.
 */
public record PredictionLogListResponse(List<PredictionLogResponse> logs, long total, int skip, int limit) {

    public static PredictionLogListResponse from(PredictionLogPage page) {
        return new PredictionLogListResponse(
                page.logs().stream().map(PredictionLogResponse::from).toList(),
                page.total(),
                page.skip(),
                page.limit());
    }
}
