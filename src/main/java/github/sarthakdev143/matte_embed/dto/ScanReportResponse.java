package github.sarthakdev143.matte_embed.dto;

import github.sarthakdev143.matte_embed.model.ScanReport;

import java.util.List;
import java.util.stream.Collectors;

public record ScanReportResponse(
        String root,
        int totalSequences,
        int totalFiles,
        List<SequenceGroupResponse> sequences,
        List<String> warnings) {

    public static ScanReportResponse from(ScanReport report) {
        return new ScanReportResponse(
                report.root().toString(),
                report.totalSequences(),
                report.totalFiles(),
                report.groups().stream().map(SequenceGroupResponse::from).collect(Collectors.toList()),
                report.warnings());
    }
}
