package me.golemcore.reports.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitReportRequest {
    private String agentName;
    private String title;
    private String body;
    private String bodyFilePath;
    @Builder.Default
    private List<String> files = new ArrayList<>();
    private boolean urgent;
}
