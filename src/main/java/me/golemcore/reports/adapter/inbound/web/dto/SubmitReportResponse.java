package me.golemcore.reports.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitReportResponse {
    private String tag;
    private String locator;
    private String mode;
    private String hostLabel;
    private int attachmentCount;
    private int embeddedCount;
    private boolean combinedTextCreated;
    private boolean notified;
    private List<AttachmentDto> attachments;
    private List<String> warnings;
}
