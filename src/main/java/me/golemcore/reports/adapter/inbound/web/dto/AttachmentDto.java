package me.golemcore.reports.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentDto {
    private String filename;
    private long sizeBytes;
    private String role;
    private String contentType;
    private String locator;
    private boolean embedded;
    private boolean derived;
}
