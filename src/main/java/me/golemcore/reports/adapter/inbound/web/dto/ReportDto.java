package me.golemcore.reports.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of a stored report. {@code locator} is issued when the response is
 * built for point lookups and copied from the record for listings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDto {
    private String tag;
    private String agentName;
    private String title;
    private String timestamp;
    private String date;
    private int hour;
    private int minute;
    private String locator;
    private String hostLabel;
    private String mode;
}
