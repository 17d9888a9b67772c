package com.HRPayMaster.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Concurrent approved-leave counts for a date range. {@code days} maps each date to a
 * department-key to count map; {@code departments} resolves department keys to names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageResponse {
    private LocalDate startDate;
    private LocalDate endDate;
    private int threshold;
    private Map<LocalDate, Map<String, Integer>> days;
    private List<Alert> alerts;
    private Map<String, String> departments;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Alert {
        private LocalDate date;
        private String departmentId;
        private String departmentName;
        private int count;
    }
}
