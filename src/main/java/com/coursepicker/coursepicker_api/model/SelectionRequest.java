package com.coursepicker.coursepicker_api.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a solve request. {@code candidates} is ignored when the pool comes from the catalog.
 */
@Data
@NoArgsConstructor
public class SelectionRequest {

    private Integer targetCredits;
    private List<String> fields = new ArrayList<>();
    private List<String> formats = new ArrayList<>();
    // Entries like "mon. 09:00-10:30", joined with ';' before parsing
    private List<String> busySchedule = new ArrayList<>();
    private List<CourseRecord> candidates = new ArrayList<>();
    // Optional, makes the shuffles reproducible
    private Long seed;

    public String busySchedulePattern() {
        if (busySchedule == null) {
            return "";
        }
        List<String> entries = new ArrayList<>();
        for (String entry : busySchedule) {
            if (entry != null && !entry.isBlank()) {
                entries.add(entry.trim());
            }
        }
        return String.join(";", entries);
    }
}
