package com.eainde.labaudit.scoring;

import com.eainde.labaudit.model.ChecklistItem;

import java.util.List;

/**
 * Counts of checklist items per assessment. Items with an unrecognized status are not counted.
 */
public record ChecklistTally(int compliant, int nonCompliant, int unable) {

    public static ChecklistTally of(List<ChecklistItem> checklist) {
        int compliant = 0;
        int nonCompliant = 0;
        int unable = 0;
        for (ChecklistItem item : checklist) {
            if (item.status() == null) {
                continue;
            }
            switch (item.status()) {
                case COMPLIANT -> compliant++;
                case NON_COMPLIANT -> nonCompliant++;
                case UNABLE_TO_ASSESS -> unable++;
                default -> {
                    // not tallied
                }
            }
        }
        return new ChecklistTally(compliant, nonCompliant, unable);
    }

    public int total() {
        return compliant + nonCompliant + unable;
    }
}
