package com.disasteralert.engine.support;

import com.disasteralert.core.model.Report;

public final class ReportFixtures {
    private ReportFixtures() {
    }

    public static Report report(String author, String location, String type, String text) {
        return new Report(author, "2026-02-12T08:00:00Z", text, location, type, Report.NOT_AVAILABLE, Report.NOT_AVAILABLE);
    }

    public static Report withImage(String author, String location, String type, String text, String imageUrl) {
        return new Report(author, "2026-02-12T08:05:00Z", text, location, type, imageUrl, Report.NOT_AVAILABLE);
    }
}
