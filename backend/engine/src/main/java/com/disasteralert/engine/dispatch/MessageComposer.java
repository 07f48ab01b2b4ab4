package com.disasteralert.engine.dispatch;

import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.model.Report;

import java.util.List;

public final class MessageComposer {
    public AlertMessage compose(EventKey key, List<Report> reports) {
        String disaster = titleCase(key.disasterType());
        String location = titleCase(key.location());
        String subject = "[ALERT] " + disaster + " Alert in " + location;

        StringBuilder body = new StringBuilder();
        body.append("Found ").append(reports.size()).append(" report(s) for a ")
                .append(disaster).append(" in ").append(location).append(":\n");
        for (Report report : reports) {
            body.append('\n');
            body.append("-> Reported by @").append(report.authorId())
                    .append(" at ").append(report.timestamp()).append(":\n");
            body.append("   \"").append(report.text()).append("\"\n");
            if (report.hasImage()) {
                body.append("   Image: ").append(report.imageUrl()).append('\n');
            }
            if (report.hasLandmark()) {
                body.append("   Landmark: ").append(report.detectedLandmark()).append('\n');
            }
        }
        return new AlertMessage(subject, body.toString());
    }

    static String titleCase(String value) {
        StringBuilder out = new StringBuilder(value.length());
        boolean wordStart = true;
        for (char c : value.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
                wordStart = false;
            } else {
                out.append(c);
                wordStart = true;
            }
        }
        return out.toString();
    }
}
