package com.disasteralert.service.intake;

import com.disasteralert.core.model.Report;
import com.disasteralert.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a batch of already-analyzed reports from a JSON array file.
 */
public final class ReportLoader {
    private ReportLoader() {
    }

    public static List<Report> load(Path file) {
        try {
            List<Report> reports = JsonUtils.readFile(file, new TypeReference<List<Report>>() {
            });
            if (reports == null) {
                return List.of();
            }
            return reports.stream().filter(Objects::nonNull).toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading reports from " + file, e);
        }
    }
}
