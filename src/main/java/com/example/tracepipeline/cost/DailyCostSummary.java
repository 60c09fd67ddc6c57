package com.example.tracepipeline.cost;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class DailyCostSummary {
    LocalDate date;
    List<ProjectCostSummary> projects;

    public ProjectCostSummary forProject(String projectId) {
        return projects.stream()
                .filter(project -> project.getProjectId().equals(projectId))
                .findFirst()
                .orElse(ProjectCostSummary.empty(projectId));
    }
}
