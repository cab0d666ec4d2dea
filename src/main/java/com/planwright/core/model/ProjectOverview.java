package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Generated high-level view of the project.
 *
 * @param summary      a short paragraph describing the project
 * @param objectives   measurable objectives
 * @param scope        in-scope deliverables
 * @param keyFeatures  headline features
 * @param risks        identified risks with mitigations
 */
public record ProjectOverview(
    String summary,
    List<String> objectives,
    List<String> scope,
    List<String> keyFeatures,
    List<Risk> risks
) implements Serializable {

    public ProjectOverview {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        scope = scope == null ? List.of() : List.copyOf(scope);
        keyFeatures = keyFeatures == null ? List.of() : List.copyOf(keyFeatures);
        risks = risks == null ? List.of() : List.copyOf(risks);
    }
}
