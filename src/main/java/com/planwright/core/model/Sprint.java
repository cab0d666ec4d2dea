package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One sprint of the plan.
 *
 * @param number    1-based sprint number
 * @param name      display name
 * @param goal      what the sprint should deliver
 * @param startWeek first project week covered (1-based)
 * @param endWeek   last project week covered
 * @param focus     themes or features worked on
 */
public record Sprint(
    int number,
    String name,
    String goal,
    int startWeek,
    int endWeek,
    List<String> focus
) implements Serializable {

    public Sprint {
        focus = focus == null ? List.of() : List.copyOf(focus);
    }

    public int lengthInWeeks() {
        return Math.max(1, endWeek - startWeek + 1);
    }
}
