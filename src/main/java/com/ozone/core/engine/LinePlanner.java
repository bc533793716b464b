package com.ozone.core.engine;

import com.ozone.core.model.ExecutionStrategy;
import com.ozone.core.model.Plan;
import com.ozone.core.model.Step;
import com.ozone.core.model.StepId;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plans an objective written as one step per line.
 * <p>
 * Each line is {@code capability: input}; a line without a capability prefix uses the
 * default capability. Several steps on one line joined by {@code " & "} share a rank,
 * which makes the whole plan PARALLEL. Blank lines and lines starting with {@code #}
 * are ignored.
 *
 * <pre>
 * code-analysis: src/main
 * text-generation: summary &amp; text-generation: changelog
 * </pre>
 */
public class LinePlanner implements Planner {

    /** Capability identifiers: lowercase letters, digits, '-', '_' and '.'. */
    private static final Pattern STEP_PATTERN = Pattern.compile("^([a-z][a-z0-9._-]*)\\s*:\\s*(.*)$");
    private static final String RANK_SEPARATOR = " & ";

    private final String defaultCapability;

    public LinePlanner(String defaultCapability) {
        this.defaultCapability = defaultCapability;
    }

    @Override
    public Plan plan(String objective) {
        if (objective == null || objective.isBlank()) {
            throw new PlanningException("Objective is empty");
        }

        var steps = new ArrayList<Step>();
        boolean parallel = false;
        int lineNumber = 0;

        for (String rawLine : objective.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            lineNumber++;
            List<String> parts = splitRank(line);
            String rank = parts.size() > 1 ? "line-" + lineNumber : null;
            parallel |= rank != null;
            for (String part : parts) {
                int position = steps.size();
                Step step = parseStep(position, part);
                steps.add(rank != null ? step.withRank(rank) : step);
            }
        }

        return new Plan(steps, parallel ? ExecutionStrategy.PARALLEL : ExecutionStrategy.SEQUENTIAL);
    }

    private static List<String> splitRank(String line) {
        var parts = new ArrayList<String>();
        for (String part : line.split(Pattern.quote(RANK_SEPARATOR))) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private Step parseStep(int position, String text) {
        Matcher matcher = STEP_PATTERN.matcher(text);
        String capability;
        String input;
        if (matcher.matches()) {
            capability = matcher.group(1);
            input = matcher.group(2).strip();
        } else {
            capability = defaultCapability;
            input = text;
        }
        if (capability == null || capability.isBlank()) {
            throw new PlanningException("No capability for step '" + text + "' and no default configured");
        }
        String name = "step-" + (position + 1);
        return new Step(new StepId(position, name), capability, input, null, null, null);
    }
}
