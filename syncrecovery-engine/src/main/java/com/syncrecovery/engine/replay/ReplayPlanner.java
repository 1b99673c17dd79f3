package com.syncrecovery.engine.replay;

import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ReplayOptions;
import com.syncrecovery.core.model.ReplayStrategy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns the events matched by a session filter into an ordered replay plan.
 * 
 * Base order is always chronological (timestamp, then append sequence) so
 * two plans over the same events are identical.
 */
public class ReplayPlanner {

    private static final String UNKEYED_LANE = "";

    private final Map<String, ReplaySelector> selectors = new ConcurrentHashMap<>();

    public void registerSelector(ReplaySelector selector) {
        selectors.put(selector.name(), selector);
    }

    public boolean hasSelector(String name) {
        return selectors.containsKey(name);
    }

    /**
     * Reject options naming selectors that are not registered.
     */
    public void checkSelectors(ReplayOptions options) {
        for (String name : options.selectors()) {
            if (!selectors.containsKey(name)) {
                throw new InvalidRequestException("Unknown replay selector: " + name);
            }
        }
    }

    /**
     * Build the plan for a run.
     * 
     * @throws ReplayPlanningException if declared dependencies form a cycle
     */
    public ReplayPlan plan(List<ChangeEvent> matched, ReplayOptions options) {
        List<ChangeEvent> base = new ArrayList<>(matched);
        base.sort(ChangeEvent.CHRONOLOGICAL);

        List<ChangeEvent> selected = select(base, options);
        int excluded = base.size() - selected.size();

        List<ChangeEvent> ordered = options.strategy() == ReplayStrategy.DEPENDENCY_AWARE
            ? orderByDependencies(selected)
            : selected;

        List<ReplayPlan.Step> steps = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            steps.add(new ReplayPlan.Step(ordered.get(i), i));
        }

        List<List<ReplayPlan.Step>> lanes = options.strategy() == ReplayStrategy.PARALLEL
            ? partitionByResource(steps)
            : List.of(steps);

        return new ReplayPlan(steps, lanes, excluded);
    }

    // ========== Selection ==========

    private List<ChangeEvent> select(List<ChangeEvent> events, ReplayOptions options) {
        Set<String> skip = new HashSet<>(options.skipEvents());
        Set<String> include = new HashSet<>(options.includeEvents());

        if (options.strategy() == ReplayStrategy.SELECTIVE) {
            checkSelectors(options);
            List<ReplaySelector> active = options.selectors().stream().map(selectors::get).toList();
            boolean selectAll = active.isEmpty() && include.isEmpty();
            return events.stream()
                .filter(event -> !skip.contains(event.id()))
                .filter(event -> selectAll
                    || include.contains(event.id())
                    || active.stream().anyMatch(selector -> selector.test(event)))
                .toList();
        }

        return events.stream()
            .filter(event -> !skip.contains(event.id()))
            .filter(event -> include.isEmpty() || include.contains(event.id()))
            .toList();
    }

    // ========== Dependency Ordering ==========

    /**
     * Topological order over metadata.dependsOn. Among ready events the
     * chronologically earliest goes first. Dependencies on events outside
     * the plan are treated as already applied.
     */
    private List<ChangeEvent> orderByDependencies(List<ChangeEvent> events) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            position.put(events.get(i).id(), i);
        }

        int[] pending = new int[events.size()];
        Map<Integer, List<Integer>> dependents = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            for (String dependency : new HashSet<>(events.get(i).dependsOn())) {
                Integer from = position.get(dependency);
                if (from == null) {
                    continue;
                }
                pending[i]++;
                dependents.computeIfAbsent(from, k -> new ArrayList<>()).add(i);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < events.size(); i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }

        List<ChangeEvent> ordered = new ArrayList<>(events.size());
        while (!ready.isEmpty()) {
            int next = ready.poll();
            ordered.add(events.get(next));
            for (int dependent : dependents.getOrDefault(next, List.of())) {
                if (--pending[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < events.size()) {
            String cycle = IntStream.range(0, events.size())
                .filter(i -> pending[i] > 0)
                .mapToObj(i -> events.get(i).id())
                .collect(Collectors.joining(", "));
            throw new ReplayPlanningException("Dependency cycle among events: " + cycle);
        }
        return ordered;
    }

    // ========== Parallel Lanes ==========

    /**
     * Events touching the same resource stay in one ordered lane. Events
     * without a resource key cannot be proven independent and share a lane.
     */
    private List<List<ReplayPlan.Step>> partitionByResource(List<ReplayPlan.Step> steps) {
        Map<String, List<ReplayPlan.Step>> lanes = new LinkedHashMap<>();
        for (ReplayPlan.Step step : steps) {
            String key = step.event().resourceKey();
            lanes.computeIfAbsent(key != null ? key : UNKEYED_LANE, k -> new ArrayList<>()).add(step);
        }
        return new ArrayList<>(lanes.values());
    }
}
