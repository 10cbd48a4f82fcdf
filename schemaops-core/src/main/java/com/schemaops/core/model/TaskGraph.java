package com.schemaops.core.model;

import com.schemaops.core.exception.CircularDependencyException;
import com.schemaops.core.exception.UnresolvedDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tasks and their dependency edges.
 * Pure scheduling logic: computes readiness, cycles, topological order and
 * critical path without touching the database.
 *
 * Iteration follows insertion order, so every query is deterministic for a
 * fixed graph. Not safe for concurrent mutation.
 */
public class TaskGraph {

    private final Map<String, TaskDefinition> tasks = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();

    public TaskGraph() {
    }

    public TaskGraph(Collection<TaskDefinition> tasks) {
        tasks.forEach(this::addTask);
    }

    /**
     * Add a task, replacing any task with the same id along with its edges.
     */
    public TaskGraph addTask(TaskDefinition task) {
        TaskDefinition previous = tasks.put(task.id(), task);
        if (previous != null) {
            for (String dep : previous.dependencies()) {
                Set<String> reverse = dependents.get(dep);
                if (reverse != null) {
                    reverse.remove(task.id());
                }
            }
            dependencies.remove(task.id());
        }

        for (String dep : task.dependencies()) {
            dependencies.computeIfAbsent(task.id(), k -> new LinkedHashSet<>()).add(dep);
            dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(task.id());
        }
        return this;
    }

    public Optional<TaskDefinition> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Collection<TaskDefinition> getTasks() {
        return List.copyOf(tasks.values());
    }

    public int size() {
        return tasks.size();
    }

    public Set<String> getDependencies(String taskId) {
        return Set.copyOf(dependencies.getOrDefault(taskId, Set.of()));
    }

    public Set<String> getDependents(String taskId) {
        return Set.copyOf(dependents.getOrDefault(taskId, Set.of()));
    }

    /**
     * Tasks not yet completed whose dependencies are all completed,
     * highest priority first. Equal priorities keep insertion order.
     */
    public List<TaskDefinition> getReadyTasks(Set<String> completedTasks) {
        List<TaskDefinition> ready = new ArrayList<>();
        for (TaskDefinition task : tasks.values()) {
            if (completedTasks.contains(task.id())) {
                continue;
            }
            if (task.dependenciesSatisfied(completedTasks)) {
                ready.add(task);
            }
        }
        ready.sort(Comparator.comparingInt(TaskDefinition::priority).reversed());
        return ready;
    }

    /**
     * Dependency ids that do not name a task in this graph, keyed by the
     * task referencing them.
     */
    public Map<String, Set<String>> getUnresolvedDependencies() {
        Map<String, Set<String>> unresolved = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dep : entry.getValue()) {
                if (!tasks.containsKey(dep)) {
                    unresolved.computeIfAbsent(entry.getKey(), k -> new LinkedHashSet<>()).add(dep);
                }
            }
        }
        return unresolved;
    }

    /**
     * Depth-first cycle search from every unvisited task.
     * Each reported cycle runs from the first occurrence of the repeated
     * task to its revisit, inclusive. At least one cycle is reported when
     * any exists; overlapping cycles may be reported only once.
     */
    public List<List<String>> detectCycles() {
        Set<String> visited = new HashSet<>();
        Set<String> recursionStack = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();

        for (String taskId : tasks.keySet()) {
            if (!visited.contains(taskId)) {
                findCycle(taskId, new ArrayList<>(), visited, recursionStack, cycles);
            }
        }
        return cycles;
    }

    private boolean findCycle(String taskId, List<String> path, Set<String> visited,
                              Set<String> recursionStack, List<List<String>> cycles) {
        if (recursionStack.contains(taskId)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(taskId), path.size()));
            cycle.add(taskId);
            cycles.add(List.copyOf(cycle));
            return true;
        }
        if (visited.contains(taskId)) {
            return false;
        }

        visited.add(taskId);
        recursionStack.add(taskId);
        path.add(taskId);

        for (String dep : dependencies.getOrDefault(taskId, Set.of())) {
            if (findCycle(dep, new ArrayList<>(path), visited, recursionStack, cycles)) {
                return true;
            }
        }

        recursionStack.remove(taskId);
        return false;
    }

    /**
     * Topological order (Kahn's algorithm): every task appears after all of
     * its dependencies.
     *
     * @throws UnresolvedDependencyException if a task depends on an unknown id
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public List<String> getExecutionOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();

        for (String taskId : tasks.keySet()) {
            int degree = dependencies.getOrDefault(taskId, Set.of()).size();
            inDegree.put(taskId, degree);
            if (degree == 0) {
                queue.add(taskId);
            }
        }

        List<String> order = new ArrayList<>(tasks.size());
        while (!queue.isEmpty()) {
            String taskId = queue.poll();
            order.add(taskId);

            for (String dependent : dependents.getOrDefault(taskId, Set.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (order.size() < tasks.size()) {
            Map<String, Set<String>> unresolved = getUnresolvedDependencies();
            if (!unresolved.isEmpty()) {
                throw new UnresolvedDependencyException(unresolved);
            }
            List<List<String>> cycles = detectCycles();
            if (cycles.isEmpty()) {
                throw new CircularDependencyException("Circular dependency detected in task graph");
            }
            throw new CircularDependencyException(cycles);
        }
        return order;
    }

    /**
     * Longest path through the graph, weighting each edge by the estimated
     * duration of the task it leaves. Tasks without an estimate count as 1.
     */
    public CriticalPath getCriticalPath() {
        Map<String, Long> distances = new LinkedHashMap<>();
        Map<String, String> predecessors = new HashMap<>();
        for (String taskId : tasks.keySet()) {
            distances.put(taskId, 0L);
        }

        for (String taskId : getExecutionOrder()) {
            TaskDefinition task = tasks.get(taskId);
            long weight = task.estimatedDuration() != null ? task.estimatedDuration() : 1L;
            long candidate = distances.get(taskId) + weight;

            for (String dependent : dependents.getOrDefault(taskId, Set.of())) {
                if (candidate > distances.get(dependent)) {
                    distances.put(dependent, candidate);
                    predecessors.put(dependent, taskId);
                }
            }
        }

        long maxDistance = 0;
        String endTask = null;
        for (Map.Entry<String, Long> entry : distances.entrySet()) {
            if (entry.getValue() > maxDistance) {
                maxDistance = entry.getValue();
                endTask = entry.getKey();
            }
        }
        if (endTask == null) {
            return CriticalPath.empty();
        }

        Deque<String> path = new ArrayDeque<>();
        for (String current = endTask; current != null; current = predecessors.get(current)) {
            path.addFirst(current);
        }
        List<TaskDefinition> pathTasks = path.stream().map(tasks::get).toList();
        return new CriticalPath(List.copyOf(path), maxDistance, pathTasks);
    }
}
