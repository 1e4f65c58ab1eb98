/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.datagrid.validation.engine;

import org.fireflyframework.datagrid.validation.RuleDescriptor;
import org.fireflyframework.datagrid.validation.ValidationConfigurationException;
import org.fireflyframework.datagrid.validation.ValidationRule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders a rule set for execution and determines which rules may run concurrently.
 *
 * <p>Rules are sorted by priority ascending with unprioritized rules last; equal
 * priorities keep declaration order. Two rules are placed in the same lane when they
 * read a common column, or when either of them reads the whole target. Lanes are
 * independent of each other.</p>
 *
 * <p>The scheduler holds no state and is safe to share.</p>
 */
public class RuleScheduler {

    private static final Comparator<Candidate> PRIORITY_ORDER = Comparator
            .comparing((Candidate candidate) -> candidate.descriptor().getPriority(),
                    Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(Candidate::declarationIndex);

    /**
     * Builds the execution plan for the given rules.
     *
     * @param rules the active rule set, in declaration order
     * @param <T>   the type of target the rules validate
     * @return the execution plan
     * @throws ValidationConfigurationException if the rule set or any rule in it is malformed
     */
    public <T> ExecutionPlan<T> plan(List<? extends ValidationRule<T>> rules) {
        if (rules == null) {
            throw new ValidationConfigurationException("Rule set must not be null");
        }

        List<Candidate> candidates = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            ValidationRule<T> rule = rules.get(i);
            candidates.add(new Candidate(rule, checkDescriptor(rule, i), i));
        }
        candidates.sort(PRIORITY_ORDER);

        int[] laneRoots = assignLanes(candidates);
        Map<Integer, Integer> laneIndexByRoot = new LinkedHashMap<>();
        Map<Integer, Integer> laneSizes = new LinkedHashMap<>();
        for (int root : laneRoots) {
            laneIndexByRoot.putIfAbsent(root, laneIndexByRoot.size());
            laneSizes.merge(root, 1, Integer::sum);
        }

        List<PlannedRule<T>> ordered = new ArrayList<>(candidates.size());
        List<List<PlannedRule<T>>> lanes = new ArrayList<>();
        for (int i = 0; i < laneIndexByRoot.size(); i++) {
            lanes.add(new ArrayList<>());
        }

        for (int planIndex = 0; planIndex < candidates.size(); planIndex++) {
            Candidate candidate = candidates.get(planIndex);
            int root = laneRoots[planIndex];
            int lane = laneIndexByRoot.get(root);
            @SuppressWarnings("unchecked")
            PlannedRule<T> planned = PlannedRule.<T>builder()
                    .rule((ValidationRule<T>) candidate.rule())
                    .descriptor(candidate.descriptor())
                    .declarationIndex(candidate.declarationIndex())
                    .planIndex(planIndex)
                    .lane(lane)
                    .parallelSafe(laneSizes.get(root) == 1)
                    .build();
            ordered.add(planned);
            lanes.get(lane).add(planned);
        }

        return new ExecutionPlan<>(
                Collections.unmodifiableList(ordered),
                lanes.stream().map(Collections::unmodifiableList).toList());
    }

    private RuleDescriptor checkDescriptor(ValidationRule<?> rule, int index) {
        if (rule == null) {
            throw new ValidationConfigurationException("Rule at position " + index + " is null");
        }
        RuleDescriptor descriptor = rule.descriptor();
        if (descriptor == null) {
            throw new ValidationConfigurationException("Rule at position " + index + " has no descriptor");
        }
        if (descriptor.getMessage() == null || descriptor.getMessage().isBlank()) {
            throw new ValidationConfigurationException(
                    "Rule '" + descriptor.displayName(index) + "' must declare a non-empty message");
        }
        if (descriptor.getSeverity() == null) {
            throw new ValidationConfigurationException(
                    "Rule '" + descriptor.displayName(index) + "' must declare a severity");
        }
        Duration timeout = descriptor.getTimeout();
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new ValidationConfigurationException(
                    "Rule '" + descriptor.displayName(index) + "' has a non-positive timeout: " + timeout);
        }
        return descriptor;
    }

    /**
     * Union-find over the sorted candidates. Returns, for each plan position, the plan
     * position of its lane's root.
     */
    private int[] assignLanes(List<Candidate> candidates) {
        int[] parent = new int[candidates.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                if (conflicts(candidates.get(i).descriptor(), candidates.get(j).descriptor())) {
                    union(parent, i, j);
                }
            }
        }
        int[] roots = new int[parent.length];
        for (int i = 0; i < parent.length; i++) {
            roots[i] = find(parent, i);
        }
        return roots;
    }

    private static boolean conflicts(RuleDescriptor a, RuleDescriptor b) {
        if (a.readsWholeTarget() || b.readsWholeTarget()) {
            return true;
        }
        return !Collections.disjoint(a.getColumns(), b.getColumns());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    // The smaller plan position becomes the root so lanes are numbered by their first rule.
    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }

    private record Candidate(ValidationRule<?> rule, RuleDescriptor descriptor, int declarationIndex) {}
}
