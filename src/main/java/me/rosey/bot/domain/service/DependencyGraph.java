package me.rosey.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.rosey.bot.domain.model.PluginManifest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of plugin dependencies. Edges point from a plugin to the
 * plugins it requires; {@link #dependentsOf} is the exact transpose.
 */
public final class DependencyGraph {

    /** Higher priority first, then by name. */
    private static final Comparator<PluginManifest> START_ORDER = Comparator
            .comparingInt(PluginManifest::getPriority).reversed()
            .thenComparing(PluginManifest::getName);

    private final Map<String, PluginManifest> manifests;
    private final Map<String, Set<String>> dependents;

    private DependencyGraph(Map<String, PluginManifest> manifests) {
        this.manifests = manifests;
        Map<String, Set<String>> transpose = new HashMap<>();
        for (PluginManifest manifest : manifests.values()) {
            transpose.computeIfAbsent(manifest.getName(), k -> new TreeSet<>());
            for (String dependency : manifest.getDependencies()) {
                if (manifests.containsKey(dependency)) {
                    transpose.computeIfAbsent(dependency, k -> new TreeSet<>()).add(manifest.getName());
                }
            }
        }
        this.dependents = transpose;
    }

    public static DependencyGraph of(Collection<PluginManifest> manifests) {
        Map<String, PluginManifest> byName = new LinkedHashMap<>();
        for (PluginManifest manifest : manifests) {
            byName.put(manifest.getName(), manifest);
        }
        return new DependencyGraph(byName);
    }

    /**
     * Graph with one more plugin, used to vet an install before committing it.
     */
    public DependencyGraph with(PluginManifest manifest) {
        Map<String, PluginManifest> byName = new LinkedHashMap<>(manifests);
        byName.put(manifest.getName(), manifest);
        return new DependencyGraph(byName);
    }

    public boolean contains(String name) {
        return manifests.containsKey(name);
    }

    public List<String> dependenciesOf(String name) {
        PluginManifest manifest = manifests.get(name);
        return manifest != null ? manifest.getDependencies() : List.of();
    }

    public Set<String> dependentsOf(String name) {
        return Set.copyOf(dependents.getOrDefault(name, Set.of()));
    }

    /**
     * Dependencies that are not registered.
     */
    public List<String> missingDependencies(String name) {
        return dependenciesOf(name).stream()
                .filter(dependency -> !manifests.containsKey(dependency))
                .toList();
    }

    /**
     * Every plugin that depends on {@code name} directly or indirectly, ordered
     * so that each plugin appears before anything it depends on. Stopping in
     * this order never stops a dependency while a dependent still runs.
     */
    public List<String> transitiveDependentsInStopOrder(String name) {
        List<String> postOrder = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        visited.add(name);
        for (String dependent : dependents.getOrDefault(name, Set.of())) {
            collectDependents(dependent, visited, postOrder);
        }
        return postOrder;
    }

    private void collectDependents(String name, Set<String> visited, List<String> postOrder) {
        if (!visited.add(name)) {
            return;
        }
        for (String dependent : dependents.getOrDefault(name, Set.of())) {
            collectDependents(dependent, visited, postOrder);
        }
        postOrder.add(name);
    }

    /**
     * Plugins that sit on a dependency cycle (including self-loops), found by a
     * depth-first strongly-connected-components pass.
     */
    public Set<String> findCycleMembers() {
        Tarjan tarjan = new Tarjan();
        for (String name : new TreeSet<>(manifests.keySet())) {
            if (!tarjan.index.containsKey(name)) {
                tarjan.visit(name);
            }
        }
        return tarjan.members;
    }

    /**
     * Kahn's algorithm over registered plugins. Missing dependencies do not
     * constrain the order. Ties are broken by priority (higher first), then
     * by name.
     *
     * @return the order plus the plugins that could not be ordered because
     *         they are on, or downstream of, a cycle
     */
    public TopologicalOrder topologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (PluginManifest manifest : manifests.values()) {
            int degree = (int) manifest.getDependencies().stream()
                    .filter(manifests::containsKey)
                    .count();
            inDegree.put(manifest.getName(), degree);
        }

        PriorityQueue<PluginManifest> ready = new PriorityQueue<>(START_ORDER);
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(manifests.get(name));
            }
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            PluginManifest next = ready.poll();
            order.add(next.getName());
            for (String dependent : dependents.getOrDefault(next.getName(), Set.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(manifests.get(dependent));
                }
            }
        }

        Set<String> residual = new TreeSet<>(manifests.keySet());
        order.forEach(residual::remove);
        return new TopologicalOrder(List.copyOf(order), Set.copyOf(residual));
    }

    /**
     * Result of {@link #topologicalOrder()}.
     *
     * @param order
     *            start order, dependencies first
     * @param residual
     *            plugins left with a non-zero in-degree
     */
    public record TopologicalOrder(List<String> order, Set<String> residual) {

        public List<String> reversed() {
            List<String> reversed = new ArrayList<>(order);
            Collections.reverse(reversed);
            return reversed;
        }
    }

    private final class Tarjan {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final Set<String> members = new TreeSet<>();
        private int counter;

        private void visit(String name) {
            index.put(name, counter);
            lowLink.put(name, counter);
            counter++;
            stack.push(name);
            onStack.add(name);

            for (String dependency : dependenciesOf(name)) {
                if (!manifests.containsKey(dependency)) {
                    continue;
                }
                if (!index.containsKey(dependency)) {
                    visit(dependency);
                    lowLink.put(name, Math.min(lowLink.get(name), lowLink.get(dependency)));
                } else if (onStack.contains(dependency)) {
                    lowLink.put(name, Math.min(lowLink.get(name), index.get(dependency)));
                }
            }

            if (lowLink.get(name).equals(index.get(name))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(name));
                if (component.size() > 1 || dependenciesOf(name).contains(name)) {
                    members.addAll(component);
                }
            }
        }
    }
}
