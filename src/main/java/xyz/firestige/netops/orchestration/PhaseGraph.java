package xyz.firestige.netops.orchestration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import xyz.firestige.netops.exception.OrchestratorConfigException;

/**
 * 阶段依赖图（DAG）
 *
 * <p>依赖关系是数据而不是代码顺序。{@link Builder#build()} 在构建时检查：
 * <ul>
 *   <li>阶段名重复</li>
 *   <li>依赖了未声明的阶段</li>
 *   <li>依赖自身</li>
 *   <li>环</li>
 * </ul>
 * 任一不满足都抛出 {@link OrchestratorConfigException}，编排器因此永远不会在运行时遇到环。
 */
public final class PhaseGraph {

    private final Map<String, PhaseDefinition> phases;
    private final List<String> topologicalOrder;

    private PhaseGraph(Map<String, PhaseDefinition> phases, List<String> topologicalOrder) {
        this.phases = Collections.unmodifiableMap(phases);
        this.topologicalOrder = Collections.unmodifiableList(topologicalOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public PhaseDefinition get(String name) {
        return phases.get(name);
    }

    /**
     * 稳定的拓扑序：同一层内保持声明顺序
     */
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public List<String> dependentsOf(String name) {
        List<String> result = new ArrayList<>();
        for (PhaseDefinition def : phases.values()) {
            if (def.getDependsOn().contains(name)) {
                result.add(def.getName());
            }
        }
        return result;
    }

    public int size() {
        return phases.size();
    }

    public static final class Builder {

        private final List<PhaseDefinition> definitions = new ArrayList<>();

        private Builder() {
        }

        public Builder phase(PhaseDefinition definition) {
            definitions.add(definition);
            return this;
        }

        public PhaseGraph build() {
            Map<String, PhaseDefinition> phases = new LinkedHashMap<>();
            for (PhaseDefinition def : definitions) {
                if (phases.put(def.getName(), def) != null) {
                    throw new OrchestratorConfigException("阶段名重复: " + def.getName());
                }
            }
            for (PhaseDefinition def : phases.values()) {
                for (String dep : def.getDependsOn()) {
                    if (dep.equals(def.getName())) {
                        throw new OrchestratorConfigException("阶段依赖了自身: " + dep);
                    }
                    if (!phases.containsKey(dep)) {
                        throw new OrchestratorConfigException("阶段 " + def.getName() + " 依赖了未声明的阶段: " + dep);
                    }
                }
            }
            detectCycle(phases);
            return new PhaseGraph(phases, sort(phases));
        }

        private static void detectCycle(Map<String, PhaseDefinition> phases) {
            Set<String> done = new HashSet<>();
            for (String start : phases.keySet()) {
                if (!done.contains(start)) {
                    visit(start, phases, done, new ArrayList<>());
                }
            }
        }

        private static void visit(String name, Map<String, PhaseDefinition> phases, Set<String> done, List<String> path) {
            int index = path.indexOf(name);
            if (index >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
                cycle.add(name);
                throw new OrchestratorConfigException("阶段图存在环: " + String.join(" -> ", cycle));
            }
            if (done.contains(name)) {
                return;
            }
            path.add(name);
            for (String dep : phases.get(name).getDependsOn()) {
                visit(dep, phases, done, path);
            }
            path.remove(path.size() - 1);
            done.add(name);
        }

        // Kahn
        private static List<String> sort(Map<String, PhaseDefinition> phases) {
            Map<String, Integer> inDegree = new HashMap<>();
            for (PhaseDefinition def : phases.values()) {
                inDegree.put(def.getName(), def.getDependsOn().size());
            }
            Deque<String> ready = new ArrayDeque<>();
            for (PhaseDefinition def : phases.values()) {
                if (def.getDependsOn().isEmpty()) {
                    ready.add(def.getName());
                }
            }
            List<String> order = new ArrayList<>();
            while (!ready.isEmpty()) {
                String current = ready.poll();
                order.add(current);
                for (PhaseDefinition def : phases.values()) {
                    if (def.getDependsOn().contains(current)) {
                        int remaining = inDegree.merge(def.getName(), -1, Integer::sum);
                        if (remaining == 0) {
                            ready.add(def.getName());
                        }
                    }
                }
            }
            return order;
        }
    }
}
