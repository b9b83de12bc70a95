package com.github.asymptotic.recursion;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.asymptotic.parser.AstWalker;
import com.github.asymptotic.parser.Program;

/**
 * Which analyzed function calls which, with its strongly connected components.
 * <p>
 * Components are listed callees first, so walking {@link #components()} in order costs every
 * function after everything it depends on outside its own component.
 */
public class CallGraph {

    private final Map<String, Set<String>> edges;
    private final List<Set<String>> components;
    private final Map<String, Set<String>> componentOf = new HashMap<>();

    CallGraph(Map<String, Set<String>> edges) {
        var copy = new LinkedHashMap<String, Set<String>>();
        edges.forEach((caller, callees) -> copy.put(caller, Collections.unmodifiableSet(new LinkedHashSet<>(callees))));
        this.edges = Collections.unmodifiableMap(copy);
        this.components = new Tarjan().run();
        for (var component : components) {
            for (var member : component) {
                componentOf.put(member, component);
            }
        }
    }

    public static CallGraph of(Program program) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (var function : program.functions()) {
            edges.put(function.name(), new LinkedHashSet<>());
        }
        for (var function : program.functions()) {
            for (var call : AstWalker.calls(function.body())) {
                if (edges.containsKey(call.name())) {
                    edges.get(function.name()).add(call.name());
                }
            }
        }
        return new CallGraph(edges);
    }

    public Set<String> functions() {
        return edges.keySet();
    }

    public Set<String> callees(String function) {
        return edges.getOrDefault(function, Set.of());
    }

    /** Strongly connected components, callees before callers. */
    public List<Set<String>> components() {
        return components;
    }

    public Set<String> componentOf(String function) {
        return componentOf.getOrDefault(function, Set.of());
    }

    public boolean isRecursive(String function) {
        return componentOf(function).size() > 1 || callees(function).contains(function);
    }

    /** Whether some other function calls this one. */
    public boolean isCalledByOthers(String function) {
        return edges.entrySet().stream()
                .anyMatch(e -> !e.getKey().equals(function) && e.getValue().contains(function));
    }

    @Override
    public String toString() {
        return edges.toString();
    }

    private class Tarjan {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<Set<String>> result = new ArrayList<>();
        private int counter;

        List<Set<String>> run() {
            for (var function : edges.keySet()) {
                if (!index.containsKey(function)) {
                    connect(function);
                }
            }
            return Collections.unmodifiableList(result);
        }

        private void connect(String function) {
            index.put(function, counter);
            lowLink.put(function, counter);
            counter++;
            stack.push(function);
            onStack.add(function);

            for (var callee : edges.get(function)) {
                if (!index.containsKey(callee)) {
                    connect(callee);
                    lowLink.put(function, Math.min(lowLink.get(function), lowLink.get(callee)));
                } else if (onStack.contains(callee)) {
                    lowLink.put(function, Math.min(lowLink.get(function), index.get(callee)));
                }
            }

            if (lowLink.get(function).equals(index.get(function))) {
                var component = new LinkedHashSet<String>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(function));
                result.add(Collections.unmodifiableSet(component));
            }
        }
    }

}
