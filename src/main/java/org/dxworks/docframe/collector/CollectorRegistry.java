package org.dxworks.docframe.collector;

import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Registered collector factories plus the kind-to-collector routing table. Built once and
 * shared; {@link #instantiate()} hands out fresh collectors for every document.
 */
public final class CollectorRegistry {

    private final List<Supplier<? extends Collector>> factories;
    private final List<String> names;
    private final int[][] routes;

    private CollectorRegistry(List<Supplier<? extends Collector>> factories, List<String> names, int[][] routes) {
        this.factories = factories;
        this.names = names;
        this.routes = routes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return factories.size();
    }

    /** Collector slots interested in {@code kind}, in registration order. */
    public int[] routesFor(TokenKind kind) {
        return routes[kind.ordinal()];
    }

    public List<Collector> instantiate() {
        List<Collector> collectors = new ArrayList<>(factories.size());
        for (Supplier<? extends Collector> factory : factories) {
            collectors.add(factory.get());
        }
        return collectors;
    }

    public static final class Builder {
        private final List<Supplier<? extends Collector>> factories = new ArrayList<>();
        private final List<String> names = new ArrayList<>();
        private final List<Set<TokenKind>> interests = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();

        public Builder register(Supplier<? extends Collector> factory) {
            Collector prototype = factory.get();
            if (prototype == null) {
                throw new IllegalArgumentException("Collector factory returned null");
            }
            String name = prototype.name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Collector name must not be blank");
            }
            Set<TokenKind> interest = prototype.interest();
            if (interest == null || interest.isEmpty()) {
                throw new IllegalArgumentException("Collector '" + name + "' declares no token kinds");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate collector name: " + name);
            }
            factories.add(factory);
            names.add(name);
            interests.add(Set.copyOf(interest));
            return this;
        }

        public CollectorRegistry build() {
            TokenKind[] kinds = TokenKind.values();
            int[][] routes = new int[kinds.length][];
            for (TokenKind kind : kinds) {
                List<Integer> slots = new ArrayList<>();
                for (int slot = 0; slot < interests.size(); slot++) {
                    if (interests.get(slot).contains(kind)) {
                        slots.add(slot);
                    }
                }
                routes[kind.ordinal()] = slots.stream().mapToInt(Integer::intValue).toArray();
            }
            return new CollectorRegistry(List.copyOf(factories), Collections.unmodifiableList(new ArrayList<>(names)), routes);
        }
    }
}
