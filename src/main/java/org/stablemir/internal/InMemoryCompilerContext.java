package org.stablemir.internal;

import org.stablemir.internal.mir.Body;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link CompilerContext} over a fixed set of crates and bodies, assembled with a {@link Builder}.
 * Used by tools that replay a snapshot of compiler state and by tests.
 */
public final class InMemoryCompilerContext implements CompilerContext {

    private final Map<CrateNum, String> crateNames;
    private final Map<DefId, Body> bodies;
    private final DefId entryFn;

    private InMemoryCompilerContext(Builder builder) {
        this.crateNames = Collections.unmodifiableMap(new LinkedHashMap<>(builder.crateNames));
        this.bodies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.bodies));
        this.entryFn = builder.entryFn;
    }

    public static Builder builder(String localCrateName) {
        return new Builder(localCrateName);
    }

    @Override
    public List<CrateNum> crates() {
        List<CrateNum> result = new ArrayList<>();
        for (CrateNum num : crateNames.keySet()) {
            if (!num.isLocal()) result.add(num);
        }
        return result;
    }

    @Override
    public String crateName(CrateNum crateNum) {
        String name = crateNames.get(crateNum);
        if (name == null) {
            throw new IllegalArgumentException("Unknown crate: " + crateNum);
        }
        return name;
    }

    @Override
    public List<DefId> mirKeys() {
        List<DefId> result = new ArrayList<>();
        for (DefId defId : bodies.keySet()) {
            if (defId.krate().isLocal()) result.add(defId);
        }
        return result;
    }

    @Override
    public Optional<DefId> entryFn() {
        return Optional.ofNullable(entryFn);
    }

    @Override
    public Body optimizedMir(DefId defId) {
        Body body = bodies.get(defId);
        if (body == null) {
            throw new IllegalArgumentException("No optimized body for " + defId);
        }
        return body;
    }

    /**
     * Collects crates and bodies. Crates are enumerated in the order they were added.
     */
    public static final class Builder {
        private final Map<CrateNum, String> crateNames = new LinkedHashMap<>();
        private final Map<DefId, Body> bodies = new LinkedHashMap<>();
        private DefId entryFn;

        private Builder(String localCrateName) {
            crateNames.put(CrateNum.LOCAL_CRATE, localCrateName);
        }

        public Builder externalCrate(int number, String name) {
            CrateNum num = new CrateNum(number);
            if (num.isLocal()) {
                throw new IllegalArgumentException("Crate number 0 is reserved for the local crate");
            }
            crateNames.put(num, name);
            return this;
        }

        public Builder body(DefId defId, Body body) {
            if (!crateNames.containsKey(defId.krate())) {
                throw new IllegalArgumentException("Body owner " + defId + " belongs to an unknown crate");
            }
            bodies.put(defId, body);
            return this;
        }

        public Builder entryFn(DefId defId) {
            this.entryFn = defId;
            return this;
        }

        public InMemoryCompilerContext build() {
            if (entryFn != null && !bodies.containsKey(entryFn)) {
                throw new IllegalStateException("Entry function " + entryFn + " has no body");
            }
            return new InMemoryCompilerContext(this);
        }
    }
}
