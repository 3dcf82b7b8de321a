package org.stablemir.bridge;

import org.stablemir.api.Context;
import org.stablemir.api.Crate;
import org.stablemir.api.CrateItem;
import org.stablemir.api.mir.Body;
import org.stablemir.api.ty.Ty;
import org.stablemir.api.ty.TyKind;
import org.stablemir.config.StableMirConfig;
import org.stablemir.internal.CompilerContext;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs stable MIR queries against a compiler. Each run gets its own session, which is closed when
 * the run returns.
 */
public final class StableMir {

    private StableMir() {
    }

    /**
     * Runs {@code body} in a fresh session configured from {@link StableMirConfig#load()}.
     *
     * @param tcx  The compiler to read from.
     * @param body The queries to run.
     * @param <T>  The result type; must not hold on to the context.
     * @return What {@code body} returned.
     */
    public static <T> T run(CompilerContext tcx, Function<Context, T> body) {
        return run(tcx, StableMirConfig.load(), body);
    }

    public static <T> T run(CompilerContext tcx, StableMirConfig config, Function<Context, T> body) {
        try (Tables tables = new Tables(tcx, config.internStrategy())) {
            return body.apply(new ContextView(tables));
        }
    }

    /**
     * Like {@link #run(CompilerContext, StableMirConfig, Function)} but hands out the privileged
     * {@link TrustedContext}.
     */
    public static <T> T runTrusted(CompilerContext tcx, StableMirConfig config, Function<TrustedContext, T> body) {
        try (Tables tables = new Tables(tcx, config.internStrategy())) {
            return body.apply(tables);
        }
    }

    /**
     * The query surface of a session without its tables.
     */
    private static final class ContextView implements Context {

        private final Tables tables;

        ContextView(Tables tables) {
            this.tables = tables;
        }

        @Override
        public Crate localCrate() {
            return tables.localCrate();
        }

        @Override
        public List<Crate> externalCrates() {
            return tables.externalCrates();
        }

        @Override
        public Optional<Crate> findCrate(String name) {
            return tables.findCrate(name);
        }

        @Override
        public List<CrateItem> allLocalItems() {
            return tables.allLocalItems();
        }

        @Override
        public Optional<CrateItem> entryFn() {
            return tables.entryFn();
        }

        @Override
        public Body mirBody(CrateItem item) {
            return tables.mirBody(item);
        }

        @Override
        public TyKind tyKind(Ty ty) {
            return tables.tyKind(ty);
        }
    }
}
