package org.stablemir.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stablemir.api.Crate;
import org.stablemir.api.CrateItem;
import org.stablemir.api.mir.BasicBlock;
import org.stablemir.api.mir.Body;
import org.stablemir.api.mir.Statement;
import org.stablemir.api.ty.AdtDef;
import org.stablemir.api.ty.BrNamedDef;
import org.stablemir.api.ty.ClosureDef;
import org.stablemir.api.ty.FnDef;
import org.stablemir.api.ty.ForeignDef;
import org.stablemir.api.ty.GeneratorDef;
import org.stablemir.api.ty.ParamDef;
import org.stablemir.api.ty.Ty;
import org.stablemir.api.ty.TyKind;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.bridge.intern.InternTable;
import org.stablemir.internal.CompilerContext;
import org.stablemir.internal.CrateNum;
import org.stablemir.internal.DefId;
import org.stablemir.internal.mir.BasicBlockData;
import org.stablemir.internal.mir.LocalDecl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import static org.stablemir.bridge.convert.StableConverters.STATEMENTS;
import static org.stablemir.bridge.convert.StableConverters.TERMINATORS;
import static org.stablemir.bridge.convert.StableConverters.TYPES;

/**
 * One stable MIR session: the compiler context plus the tables mapping compiler values to stable
 * handles. Every handle this session mints stays valid until {@link #close()}.
 * <p>
 * Not thread-safe. Even read-looking queries may grow the tables.
 */
public final class Tables implements TrustedContext, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Tables.class);

    private final CompilerContext tcx;
    private final InternTable<DefId> defIds;
    private final InternTable<org.stablemir.internal.ty.Ty> types;
    private boolean closed;

    /**
     * Opens a session.
     *
     * @param tcx      The compiler to read from.
     * @param strategy How the session's intern tables look values up.
     */
    public Tables(CompilerContext tcx, InternStrategy strategy) {
        this.tcx = Objects.requireNonNull(tcx, "tcx");
        this.defIds = strategy.newTable();
        this.types = strategy.newTable();
        LOG.debug("Opened stable MIR session ({} interning)", strategy.configName());
    }

    public CompilerContext tcx() {
        ensureOpen();
        return tcx;
    }

    // --- Query surface ---

    @Override
    public Crate localCrate() {
        ensureOpen();
        return smirCrate(tcx, CrateNum.LOCAL_CRATE);
    }

    @Override
    public List<Crate> externalCrates() {
        ensureOpen();
        List<Crate> crates = new ArrayList<>();
        for (CrateNum crateNum : tcx.crates()) {
            crates.add(smirCrate(tcx, crateNum));
        }
        return crates;
    }

    @Override
    public Optional<Crate> findCrate(String name) {
        ensureOpen();
        List<CrateNum> candidates = new ArrayList<>();
        candidates.add(CrateNum.LOCAL_CRATE);
        candidates.addAll(tcx.crates());
        for (CrateNum crateNum : candidates) {
            if (name.equals(tcx.crateName(crateNum))) {
                return Optional.of(smirCrate(tcx, crateNum));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<CrateItem> allLocalItems() {
        ensureOpen();
        List<CrateItem> items = new ArrayList<>();
        for (DefId defId : tcx.mirKeys()) {
            items.add(crateItem(defId));
        }
        return items;
    }

    @Override
    public Optional<CrateItem> entryFn() {
        ensureOpen();
        return tcx.entryFn().map(this::crateItem);
    }

    @Override
    public Body mirBody(CrateItem item) {
        ensureOpen();
        DefId defId = itemDefId(item);
        org.stablemir.internal.mir.Body mir = tcx.optimizedMir(defId);
        LOG.debug("Converting body of {} ({} blocks, {} locals)", defId, mir.basicBlocks().size(), mir.localDecls().size());

        List<BasicBlock> blocks = new ArrayList<>(mir.basicBlocks().size());
        for (BasicBlockData block : mir.basicBlocks()) {
            List<Statement> statements = new ArrayList<>(block.statements().size());
            for (org.stablemir.internal.mir.Statement statement : block.statements()) {
                statements.add(STATEMENTS.stable(statement, this));
            }
            blocks.add(new BasicBlock(statements, TERMINATORS.stable(block.terminator(), this)));
        }

        List<Ty> locals = new ArrayList<>(mir.localDecls().size());
        for (LocalDecl decl : mir.localDecls()) {
            locals.add(internTy(decl.ty()));
        }
        return new Body(blocks, locals);
    }

    @Override
    public TyKind tyKind(Ty ty) {
        ensureOpen();
        return TYPES.stable(types.resolve(ty.id()), this);
    }

    @Override
    public void withTables(Consumer<Tables> action) {
        ensureOpen();
        action.accept(this);
    }

    // --- Type interning ---

    /**
     * @param ty A compiler type.
     * @return Its handle; equal types always share one.
     */
    public Ty internTy(org.stablemir.internal.ty.Ty ty) {
        ensureOpen();
        int before = types.size();
        int id = types.intern(ty);
        if (types.size() > before && LOG.isTraceEnabled()) {
            LOG.trace("Interned type #{}: {}", id, ty);
        }
        return new Ty(id);
    }

    /**
     * @param ty A handle minted by this session.
     * @return The compiler type behind it.
     */
    public org.stablemir.internal.ty.Ty internalTy(Ty ty) {
        ensureOpen();
        return types.resolve(ty.id());
    }

    public int internedTypeCount() {
        return types.size();
    }

    // --- Identity derivation ---

    /**
     * @param defId A compiler definition.
     * @return The session-stable handle of the definition; the same for every call with an equal id.
     */
    public org.stablemir.api.DefId createDefId(DefId defId) {
        ensureOpen();
        int before = defIds.size();
        int index = defIds.intern(defId);
        if (defIds.size() > before && LOG.isTraceEnabled()) {
            LOG.trace("Interned definition #{}: {}", index, defId);
        }
        return new org.stablemir.api.DefId(index);
    }

    /**
     * @param def A handle minted by this session.
     * @return The compiler definition behind it.
     */
    public DefId defId(org.stablemir.api.DefId def) {
        ensureOpen();
        return defIds.resolve(def.index());
    }

    public CrateItem crateItem(DefId defId) {
        return new CrateItem(createDefId(defId));
    }

    public DefId itemDefId(CrateItem item) {
        return defId(item.def());
    }

    public AdtDef adtDef(DefId defId) {
        return new AdtDef(createDefId(defId));
    }

    public FnDef fnDef(DefId defId) {
        return new FnDef(createDefId(defId));
    }

    public ClosureDef closureDef(DefId defId) {
        return new ClosureDef(createDefId(defId));
    }

    public GeneratorDef generatorDef(DefId defId) {
        return new GeneratorDef(createDefId(defId));
    }

    public ForeignDef foreignDef(DefId defId) {
        return new ForeignDef(createDefId(defId));
    }

    public ParamDef paramDef(DefId defId) {
        return new ParamDef(createDefId(defId));
    }

    public BrNamedDef brNamedDef(DefId defId) {
        return new BrNamedDef(createDefId(defId));
    }

    /**
     * @param crate A crate snapshot.
     * @return The compiler crate number it was built from.
     */
    public static CrateNum crateNum(Crate crate) {
        return new CrateNum(crate.id());
    }

    /**
     * Builds the snapshot of a crate. Pure: equal crate numbers give equal snapshots.
     *
     * @param tcx      The compiler.
     * @param crateNum The crate.
     * @return The crate snapshot.
     */
    static Crate smirCrate(CompilerContext tcx, CrateNum crateNum) {
        String crateName = tcx.crateName(crateNum);
        boolean isLocal = crateNum.isLocal();
        LOG.debug("smir_crate: crate_name={}, crate_num={}", crateName, crateNum.value());
        return new Crate(crateNum.value(), crateName, isLocal);
    }

    // --- Lifecycle ---

    /**
     * Ends the session. All handles it minted become meaningless; later queries fail.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOG.debug("Closed stable MIR session ({} types, {} definitions interned)", types.size(), defIds.size());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Stable MIR session is closed");
        }
    }
}
