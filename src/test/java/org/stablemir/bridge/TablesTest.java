package org.stablemir.bridge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stablemir.api.Crate;
import org.stablemir.api.CrateItem;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.internal.InMemoryCompilerContext;
import org.stablemir.testutil.MirFixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Query surface of a session over the in-memory demo crate.
 */
@Tag("unit")
class TablesTest {

    private Tables tables;

    @BeforeEach
    void setUp() {
        tables = new Tables(MirFixtures.demoCrate(), InternStrategy.LINEAR);
    }

    @AfterEach
    void tearDown() {
        tables.close();
    }

    @Test
    void localCrate_isCrateZero() {
        Crate local = tables.localCrate();

        assertEquals(new Crate(0, "demo", true), local);
    }

    @Test
    void externalCrates_excludeLocalCrate() {
        List<Crate> external = tables.externalCrates();

        assertThat(external).extracting(Crate::name).containsExactlyInAnyOrder("std", "core", "rand", "rand");
        assertThat(external).noneMatch(Crate::isLocal);
    }

    @Test
    @DisplayName("find_crate returns a crate with the same id for every listed crate name")
    void findCrate_isConsistentWithListing() {
        List<Crate> all = new ArrayList<>(tables.externalCrates());
        all.add(tables.localCrate());

        for (Crate crate : all) {
            Optional<Crate> found = tables.findCrate(crate.name());
            assertTrue(found.isPresent(), crate.name());
            if (!crate.name().equals("rand")) {
                assertEquals(crate.id(), found.get().id());
            }
        }
    }

    @Test
    @DisplayName("When two crates share a name the first one found wins")
    void findCrate_firstMatchWins() {
        assertThat(tables.findCrate("rand")).map(Crate::id).contains(3);
    }

    @Test
    void findCrate_prefersLocalCrate() {
        InMemoryCompilerContext tcx = InMemoryCompilerContext.builder("core")
                .externalCrate(1, "core")
                .build();
        try (Tables shadowing = new Tables(tcx, InternStrategy.LINEAR)) {
            assertThat(shadowing.findCrate("core")).map(Crate::isLocal).contains(true);
        }
    }

    @Test
    void findCrate_returnsEmptyForUnknownName() {
        assertThat(tables.findCrate("serde")).isEmpty();
    }

    @Test
    void allLocalItems_listsEveryBodyOwner() {
        List<CrateItem> items = tables.allLocalItems();

        assertThat(items).hasSize(3);
        assertThat(items).extracting(tables::itemDefId)
                .containsExactly(MirFixtures.MAIN, MirFixtures.CHECKED_ADD, MirFixtures.CLASSIFY);
    }

    @Test
    void entryFn_isOneOfTheLocalItems() {
        Optional<CrateItem> entry = tables.entryFn();

        assertTrue(entry.isPresent());
        assertThat(tables.allLocalItems()).contains(entry.get());
        assertEquals(MirFixtures.MAIN, tables.itemDefId(entry.get()));
    }

    @Test
    void entryFn_isEmptyForLibraries() {
        try (Tables library = new Tables(MirFixtures.libraryCrate(), InternStrategy.HASH_CONSING)) {
            assertThat(library.entryFn()).isEmpty();
            assertThat(library.externalCrates()).isEmpty();
        }
    }

    @Test
    void mirBody_rejectsItemFromAnotherSession() {
        CrateItem foreign;
        try (Tables other = new Tables(MirFixtures.libraryCrate(), InternStrategy.LINEAR)) {
            other.createDefId(MirFixtures.CHECKED_ADD);
            other.createDefId(MirFixtures.MAIN);
            foreign = other.crateItem(MirFixtures.CLASSIFY);
        }

        assertThatThrownBy(() -> tables.mirBody(foreign)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tyKind_rejectsUnknownHandle() {
        assertThatThrownBy(() -> tables.tyKind(new org.stablemir.api.ty.Ty(42)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withTables_exposesTheSessionItself() {
        List<Tables> seen = new ArrayList<>();

        tables.withTables(seen::add);

        assertThat(seen).containsExactly(tables);
    }

    @Test
    void closedSession_rejectsQueries() {
        CrateItem entry = tables.entryFn().orElseThrow();
        tables.close();

        assertTrue(tables.isClosed());
        assertThatThrownBy(() -> tables.localCrate()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tables.mirBody(entry)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tables.withTables(t -> { })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Tables kept past withTables stop minting and resolving handles once closed")
    void closedSession_rejectsHandleMapping() {
        List<Tables> escaped = new ArrayList<>();
        tables.withTables(escaped::add);
        Tables leaked = escaped.get(0);
        org.stablemir.api.ty.Ty i32 = leaked.internTy(org.stablemir.internal.ty.Ty.I32);
        org.stablemir.api.DefId main = leaked.createDefId(MirFixtures.MAIN);
        tables.close();

        assertThatThrownBy(() -> leaked.internTy(org.stablemir.internal.ty.Ty.BOOL))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> leaked.internalTy(i32)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> leaked.createDefId(MirFixtures.CLASSIFY)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> leaked.defId(main)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> leaked.fnDef(MirFixtures.MAIN)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void close_isIdempotent() {
        tables.close();
        tables.close();

        assertTrue(tables.isClosed());
    }
}
