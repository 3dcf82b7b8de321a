package org.stablemir.bridge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.stablemir.api.ConversionErrorCode;
import org.stablemir.api.ConversionException;
import org.stablemir.api.CrateItem;
import org.stablemir.api.mir.Body;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.internal.CompilerContext;
import org.stablemir.internal.mir.BasicBlockData;
import org.stablemir.internal.mir.LocalDecl;
import org.stablemir.internal.mir.Statement;
import org.stablemir.internal.mir.StatementKind;
import org.stablemir.internal.mir.Terminator;
import org.stablemir.internal.mir.TerminatorKind;
import org.stablemir.internal.ty.Ty;
import org.stablemir.testutil.MirFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * {@code mirBody} against a mocked compiler, to observe how often the compiler is asked.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MirBodyQueryTest {

    @Mock
    private CompilerContext tcx;

    private Tables tables;

    @BeforeEach
    void setUp() {
        tables = new Tables(tcx, InternStrategy.HASH_CONSING);
    }

    @Test
    @DisplayName("Bodies are not cached: every call re-reads and re-converts the compiler body")
    void mirBody_isRecomputedOnEveryCall() {
        // Arrange
        when(tcx.mirKeys()).thenReturn(List.of(MirFixtures.CHECKED_ADD));
        when(tcx.optimizedMir(MirFixtures.CHECKED_ADD)).thenReturn(MirFixtures.checkedAdd());
        CrateItem item = tables.allLocalItems().get(0);

        // Act
        Body first = item.body(tables);
        Body second = tables.mirBody(item);

        // Assert
        assertThat(second).isEqualTo(first);
        verify(tcx, times(2)).optimizedMir(MirFixtures.CHECKED_ADD);
    }

    @Test
    @DisplayName("Converting a body twice does not grow the type table")
    void mirBody_reusesTypeHandles() {
        when(tcx.mirKeys()).thenReturn(List.of(MirFixtures.CHECKED_ADD));
        when(tcx.optimizedMir(MirFixtures.CHECKED_ADD)).thenReturn(MirFixtures.checkedAdd());
        CrateItem item = tables.allLocalItems().get(0);

        tables.mirBody(item);
        int afterFirst = tables.internedTypeCount();
        tables.mirBody(item);

        assertThat(tables.internedTypeCount()).isEqualTo(afterFirst);
    }

    @Test
    @DisplayName("An unsupported statement abandons the whole query, the session stays usable")
    void mirBody_failsAsAWhole() {
        // Arrange
        org.stablemir.internal.mir.Body withStorageMarker = new org.stablemir.internal.mir.Body(
                List.of(new BasicBlockData(
                        List.of(Statement.of(new StatementKind.StorageLive(1))),
                        Terminator.of(new TerminatorKind.Return()))),
                List.of(LocalDecl.of(Ty.UNIT), LocalDecl.of(Ty.I32)),
                0);
        when(tcx.mirKeys()).thenReturn(List.of(MirFixtures.MAIN, MirFixtures.CHECKED_ADD));
        when(tcx.optimizedMir(MirFixtures.MAIN)).thenReturn(withStorageMarker);
        when(tcx.optimizedMir(MirFixtures.CHECKED_ADD)).thenReturn(MirFixtures.checkedAdd());
        List<CrateItem> items = tables.allLocalItems();

        // Act & Assert
        assertThatThrownBy(() -> tables.mirBody(items.get(0)))
                .isInstanceOf(ConversionException.class)
                .extracting(e -> ((ConversionException) e).code())
                .isEqualTo(ConversionErrorCode.NOT_YET_IMPLEMENTED);
        assertThat(tables.mirBody(items.get(1)).blocks()).hasSize(2);
    }
}
