package org.stablemir.bridge.convert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stablemir.api.CrateItem;
import org.stablemir.api.mir.AssertMessage;
import org.stablemir.api.mir.BasicBlock;
import org.stablemir.api.mir.BinOp;
import org.stablemir.api.mir.Body;
import org.stablemir.api.mir.Operand;
import org.stablemir.api.mir.Rvalue;
import org.stablemir.api.mir.Statement;
import org.stablemir.api.mir.Terminator;
import org.stablemir.api.ty.IntTy;
import org.stablemir.api.ty.RigidTy;
import org.stablemir.api.ty.TyKind;
import org.stablemir.bridge.Tables;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.testutil.MirFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Whole-body conversion through the query surface.
 */
@Tag("unit")
class BodyConversionTest {

    private Tables tables;

    @BeforeEach
    void setUp() {
        tables = new Tables(MirFixtures.demoCrate(), InternStrategy.LINEAR);
    }

    @AfterEach
    void tearDown() {
        tables.close();
    }

    private Body body(int itemIndex) {
        CrateItem item = tables.allLocalItems().get(itemIndex);
        return tables.mirBody(item);
    }

    @Test
    @DisplayName("Every successor of every converted body points at one of its blocks")
    void successors_stayInsideTheBody() {
        for (CrateItem item : tables.allLocalItems()) {
            Body body = tables.mirBody(item);
            int blockCount = body.blocks().size();
            for (BasicBlock block : body.blocks()) {
                assertThat(block.terminator().successors()).allMatch(s -> s >= 0 && s < blockCount);
            }
        }
    }

    @Test
    void checkedAdd_keepsStatementOrderAndMessages() {
        Body body = body(1);

        assertThat(body.blocks()).hasSize(2);
        BasicBlock entry = body.blocks().get(0);
        assertThat(entry.statements()).hasSize(1);
        Statement.Assign assign = (Statement.Assign) entry.statements().get(0);
        assertEquals(3, assign.place().local());
        assertThat(assign.rvalue()).isInstanceOf(Rvalue.CheckedBinaryOp.class);

        Terminator.Assert check = (Terminator.Assert) entry.terminator();
        assertThat(check.msg()).isInstanceOf(AssertMessage.Overflow.class);
        assertEquals(BinOp.ADD, ((AssertMessage.Overflow) check.msg()).op());
        assertThat(check.successors()).containsExactly(1);
        assertThat(body.blocks().get(1).terminator()).isInstanceOf(Terminator.Return.class);
    }

    @Test
    void locals_areInternedInDeclarationOrder() {
        Body body = body(1);

        assertThat(body.locals()).hasSize(4);
        assertEquals(body.locals().get(0), body.locals().get(1));
        assertEquals(new TyKind.Rigid(new RigidTy.Int(IntTy.I32)), body.locals().get(0).kind(tables));
        RigidTy.Tuple pair = (RigidTy.Tuple) ((TyKind.Rigid) body.locals().get(3).kind(tables)).ty();
        assertThat(pair.fields()).hasSize(2);
    }

    @Test
    void classify_keepsSwitchArmsAndCleanupEdge() {
        Body body = body(2);

        assertThat(body.blocks()).hasSize(6);
        assertThat(body.blocks().get(0).terminator().successors()).containsExactly(1, 2, 3);
        Terminator.Call call = (Terminator.Call) body.blocks().get(3).terminator();
        assertThat(call.successors()).containsExactly(4, 5);
        assertThat(call.args()).hasSize(1);
        assertThat(body.blocks().get(5).terminator()).isInstanceOf(Terminator.Resume.class);

        List<Statement> arm = body.blocks().get(1).statements();
        assertEquals(new Rvalue.Use(new Operand.Constant("10_u8")), ((Statement.Assign) arm.get(0)).rvalue());
    }
}
