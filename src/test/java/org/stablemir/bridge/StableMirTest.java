package org.stablemir.bridge;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stablemir.api.Context;
import org.stablemir.api.CrateItem;
import org.stablemir.api.mir.Body;
import org.stablemir.config.StableMirConfig;
import org.stablemir.testutil.MirFixtures;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StableMirTest {

    @Test
    void run_returnsTheCallersResult() {
        String name = StableMir.run(MirFixtures.demoCrate(), context -> context.localCrate().name());

        assertThat(name).isEqualTo("demo");
    }

    @Test
    void run_closesTheSessionAfterwards() {
        AtomicReference<Context> escaped = new AtomicReference<>();
        CrateItem entry = StableMir.run(MirFixtures.demoCrate(), StableMirConfig.defaults(), context -> {
            escaped.set(context);
            return context.entryFn().orElseThrow();
        });

        assertThatThrownBy(() -> escaped.get().mirBody(entry)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void run_honorsConfiguredStrategy() {
        StableMirConfig config = StableMirConfig.from(
                ConfigFactory.parseString("stablemir.interning.strategy = hash-consing"));

        Body body = StableMir.run(MirFixtures.demoCrate(), config,
                context -> context.entryFn().orElseThrow().body(context));

        assertThat(body.blocks()).hasSize(1);
    }

    @Test
    @DisplayName("An ordinary run hands out no way to the session tables")
    void run_hidesTheTrustedContext() {
        boolean trusted = StableMir.run(MirFixtures.demoCrate(), StableMirConfig.defaults(),
                context -> context instanceof TrustedContext || context instanceof Tables);

        assertThat(trusted).isFalse();
    }

    @Test
    void run_answersEveryQueryThroughTheView() {
        StableMir.run(MirFixtures.demoCrate(), StableMirConfig.defaults(), context -> {
            assertThat(context.externalCrates()).hasSize(4);
            assertThat(context.findCrate("std")).isPresent();
            assertThat(context.allLocalItems()).hasSize(3);
            Body body = context.mirBody(context.allLocalItems().get(1));
            assertThat(context.tyKind(body.locals().get(0))).isNotNull();
            return null;
        });
    }

    @Test
    void runTrusted_exposesTables() {
        int types = StableMir.runTrusted(MirFixtures.demoCrate(), StableMirConfig.defaults(), context -> {
            int[] count = new int[1];
            context.allLocalItems().forEach(context::mirBody);
            context.withTables(tables -> count[0] = tables.internedTypeCount());
            return count[0];
        });

        assertThat(types).isPositive();
    }
}
