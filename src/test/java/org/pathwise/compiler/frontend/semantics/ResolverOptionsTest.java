package org.pathwise.compiler.frontend.semantics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pathwise.compiler.frontend.semantics.ResolverOptions.LocalImportCollision;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ResolverOptionsTest {

    @Test
    void referenceDefaultsMatchConstant() {
        Config reference = ConfigFactory.defaultReference().getConfig("pathwise.resolver");

        assertThat(ResolverOptions.fromConfig(reference)).isEqualTo(ResolverOptions.DEFAULTS);
    }

    @Test
    void policyIsCaseInsensitive() {
        Config config = ConfigFactory.parseString("parallelism = 3\nlocal-import-collision = shadow");

        ResolverOptions options = ResolverOptions.fromConfig(config);

        assertThat(options.parallelism()).isEqualTo(3);
        assertThat(options.localImportCollision()).isEqualTo(LocalImportCollision.SHADOW);
    }

    @Test
    void zeroParallelismMeansAllProcessors() {
        Config config = ConfigFactory.parseString("parallelism = 0\nlocal-import-collision = REPORT");

        assertThat(ResolverOptions.fromConfig(config).parallelism())
                .isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void effectiveParallelismKeepsPositiveCounts() {
        assertThat(ResolverOptions.effectiveParallelism(2)).isEqualTo(2);
        assertThat(ResolverOptions.effectiveParallelism(-1)).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void unknownPolicyIsABadValue() {
        Config config = ConfigFactory.parseString("parallelism = 1\nlocal-import-collision = MERGE");

        assertThatThrownBy(() -> ResolverOptions.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("local-import-collision");
    }

    @Test
    void constructorValidates() {
        assertThatThrownBy(() -> new ResolverOptions(0, LocalImportCollision.REPORT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolverOptions(1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
