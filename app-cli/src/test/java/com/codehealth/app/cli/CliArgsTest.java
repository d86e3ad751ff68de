package com.codehealth.app.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgsTest {

    @Test
    void pathOnly() {
        CliArgs a = CliArgs.parse(List.of("runs/r1/findings"));

        assertThat(a.input()).isEqualTo(Path.of("runs/r1/findings"));
        assertThat(a.out()).isNull();
        assertThat(a.config()).isNull();
        assertThat(a.help()).isFalse();
    }

    @Test
    void optionsInBothForms_anyOrder() {
        CliArgs a = CliArgs.parse(List.of("--out", "merged.json", "runs", "--config=ci/audit.yml"));

        assertThat(a.input()).isEqualTo(Path.of("runs"));
        assertThat(a.out()).isEqualTo(Path.of("merged.json"));
        assertThat(a.config()).isEqualTo(Path.of("ci/audit.yml"));

        assertThat(CliArgs.parse(List.of("runs", "--out=x.json")).out()).isEqualTo(Path.of("x.json"));
    }

    @Test
    void help_stopsParsing() {
        assertThat(CliArgs.parse(List.of("-h")).help()).isTrue();
        assertThat(CliArgs.parse(List.of("--help", "--bogus")).help()).isTrue();
        assertThat(CliArgs.parse(List.of("runs", "--help")).input()).isNull();
    }

    @Test
    void invalidUsage() {
        assertThatThrownBy(() -> CliArgs.parse(List.of()))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("missing <path>");
        assertThatThrownBy(() -> CliArgs.parse(List.of("runs", "--out")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--out");
        assertThatThrownBy(() -> CliArgs.parse(List.of("runs", "--out=")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CliArgs.parse(List.of("runs", "--verbose")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("unknown option");
        assertThatThrownBy(() -> CliArgs.parse(List.of("a", "b")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("unexpected argument");
    }
}
