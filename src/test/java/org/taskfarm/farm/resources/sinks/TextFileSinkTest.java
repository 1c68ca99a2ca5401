package org.taskfarm.farm.resources.sinks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.taskfarm.farm.api.FarmParameters;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class TextFileSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneValuePerLine() throws IOException {
        Path file = tempDir.resolve("out.txt");
        try (TextFileSink sink = new TextFileSink(file, 16)) {
            sink.append(new double[] {1.5, -0.25});
            sink.append(new double[] {3.0});
            assertThat(sink.valuesWritten()).isEqualTo(3);
        }

        assertThat(Files.readAllLines(file)).containsExactly("1.5", "-0.25", "3.0");
    }

    @Test
    void configuredPathWinsOverDefaultName() throws IOException {
        Path file = tempDir.resolve("nested/dir/values.txt");
        FarmParameters parameters = new FarmParameters(10, 5, 0.0, 2);

        try (TextFileSink sink = new TextFileSink(parameters,
                ConfigFactory.parseString("path = \"" + file.toString().replace("\\", "\\\\") + "\""))) {
            assertThat(sink.getPath()).isEqualTo(file);
            assertThat(sink.describe()).isEqualTo(file.toAbsolutePath().toString());
        }
        assertThat(file).exists();
    }

    @Test
    void defaultNameFollowsTarget() {
        assertThat(TextFileSink.defaultPath(1000)).isEqualTo(Paths.get("random_1000_nums.txt"));
    }

    @Test
    void contentSurvivesCloseAndFurtherAppendsFail() throws IOException {
        Path file = tempDir.resolve("partial.txt");
        TextFileSink sink = new TextFileSink(file, 1024);
        sink.append(new double[] {42.0});
        sink.close();
        sink.close();

        assertThat(Files.readAllLines(file)).containsExactly("42.0");
        assertThatThrownBy(() -> sink.append(new double[] {1.0}))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("closed");
    }

    @Test
    void rejectsNonPositiveBuffer() {
        assertThatThrownBy(() -> new TextFileSink(tempDir.resolve("x.txt"), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
