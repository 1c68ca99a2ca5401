package org.taskfarm.farm.resources.sinks;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.taskfarm.farm.api.FarmParameters;
import org.taskfarm.farm.api.resources.ISink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Writes every value on its own line to a text file.
 * <p>
 * The file is created (or truncated) when the sink is constructed. Whatever was appended
 * before a failure stays on disk after {@link #close()}.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>path</b>: output file (default: {@code random_<target>_nums.txt} in the working directory).</li>
 *   <li><b>bufferSize</b>: writer buffer in bytes (default: 65536).</li>
 * </ul>
 */
public class TextFileSink implements ISink {

    private static final Logger log = LoggerFactory.getLogger(TextFileSink.class);

    private final Path path;
    private final Writer writer;
    private long valuesWritten;
    private boolean closed;

    /**
     * Creates the sink from configuration.
     *
     * @param parameters the run parameters, used for the default file name.
     * @param options    sink options.
     * @throws IOException if the file cannot be created.
     */
    public TextFileSink(FarmParameters parameters, Config options) throws IOException {
        this(options.hasPath("path") && !options.getString("path").isBlank()
                ? Paths.get(options.getString("path"))
                : defaultPath(parameters.target()),
            options.hasPath("bufferSize") ? options.getInt("bufferSize") : 65536);
    }

    /**
     * @param path       the output file.
     * @param bufferSize writer buffer in bytes.
     * @throws IOException if the file cannot be created.
     */
    public TextFileSink(Path path, int bufferSize) throws IOException {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got: " + bufferSize);
        }
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = new BufferedWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8), bufferSize);
        log.debug("Opened output file {}", path.toAbsolutePath());
    }

    /**
     * @param target total number of values of the run.
     * @return the default output file for a run of {@code target} values.
     */
    public static Path defaultPath(long target) {
        return Paths.get(String.format("random_%d_nums.txt", target));
    }

    @Override
    public void append(double[] values) throws IOException {
        if (closed) {
            throw new IOException("Sink for " + path + " is already closed");
        }
        for (double value : values) {
            writer.write(Double.toString(value));
            writer.write('\n');
        }
        valuesWritten += values.length;
    }

    @Override
    public long valuesWritten() {
        return valuesWritten;
    }

    @Override
    public String describe() {
        return path.toAbsolutePath().toString();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.close();
        log.debug("Closed output file {} after {} values", path.toAbsolutePath(), valuesWritten);
    }
}
