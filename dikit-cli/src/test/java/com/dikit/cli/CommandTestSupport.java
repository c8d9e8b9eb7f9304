package com.dikit.cli;

import com.dikit.DikitCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for command tests: runs the CLI in-process and captures stdout and stderr.
 */
abstract class CommandTestSupport {

    static final String SHOP = """
        model customer {
          id int @primary_key @default(autoincrement())
          email string @unique @required
          orders order[] @one_to_many(customer_id)
        }

        model order {
          id int @primary_key @default(autoincrement())
          customer_id int @required
          customer customer @many_to_one(customer_id)
          placed_at datetime @default(now())
        }
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void captureStreams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    int run(String... args) {
        return DikitCLI.commandLine().execute(args);
    }

    String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    Path write(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content);
        return file;
    }

    /**
     * Path of a configuration file that does not exist, so commands fall back to defaults.
     */
    String noConfig() {
        return tempDir.resolve("absent.yaml").toString();
    }
}
