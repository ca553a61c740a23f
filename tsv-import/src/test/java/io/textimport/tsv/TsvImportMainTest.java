package io.textimport.tsv;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TsvImportMainTest {
    private static int run(String... args) {
        return new CommandLine(new TsvImportMain()).execute(args);
    }

    @Test
    void imports_file_with_header_in_order() throws Exception {
        Path dir = Files.createTempDirectory("tsv-import");
        Path in = dir.resolve("in.tsv");
        Path out = dir.resolve("out/docs.jsonl");
        Files.writeString(in, "name\tage\nann\t31\nbob\t42\n", StandardCharsets.UTF_8);

        int code = run("--file", in.toString(), "--out", out.toString(), "--headerline",
                "--maintainInsertionOrder", "--inferTypes", "-j", "2");

        assertEquals(0, code);
        assertEquals(List.of("{\"name\":\"ann\",\"age\":31}", "{\"name\":\"bob\",\"age\":42}"),
                Files.readAllLines(out, StandardCharsets.UTF_8));
    }

    @Test
    void field_file_and_stop_on_error() throws Exception {
        Path dir = Files.createTempDirectory("tsv-import");
        Path in = dir.resolve("in.tsv");
        Path fieldFile = dir.resolve("fields.txt");
        Path out = dir.resolve("docs.jsonl");
        Files.writeString(in, "1\t2\n5\n3\t4\n", StandardCharsets.UTF_8);
        Files.writeString(fieldFile, "a\nb\n", StandardCharsets.UTF_8);

        int lenient = run("--file", in.toString(), "--out", out.toString(), "--fieldFile", fieldFile.toString(),
                "--strictTokenCount", "--maintainInsertionOrder");
        assertEquals(0, lenient);
        assertEquals(2, Files.readAllLines(out).size());

        int failing = run("--file", in.toString(), "--out", out.toString(), "--fields", "a,b",
                "--strictTokenCount", "--maintainInsertionOrder", "--stopOnError");
        assertEquals(1, failing);
        assertEquals(List.of("{\"a\":\"1\",\"b\":\"2\"}"), Files.readAllLines(out));
    }

    @Test
    void conflicting_field_options_are_usage_errors() throws Exception {
        Path in = Files.createTempFile("tsv-import", ".tsv");
        assertEquals(2, run("--file", in.toString(), "--headerline", "--fields", "a"));
        assertEquals(2, run("--file", in.toString()));
        assertEquals(2, run("--file", in.toString(), "--fields", "a,a"));
    }

    @Test
    void reads_stdin_without_closing_it() throws Exception {
        Path out = Files.createTempDirectory("tsv-import").resolve("docs.jsonl");
        class TrackingInput extends ByteArrayInputStream {
            boolean closed;
            TrackingInput(byte[] data) { super(data); }
            @Override public void close() { closed = true; }
        }
        TrackingInput stdin = new TrackingInput("x\ty\n".getBytes(StandardCharsets.UTF_8));
        InputStream saved = System.in;
        System.setIn(stdin);
        try {
            assertEquals(0, run("--fields", "a,b", "--out", out.toString()));
        } finally {
            System.setIn(saved);
        }
        assertFalse(stdin.closed);
        assertEquals(List.of("{\"a\":\"x\",\"b\":\"y\"}"), Files.readAllLines(out, StandardCharsets.UTF_8));
    }
}
