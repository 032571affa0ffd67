package com.carlae.test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import com.carlae.lang.Builtins;
import com.carlae.lang.CarlaeError;
import com.carlae.lang.Environment;
import com.carlae.lang.Interpreter;
import com.carlae.lang.Printer;

// Runs every script in the examples resource directory. Only the lines
// before a script's __END__ line are evaluated; after it comes one of:
//   -- expect: --              and the printed value on the next line
//   -- expect SyntaxError: --  (or NameError, EvaluationError)
public class ExampleFilesTest {

    @Test
    public void testExampleFiles() throws IOException, URISyntaxException {
        URL url = ExampleFilesTest.class.getResource("/examples");
        assertNotNull("examples directory should be on the test classpath", url);
        List<Path> files;
        try (Stream<Path> paths = Files.list(Paths.get(url.toURI()))) {
            files = paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        assertFalse("example directory should contain files", files.isEmpty());
        for (Path file : files) {
            runExample(file);
        }
    }

    private void runExample(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        int endIdx = lines.indexOf("__END__");
        assertTrue(file + " has no __END__ line", endIdx >= 0);
        assertTrue(file + " has no expectation", lines.size() > endIdx + 1);

        String src = String.join("\n", lines.subList(0, endIdx));
        String header = lines.get(endIdx + 1);
        List<String> expected = new ArrayList<>(lines.subList(endIdx + 2, lines.size()));
        expected.removeAll(Collections.singleton(""));

        Interpreter interp = new Interpreter();
        Environment env = new Environment(Builtins.globals());
        if (header.equals("-- expect: --")) {
            Object value = interp.run(src, env);
            assertEquals(file.toString(), String.join("\n", expected), Printer.stringify(value));
        } else if (header.startsWith("-- expect ") && header.endsWith(": --")) {
            String kind = header.substring("-- expect ".length(), header.length() - ": --".length());
            try {
                Object value = interp.run(src, env);
                fail(file + " should fail with " + kind + ", got " + Printer.stringify(value));
            } catch (CarlaeError e) {
                assertEquals(file.toString(), kind, e.kind());
            }
        } else {
            fail(file + ": unknown expectation " + header);
        }
    }
}
