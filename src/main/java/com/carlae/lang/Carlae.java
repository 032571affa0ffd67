package com.carlae.lang;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Paths;

import jline.console.ConsoleReader;

public class Carlae {
    private static final Interpreter interpreter = new Interpreter();

    private static final String PROMPT = "in> ";
    private static final String OUTPUT_PREFIX = "out> ";

    public static void main(String[] args) throws IOException {
        String fname = null;
        String debugKeysStr = null;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length) {
                fname = args[i+1];
                i += 2;
            } else if (args[i].equals("-D") && i + 1 < args.length) {
                debugKeysStr = args[i+1];
                i += 2;
            } else {
                System.err.println("Usage: Carlae [-f FILENAME] [-D DEBUGKEYS]");
                System.exit(1);
            }
        }

        if (debugKeysStr != null) {
            for (String key : debugKeysStr.split(",")) {
                CarlaeUtil.enableDebug(key.trim());
            }
        }
        if (fname == null) {
            runPrompt();
        } else {
            System.exit(runFile(fname));
        }
    }

    // exit status: 0 ok, 65 syntax error, 70 any other Carlae error
    private static int runFile(String path) throws IOException {
        Environment env = new Environment(Builtins.globals());
        try {
            Object value = interpreter.runFile(Paths.get(path), env);
            System.out.println(Printer.stringify(value));
            return 0;
        } catch (CarlaeError error) {
            reportError(error);
            return (error instanceof CarlaeSyntaxError) ? 65 : 70;
        }
    }

    private static void runPrompt() throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput());
        reader.setPrompt(PROMPT);

        // one environment for the whole session, so bindings carry over
        Environment env = new Environment(Builtins.globals());
        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.equals("EXIT") || line.equals("exit") || line.equals("quit")) {
                break;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            CarlaeUtil.debug("tokens", Scanner.tokenize(line).toString());
            try {
                Object value = interpreter.run(line, env);
                out.println(OUTPUT_PREFIX + Printer.stringify(value));
            } catch (CarlaeError error) {
                out.println(errorOutput(error));
                reportError(error);
            }
            out.flush();
        }
    }

    // what the prompt prints for a failed line, ex: "out> CarlaeNameError"
    public static String errorOutput(CarlaeError error) {
        return OUTPUT_PREFIX + error.getClass().getSimpleName();
    }

    static void reportError(CarlaeError error) {
        String where = "";
        if (error.getLine() > 0) {
            where = " [line " + error.getLine() + "]";
        }
        System.err.println(error.kind() + ": " + error.getMessage() + where);
        if (CarlaeUtil.isDebugging("stack") && interpreter.stackDepth() > 0) {
            System.err.println("Stacktrace:");
            System.err.print(interpreter.stacktrace());
        }
    }
}
