package com.carlae.lang;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class CarlaeUtil {
    // the value of "()"
    public static final List<Object> EMPTY_LIST = Collections.unmodifiableList(new ArrayList<>());

    // enabled with the -D flag, comma-separated
    static final Map<String, Boolean> debugKeys = new HashMap<>();

    static String readFile(Path path) throws IOException {
        byte[] encoded = Files.readAllBytes(path);
        return new String(encoded, StandardCharsets.UTF_8);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static void enableDebug(String key) {
        debugKeys.put(key, true);
    }

    static boolean isDebugging(String key) {
        return debugKeys.get(key) == (Boolean)true;
    }

    static void debug(String key, String msg) {
        if (isDebugging(key)) {
            System.err.println("[DEBUG] (" + key + "): " + msg);
        }
    }

}
