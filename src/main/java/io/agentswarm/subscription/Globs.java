package io.agentswarm.subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

public final class Globs {
    private static final Map<String, Pattern> SEGMENT_CACHE = new ConcurrentHashMap<>();

    private Globs() {
    }

    public static String normalize(String path) {
        return path == null ? "" : path.trim().replace('\\', '/');
    }

    public static String literal(String path) {
        String normalized = normalize(path);
        StringBuilder out = new StringBuilder(normalized.length() + 8);
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c == '*' || c == '?' || c == '[') {
                out.append('[').append(c).append(']');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    public static boolean matches(String glob, String path) {
        if (glob == null || glob.isBlank() || path == null || path.isBlank()) {
            return false;
        }
        String g = normalize(glob);
        String p = normalize(path);
        boolean absoluteGlob = g.startsWith("/");
        boolean absolutePath = p.startsWith("/");
        List<String> globParts = split(g);
        List<String> pathParts = split(p);
        if (globParts.isEmpty()) {
            return false;
        }
        if (absoluteGlob) {
            if (!absolutePath || globParts.size() != pathParts.size()) {
                return false;
            }
        } else if (globParts.size() > pathParts.size()) {
            return false;
        }
        int offset = pathParts.size() - globParts.size();
        for (int i = 0; i < globParts.size(); i++) {
            if (!segment(globParts.get(i)).matcher(pathParts.get(offset + i)).matches()) {
                return false;
            }
        }
        return true;
    }

    private static List<String> split(String value) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split("/")) {
            if (!part.isEmpty() && !".".equals(part)) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static Pattern segment(String glob) {
        return SEGMENT_CACHE.computeIfAbsent(glob, g -> Pattern.compile(toRegex(g)));
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else if (c == '[') {
                int close = classEnd(glob, i);
                if (close < 0) {
                    regex.append("\\[");
                    i++;
                } else {
                    regex.append(characterClass(glob.substring(i + 1, close)));
                    i = close + 1;
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return regex.toString();
    }

    private static int classEnd(String glob, int open) {
        int j = open + 1;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        // a leading ']' is a literal member of the class
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        while (j < glob.length() && glob.charAt(j) != ']') {
            j++;
        }
        return j < glob.length() ? j : -1;
    }

    private static String characterClass(String body) {
        StringBuilder out = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("!")) {
            out.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' && k > start && k < body.length() - 1) {
                out.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                out.append(c);
            } else {
                out.append('\\').append(c);
            }
        }
        return out.append(']').toString();
    }
}
