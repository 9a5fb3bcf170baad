package io.agentswarm.subscription;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobsTest {

    @Test
    void relativeGlobsMatchTrailingComponents() {
        assertTrue(Globs.matches("src/x.py", "/repo/src/x.py"));
        assertTrue(Globs.matches("*.py", "pkg/mod/file.py"));
        assertTrue(Globs.matches("mod/*.py", "pkg/mod/file.py"));
        assertFalse(Globs.matches("mod/*.py", "pkg/other/file.py"));
        assertFalse(Globs.matches("a/b/c/d.py", "b/c/d.py"));
    }

    @Test
    void absoluteGlobsMatchTheWholePath() {
        assertTrue(Globs.matches("/repo/*.py", "/repo/a.py"));
        assertFalse(Globs.matches("/repo/*.py", "/repo/sub/a.py"));
        assertFalse(Globs.matches("/repo/*.py", "repo/a.py"));
    }

    @Test
    void wildcardsAndClassesStayWithinOneComponent() {
        assertTrue(Globs.matches("fil?.txt", "dir/file.txt"));
        assertFalse(Globs.matches("fil?.txt", "dir/fil/.txt"));
        assertTrue(Globs.matches("[a-c]x.py", "bx.py"));
        assertFalse(Globs.matches("[!a-c]x.py", "bx.py"));
        assertTrue(Globs.matches("[!a-c]x.py", "dx.py"));
        assertTrue(Globs.matches("src\\win.py", "C:\\work\\src\\win.py"));
    }

    @Test
    void literalEscapesGlobCharacters() {
        String glob = Globs.literal("pkg/a[1]*.py");
        assertEquals("pkg/a[[]1][*].py", glob);
        assertTrue(Globs.matches(glob, "/repo/pkg/a[1]*.py"));
        assertFalse(Globs.matches(glob, "/repo/pkg/a1x.py"));
    }

    @Test
    void blankInputsNeverMatch() {
        assertFalse(Globs.matches("", "a.py"));
        assertFalse(Globs.matches("*.py", " "));
        assertFalse(Globs.matches(null, "a.py"));
    }
}
