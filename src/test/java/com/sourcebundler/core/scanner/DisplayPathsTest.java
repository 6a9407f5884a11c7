package com.sourcebundler.core.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DisplayPathsTest {

    @Test
    @DisplayName("includes the source root's own name after ./")
    void includesRootName() {
        Path root = Path.of("/work/project/src").toAbsolutePath();
        assertEquals("./src/pkg/a.py", DisplayPaths.of(root, root.resolve("pkg/a.py")));
    }

    @Test
    @DisplayName("normalizes a relative, unnormalized root first")
    void normalizesRoot() {
        Path root = Path.of("some/dir/../src");
        Path file = root.toAbsolutePath().normalize().resolve("a.py");
        assertEquals("./src/a.py", DisplayPaths.of(root, file));
    }

    @Test
    @DisplayName("a filesystem root has no name to prepend")
    void filesystemRoot() {
        Path root = Path.of("/").toAbsolutePath();
        assertEquals("./etc/a.py", DisplayPaths.of(root, root.resolve("etc/a.py")));
    }

    @Test
    @DisplayName("sorts by code point, not by locale collation")
    void codePointOrder() {
        var paths = new ArrayList<>(List.of("./src/b.py", "./src/B.py", "./src/a.py", "./src/😀.py",
                "./src/\uFFFD.py", "./src/_x.py"));
        paths.sort(DisplayPaths.CODE_POINT_ORDER);
        assertEquals(List.of("./src/B.py", "./src/_x.py", "./src/a.py", "./src/b.py", "./src/\uFFFD.py",
                "./src/😀.py"), paths);
    }

    @Test
    @DisplayName("a prefix sorts before its extensions")
    void prefixFirst() {
        assertTrue(DisplayPaths.compareCodePoints("./a", "./a/b") < 0);
        assertEquals(0, DisplayPaths.compareCodePoints("./a", "./a"));
    }
}
