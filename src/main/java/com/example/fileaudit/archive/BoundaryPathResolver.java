package com.example.fileaudit.archive;

import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Resolves stored paths against the allowed root and rejects anything that escapes it.
 * <p>
 * The lexical check ({@code ..} segments, foreign absolute paths) runs before the file system is
 * touched. Existing segments are then checked by real path so a symlink or junction inside the
 * root cannot lead outside it. Escapes are rejected, never clamped.
 */
public final class BoundaryPathResolver {
    private final Path root;

    public BoundaryPathResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path resolve(String input) {
        Path absolute = lexicallyResolve(input);
        Path rootReal;
        try {
            rootReal = root.toRealPath();
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.NOT_FOUND, "Allowed root does not exist: " + root, ex);
        }

        Path current = root;
        for (Path segment : root.relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            Path real;
            try {
                real = current.toRealPath();
            } catch (IOException ex) {
                throw new FileAuditException(ErrorKind.PATH_ESCAPE, "Path cannot be resolved: " + current, ex);
            }
            if (!real.startsWith(rootReal)) {
                throw new FileAuditException(ErrorKind.PATH_ESCAPE,
                        "Path escapes the allowed root through a link: " + current);
            }
        }
        return absolute;
    }

    /**
     * Pure path arithmetic, no file system access.
     */
    Path lexicallyResolve(String input) {
        if (input == null || input.isBlank()) {
            throw new FileAuditException(ErrorKind.PATH_ESCAPE, "Empty path is outside the allowed root.");
        }
        Path raw;
        try {
            raw = Path.of(input);
        } catch (InvalidPathException ex) {
            throw new FileAuditException(ErrorKind.PATH_ESCAPE, "Invalid path: " + input, ex);
        }
        Path absolute = raw.isAbsolute() ? raw.normalize() : root.resolve(raw).normalize();
        if (!absolute.startsWith(root) || absolute.equals(root)) {
            throw new FileAuditException(ErrorKind.PATH_ESCAPE, "Path is outside the allowed root " + root + ": " + input);
        }
        return absolute;
    }
}
