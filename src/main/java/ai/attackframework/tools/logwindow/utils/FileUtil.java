package ai.attackframework.tools.logwindow.utils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Small file utilities used by the UI and the launcher. Keeps I/O concerns out of UI code.
 */
public final class FileUtil {

    /** Extension used for saved logs. */
    public static final String LOG_EXTENSION = ".log";

    /**
     * Utility class; not instantiable.
     */
    private FileUtil() {}

    /**
     * Ensure a {@code .log} extension on the provided file name (case-insensitive).
     * <p>
     * @param f file to normalize
     * @return file with .log suffix ensured
     */
    public static File ensureLogExtension(File f) {
        if (f == null) return null;
        String nameLower = f.getName().toLowerCase(Locale.ROOT);
        if (nameLower.endsWith(LOG_EXTENSION)) return f;
        File parent = f.getParentFile();
        return (parent == null)
                ? new File(f.getName() + LOG_EXTENSION)
                : new File(parent, f.getName() + LOG_EXTENSION);
    }

    /**
     * Write UTF-8 text to a file, creating parent directories if necessary.
     * <p>
     * @param file    destination path
     * @param content content to write
     * @throws IOException when writing fails
     */
    public static void writeStringCreateDirs(Path file, String content) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    /**
     * Read UTF-8 text from a file.
     * <p>
     * @param file file to read
     * @return file contents as string
     * @throws IOException when reading fails
     */
    public static String readString(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
