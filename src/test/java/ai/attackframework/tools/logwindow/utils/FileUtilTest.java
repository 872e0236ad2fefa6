package ai.attackframework.tools.logwindow.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FileUtilTest {

    @TempDir
    Path tmp;

    @Test
    void ensureLogExtension_appends_only_when_missing() {
        assertEquals("app.log", FileUtil.ensureLogExtension(new File("app")).getName());
        assertEquals("APP.LOG", FileUtil.ensureLogExtension(new File("APP.LOG")).getName());
        assertEquals(new File("dir", "x.log"), FileUtil.ensureLogExtension(new File("dir", "x")));
        assertNull(FileUtil.ensureLogExtension(null));
    }

    @Test
    void writeStringCreateDirs_creates_parents_and_roundtrips_utf8() throws Exception {
        Path out = tmp.resolve("nested/deeper/out.log");
        FileUtil.writeStringCreateDirs(out, "grüße\n");
        assertEquals("grüße\n", FileUtil.readString(out));
    }
}
