package org.dxworks.flowframe;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class SourceFileDetector {

    static final List<String> EXTENSIONS = List.of(".pseudo", ".pcode", ".flow");

    public static boolean isPseudocode(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) return false;
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        for (String extension : EXTENSIONS) {
            if (fileName.endsWith(extension)) return true;
        }
        return false;
    }
}
