package org.satplan.utils;

import lombok.experimental.UtilityClass;
import org.satplan.exceptions.AccessReportParserException;

import java.io.File;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

@UtilityClass
public class FileUtils {

    public static List<File> getFilteredFilesFromDirectory(Path directoryPath, Predicate<File> filter) {
        final var files = directoryPath.toFile().listFiles();
        if (files == null) {
            throw new AccessReportParserException("Not a readable directory: " + directoryPath.toAbsolutePath());
        }
        return Stream
                .of(files)
                .filter(File::isFile)
                .filter(filter)
                .sorted(Comparator.comparing(File::getName))
                .toList();
    }
}
