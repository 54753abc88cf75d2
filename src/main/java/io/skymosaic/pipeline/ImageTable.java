package io.skymosaic.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the image list out of a Montage image table.
 */
public final class ImageTable {
    static final int HEADER_LINES = 3;

    private ImageTable() {
    }

    /**
     * Returns the image paths listed in the table, first occurrence first.
     * Multi-extension images are listed once per extension and collapse to a
     * single entry here.
     */
    public static List<String> readImages(Path table) throws IOException {
        List<String> lines = Files.readAllLines(table, StandardCharsets.ISO_8859_1);
        Set<String> images = new LinkedHashSet<>();
        for (int i = HEADER_LINES; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            String[] tokens = line.split(" ");
            images.add(tokens[tokens.length - 1]);
        }
        return new ArrayList<>(images);
    }

    /**
     * File name of an image path as listed in a table.
     */
    public static String fileName(String image) {
        int slash = image.lastIndexOf('/');
        return slash < 0 ? image : image.substring(slash + 1);
    }
}
