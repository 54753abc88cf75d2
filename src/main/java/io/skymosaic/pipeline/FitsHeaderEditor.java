package io.skymosaic.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Sets a keyword in the primary header of a FITS file in place.
 *
 * <p>FITS headers are 80-byte ASCII cards packed into 2880-byte blocks and
 * closed by an {@code END} card. Replacing an existing card rewrites only the
 * header blocks; adding a card that needs another block rewrites the file.
 */
public final class FitsHeaderEditor {
    static final int CARD = 80;
    static final int BLOCK = 2880;
    private static final int MAX_HEADER_BLOCKS = 1000;

    private FitsHeaderEditor() {
    }

    /**
     * The resampling tool writes {@code EQUINOX = 'J2000.0'}; Montage wants the
     * numeric form.
     */
    public static void normalizeEquinox(Path fits) throws IOException {
        setKeyword(fits, "EQUINOX", "2000.0");
    }

    public static void setKeyword(Path fits, String keyword, String value) throws IOException {
        if (keyword.length() > 8) {
            throw new IllegalArgumentException("FITS keyword longer than 8 characters: " + keyword);
        }
        byte[] header = readPrimaryHeader(fits);
        int cards = header.length / CARD;
        int endCard = -1;
        int target = -1;
        for (int i = 0; i < cards; i++) {
            String name = cardName(header, i);
            if (name.equals("END")) {
                endCard = i;
                break;
            }
            if (target < 0 && name.equals(keyword)) {
                target = i;
            }
        }
        if (endCard < 0) {
            throw new IOException("No END card in primary header of " + fits);
        }

        byte[] card = card(keyword, value);
        byte[] updated;
        if (target >= 0) {
            updated = header.clone();
            System.arraycopy(card, 0, updated, target * CARD, CARD);
        } else {
            int needed = (endCard + 2) * CARD;
            int size = Math.max(header.length, ((needed + BLOCK - 1) / BLOCK) * BLOCK);
            updated = Arrays.copyOf(header, size);
            Arrays.fill(updated, header.length, size, (byte) ' ');
            System.arraycopy(card, 0, updated, endCard * CARD, CARD);
            System.arraycopy(card("END", null), 0, updated, (endCard + 1) * CARD, CARD);
        }

        if (updated.length == header.length) {
            try (FileChannel channel = FileChannel.open(fits, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(updated);
                while (buffer.hasRemaining()) {
                    channel.write(buffer, buffer.position());
                }
            }
            return;
        }
        Path tmp = fits.resolveSibling("." + fits.getFileName() + ".tmp");
        try (InputStream in = Files.newInputStream(fits);
             OutputStream out = Files.newOutputStream(tmp)) {
            in.skipNBytes(header.length);
            out.write(updated);
            in.transferTo(out);
        }
        Files.move(tmp, fits, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Value of a keyword in the primary header, without quotes or comment, or
     * null when absent.
     */
    public static String readKeyword(Path fits, String keyword) throws IOException {
        byte[] header = readPrimaryHeader(fits);
        for (int i = 0; i < header.length / CARD; i++) {
            String name = cardName(header, i);
            if (name.equals("END")) {
                return null;
            }
            if (name.equals(keyword)) {
                String raw = new String(header, i * CARD + 10, CARD - 10, StandardCharsets.US_ASCII);
                int slash = raw.indexOf(" /");
                String value = (slash >= 0 ? raw.substring(0, slash) : raw).strip();
                if (value.startsWith("'") && value.endsWith("'") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1).strip();
                }
                return value;
            }
        }
        return null;
    }

    static byte[] card(String keyword, String value) {
        StringBuilder sb = new StringBuilder(CARD);
        sb.append(keyword);
        while (sb.length() < 8) {
            sb.append(' ');
        }
        if (value != null) {
            sb.append("= ");
            for (int i = value.length(); i < 20; i++) {
                sb.append(' ');
            }
            sb.append(value);
        }
        while (sb.length() < CARD) {
            sb.append(' ');
        }
        return sb.substring(0, CARD).getBytes(StandardCharsets.US_ASCII);
    }

    private static String cardName(byte[] header, int index) {
        return new String(header, index * CARD, 8, StandardCharsets.US_ASCII).strip();
    }

    private static byte[] readPrimaryHeader(Path fits) throws IOException {
        try (InputStream in = Files.newInputStream(fits)) {
            byte[] all = new byte[0];
            for (int blocks = 0; blocks < MAX_HEADER_BLOCKS; blocks++) {
                byte[] block = in.readNBytes(BLOCK);
                if (block.length < BLOCK) {
                    throw new IOException("Truncated FITS header in " + fits);
                }
                all = Arrays.copyOf(all, all.length + BLOCK);
                System.arraycopy(block, 0, all, all.length - BLOCK, BLOCK);
                for (int i = 0; i < BLOCK / CARD; i++) {
                    if (new String(block, i * CARD, 8, StandardCharsets.US_ASCII).strip().equals("END")) {
                        return all;
                    }
                }
            }
            throw new IOException("No END card in the first " + MAX_HEADER_BLOCKS + " header blocks of " + fits);
        }
    }
}
