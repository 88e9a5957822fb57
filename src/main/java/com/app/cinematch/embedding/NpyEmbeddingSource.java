package com.app.cinematch.embedding;

import com.app.cinematch.exception.DataUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a 2-D float32 or float64 NumPy {@code .npy} file (format versions 1 to 3,
 * C order) into an {@link EmbeddingMatrix}.
 */
@Slf4j
public class NpyEmbeddingSource implements EmbeddingSource {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([<>=|])(f)(\\d+)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,?\\s*\\)");

    private final Path path;

    public NpyEmbeddingSource(Path path) {
        this.path = path;
    }

    @Override
    public EmbeddingMatrix load() {
        if (!Files.isRegularFile(path)) {
            throw new DataUnavailableException("Embedding file not found: " + path);
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DataUnavailableException("Failed to read embedding file " + path, e);
        }

        EmbeddingMatrix matrix = parse(bytes);
        log.info("Read {}x{} embedding matrix from {}", matrix.rows(), matrix.dimension(), path);
        return matrix;
    }

    EmbeddingMatrix parse(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        if (bytes.length < MAGIC.length + 4) {
            throw unreadable("file too short");
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (buffer.get() != MAGIC[i]) {
                throw unreadable("missing NUMPY magic");
            }
        }

        int major = buffer.get() & 0xFF;
        buffer.get(); // minor version
        long headerLength;
        if (major == 1) {
            headerLength = buffer.getShort() & 0xFFFF;
        } else if (major == 2 || major == 3) {
            headerLength = buffer.getInt() & 0xFFFFFFFFL;
        } else {
            throw unreadable("unsupported format version " + major);
        }
        if (headerLength > buffer.remaining()) {
            throw unreadable("truncated header");
        }

        byte[] headerBytes = new byte[(int) headerLength];
        buffer.get(headerBytes);
        String header = new String(headerBytes, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

        Matcher descr = DESCR.matcher(header);
        Matcher fortran = FORTRAN.matcher(header);
        Matcher shape = SHAPE.matcher(header);
        if (!descr.find() || !fortran.find() || !shape.find()) {
            throw unreadable("unrecognized header " + header.trim());
        }
        if ("True".equals(fortran.group(1))) {
            throw unreadable("fortran-ordered arrays are not supported");
        }

        int width = parseHeaderInt(descr.group(3), "element width");
        if (width != Float.BYTES && width != Double.BYTES) {
            throw unreadable("unsupported element width " + width);
        }
        ByteOrder order = ">".equals(descr.group(1)) ? ByteOrder.BIG_ENDIAN
                : "<".equals(descr.group(1)) ? ByteOrder.LITTLE_ENDIAN
                : ByteOrder.nativeOrder();

        int rows = parseHeaderInt(shape.group(1), "row count");
        int dimension = parseHeaderInt(shape.group(2), "dimension");
        if (dimension == 0) {
            throw unreadable("embedding dimension is zero");
        }
        long count = (long) rows * dimension;
        if (count > Integer.MAX_VALUE || count * width > buffer.remaining()) {
            throw unreadable(String.format("shape (%d, %d) does not fit payload of %d bytes",
                    rows, dimension, buffer.remaining()));
        }

        ByteBuffer payload = buffer.slice().order(order);
        float[] data = new float[(int) count];
        if (width == Float.BYTES) {
            payload.asFloatBuffer().get(data);
        } else {
            var doubles = payload.asDoubleBuffer();
            for (int i = 0; i < data.length; i++) {
                data[i] = (float) doubles.get(i);
            }
        }
        return new EmbeddingMatrix(rows, dimension, data);
    }

    // Shape and element width must fit in an int.
    private int parseHeaderInt(String digits, String field) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw unreadable(field + " " + digits + " is out of range", e);
        }
    }

    private DataUnavailableException unreadable(String reason) {
        return new DataUnavailableException("Unreadable embedding file " + path + ": " + reason);
    }

    private DataUnavailableException unreadable(String reason, Throwable cause) {
        return new DataUnavailableException("Unreadable embedding file " + path + ": " + reason, cause);
    }
}
