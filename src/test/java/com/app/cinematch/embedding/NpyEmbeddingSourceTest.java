package com.app.cinematch.embedding;

import com.app.cinematch.exception.DataUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NpyEmbeddingSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void readsFloat32Matrix() throws IOException {
        Path file = write("f4.npy", npy(1, "<f4", false, 2, 3, new double[]{1, 2, 3, 4, 5, 6}));

        EmbeddingMatrix matrix = new NpyEmbeddingSource(file).load();

        assertThat(matrix.rows()).isEqualTo(2);
        assertThat(matrix.dimension()).isEqualTo(3);
        assertThat(matrix.row(1)).containsExactly(4, 5, 6);
    }

    @Test
    void readsFloat64MatrixWithVersion2Header() throws IOException {
        Path file = write("f8.npy", npy(2, "<f8", false, 2, 2, new double[]{0.5, -0.25, 1.5, 2}));

        EmbeddingMatrix matrix = new NpyEmbeddingSource(file).load();

        assertThat(matrix.row(0)).containsExactly(new double[]{0.5, -0.25}, within(1e-7));
        assertThat(matrix.row(1)).containsExactly(new double[]{1.5, 2}, within(1e-7));
    }

    @Test
    void readsBigEndianData() throws IOException {
        Path file = write("be.npy", npy(1, ">f4", false, 1, 2, new double[]{3, -7}));

        assertThat(new NpyEmbeddingSource(file).load().row(0)).containsExactly(3, -7);
    }

    @Test
    void missingFileIsDataUnavailable() {
        NpyEmbeddingSource source = new NpyEmbeddingSource(tempDir.resolve("absent.npy"));

        assertThatThrownBy(source::load)
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void rejectsFileWithoutMagic() throws IOException {
        Path file = write("bad.npy", "definitely not numpy".getBytes(StandardCharsets.US_ASCII));

        assertThatThrownBy(() -> new NpyEmbeddingSource(file).load())
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("magic");
    }

    @Test
    void rejectsFortranOrder() throws IOException {
        Path file = write("fortran.npy", npy(1, "<f4", true, 2, 2, new double[]{1, 2, 3, 4}));

        assertThatThrownBy(() -> new NpyEmbeddingSource(file).load())
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("fortran");
    }

    @Test
    void rejectsTruncatedPayload() throws IOException {
        byte[] full = npy(1, "<f4", false, 2, 3, new double[]{1, 2, 3, 4, 5, 6});
        byte[] truncated = new byte[full.length - 4];
        System.arraycopy(full, 0, truncated, 0, truncated.length);
        Path file = write("short.npy", truncated);

        assertThatThrownBy(() -> new NpyEmbeddingSource(file).load())
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("does not fit");
    }

    @Test
    void rejectsShapeBeyondIntRange() throws IOException {
        Path file = write("huge.npy", npy(1, "<f4", false, "(99999999999999999999, 3)", new double[]{1, 2, 3}));

        assertThatThrownBy(() -> new NpyEmbeddingSource(file).load())
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("row count 99999999999999999999 is out of range");
    }

    @Test
    void rejectsShapeWhoseProductOverflows() throws IOException {
        Path file = write("overflow.npy", npy(1, "<f4", false, "(2147483647, 2147483647)", new double[]{1, 2}));

        assertThatThrownBy(() -> new NpyEmbeddingSource(file).load())
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("does not fit");
    }

    @Test
    void rejectsZeroDimension() throws IOException {
        Path file = write("flat.npy", npy(1, "<f4", false, "(5000000000, 0)", new double[0]));

        assertThatThrownBy(() -> new NpyEmbeddingSource(file).load())
                .isInstanceOf(DataUnavailableException.class);

        Path empty = write("empty.npy", npy(1, "<f4", false, "(4, 0)", new double[0]));
        assertThatThrownBy(() -> new NpyEmbeddingSource(empty).load())
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("dimension is zero");
    }

    private Path write(String name, byte[] content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    private static byte[] npy(int version, String descr, boolean fortran, int rows, int cols, double[] values) {
        return npy(version, descr, fortran, String.format("(%d, %d)", rows, cols), values);
    }

    private static byte[] npy(int version, String descr, boolean fortran, String shape, double[] values) {
        StringBuilder header = new StringBuilder(String.format(
                "{'descr': '%s', 'fortran_order': %s, 'shape': %s, }",
                descr, fortran ? "True" : "False", shape));
        int preamble = version == 1 ? 10 : 12;
        while ((preamble + header.length() + 1) % 64 != 0) {
            header.append(' ');
        }
        header.append('\n');
        byte[] headerBytes = header.toString().getBytes(StandardCharsets.ISO_8859_1);

        int width = descr.endsWith("8") ? 8 : 4;
        ByteBuffer buffer = ByteBuffer.allocate(preamble + headerBytes.length + values.length * width)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) 0x93).put("NUMPY".getBytes(StandardCharsets.US_ASCII));
        buffer.put((byte) version).put((byte) 0);
        if (version == 1) {
            buffer.putShort((short) headerBytes.length);
        } else {
            buffer.putInt(headerBytes.length);
        }
        buffer.put(headerBytes);

        buffer.order(descr.startsWith(">") ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
        for (double value : values) {
            if (width == 8) {
                buffer.putDouble(value);
            } else {
                buffer.putFloat((float) value);
            }
        }
        return buffer.array();
    }
}
