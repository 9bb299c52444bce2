package io.github.manjago.talos.generator;

import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable weight state of a generator, identified by the SHA-256 of its serialized form.
 * <p>
 * Format: {@code [int magic][int version][utf kind][int count][count x long raw]}.
 */
public final class GeneratorParameters {

    private static final int MAGIC = 0x544C5347; // "TLSG"
    private static final int VERSION = 1;

    private final String kind;
    private final long[] weights;
    private final byte[] serialized;
    private final String contentHash;

    public GeneratorParameters(@NotNull String kind, long[] rawWeights) {
        for (long w : rawWeights) {
            if (Long.compareUnsigned(w, Goldilocks.P) >= 0) {
                throw new IllegalArgumentException("Weight is not a field element: " + Long.toUnsignedString(w));
            }
        }
        this.kind = kind;
        this.weights = rawWeights.clone();
        this.serialized = serialize(kind, weights);
        this.contentHash = sha256(serialized);
    }

    /**
     * All-zero parameters.
     */
    public static GeneratorParameters zeros(String kind, int count) {
        return new GeneratorParameters(kind, new long[count]);
    }

    public String kind() {
        return kind;
    }

    public int size() {
        return weights.length;
    }

    public Fixed weight(int index) {
        return Fixed.ofRaw(weights[index]);
    }

    public long[] rawWeights() {
        return weights.clone();
    }

    /**
     * Same kind with other weights.
     */
    public GeneratorParameters withWeights(long[] rawWeights) {
        return new GeneratorParameters(kind, rawWeights);
    }

    /**
     * Hex SHA-256 of {@link #toBytes()}.
     */
    public String contentHash() {
        return contentHash;
    }

    public String shortHash() {
        return contentHash.substring(0, 12);
    }

    public byte[] toBytes() {
        return serialized.clone();
    }

    public static GeneratorParameters fromBytes(byte[] bytes) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new IOException("Not generator parameters (magic " + Integer.toHexString(magic) + ")");
            }
            int version = in.readInt();
            if (version != VERSION) {
                throw new IOException("Unsupported parameter format version: " + version);
            }
            String kind = in.readUTF();
            int count = in.readInt();
            if (count < 0 || count > (bytes.length / Long.BYTES)) {
                throw new IOException("Corrupt weight count: " + count);
            }
            long[] weights = new long[count];
            for (int i = 0; i < count; i++) {
                weights[i] = in.readLong();
            }
            return new GeneratorParameters(kind, weights);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt generator parameters", e);
        }
    }

    private static byte[] serialize(String kind, long[] weights) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(16 + kind.length() + weights.length * Long.BYTES);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            out.writeUTF(kind);
            out.writeInt(weights.length);
            for (long w : weights) {
                out.writeLong(w);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static String sha256(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GeneratorParameters other
                && kind.equals(other.kind)
                && Arrays.equals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        return contentHash.hashCode();
    }

    @Override
    public String toString() {
        return kind + "@" + shortHash() + " (" + weights.length + " weights)";
    }
}
