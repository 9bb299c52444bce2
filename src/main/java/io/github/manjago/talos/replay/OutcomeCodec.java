package io.github.manjago.talos.replay;

import io.github.manjago.talos.core.Assembler;
import io.github.manjago.talos.core.Disassembler;
import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.select.OutcomeRecord;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary form of one {@link OutcomeRecord}.
 * <p>
 * Format: {@code [int version][utf blockId][int nodeCount][LENGTH x long tensor]
 * [code baseline][long baselineCost][code chosen][long chosenCost][boolean verified]
 * [utf generatorVersion]}, where code is {@code [int count][count x utf line]}.
 */
public final class OutcomeCodec {

    private static final int VERSION = 1;

    private OutcomeCodec() {
        // Utility class
    }

    public static byte[] encode(OutcomeRecord record) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {

            out.writeInt(VERSION);
            FeatureTensor features = record.features();
            out.writeUTF(features.blockId());
            out.writeInt(features.nodeCount());
            for (long value : features.toRawArray()) {
                out.writeLong(value);
            }

            writeCode(out, record.baseline());
            out.writeLong(record.baselineCost());
            writeCode(out, record.chosen());
            out.writeLong(record.chosenCost());
            out.writeBoolean(record.verified());
            out.writeUTF(record.generatorVersion());

            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @throws IOException if the payload is not a complete record of a known version
     */
    public static OutcomeRecord decode(byte[] payload) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(payload))) {
            int version = in.readInt();
            if (version != VERSION) {
                throw new IOException("Unsupported outcome record version: " + version);
            }
            String blockId = in.readUTF();
            int nodeCount = in.readInt();
            long[] raw = new long[FeatureTensor.LENGTH];
            for (int i = 0; i < raw.length; i++) {
                raw[i] = in.readLong();
            }

            List<Instruction> baseline = readCode(in);
            long baselineCost = in.readLong();
            List<Instruction> chosen = readCode(in);
            long chosenCost = in.readLong();
            boolean verified = in.readBoolean();
            String generatorVersion = in.readUTF();

            return new OutcomeRecord(FeatureTensor.fromRaw(blockId, nodeCount, raw),
                    baseline, baselineCost, chosen, chosenCost, verified, generatorVersion);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid outcome record: " + e.getMessage(), e);
        }
    }

    private static void writeCode(DataOutputStream out, List<Instruction> code) throws IOException {
        List<String> lines = Disassembler.toLines(code);
        out.writeInt(lines.size());
        for (String line : lines) {
            out.writeUTF(line);
        }
    }

    private static List<Instruction> readCode(DataInputStream in) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new IOException("Negative instruction count: " + count);
        }
        List<String> lines = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            lines.add(in.readUTF());
        }
        try {
            return new Assembler().assembleLines(lines);
        } catch (Assembler.AssemblerException e) {
            throw new IOException("Stored code does not assemble: " + e.getMessage(), e);
        }
    }
}
