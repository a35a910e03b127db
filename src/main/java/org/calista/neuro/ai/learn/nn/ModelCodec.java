package org.calista.neuro.ai.learn.nn;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Binary weight format.
 *
 * <pre>
 * int    MAGIC ("NQN1")
 * int    VERSION
 * int    layer count + 1, then every layer size
 * double weights, then biases, per layer
 * </pre>
 *
 * Big-endian, as written by {@link DataOutputStream}.
 */
public final class ModelCodec {

    static final int MAGIC = 0x4E514E31;
    static final int VERSION = 1;

    private static final int MAX_LAYER = 1 << 16;

    private ModelCodec() {
    }

    public static byte[] encode(ValueNetwork net) {
        Objects.requireNonNull(net, "net");
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bos)) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            int[] sizes = net.layerSizes();
            out.writeInt(sizes.length);
            for (int s : sizes) out.writeInt(s);
            for (int l = 0; l < net.layerCount(); l++) {
                for (double v : net.weights(l)) out.writeDouble(v);
                for (double v : net.biases(l)) out.writeDouble(v);
            }
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    /**
     * Decodes {@code bytes} into {@code target}. The target keeps its weights if anything is wrong.
     */
    public static void decodeInto(byte[] bytes, ValueNetwork target) throws ModelFormatException {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(target, "target");

        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            int magic = in.readInt();
            if (magic != MAGIC) throw new ModelFormatException("bad magic: 0x" + Integer.toHexString(magic));
            int version = in.readInt();
            if (version != VERSION) throw new ModelFormatException("unsupported version: " + version);

            int n = in.readInt();
            if (n < 2 || n > 64) throw new ModelFormatException("bad layer count: " + n);
            int[] sizes = new int[n];
            for (int i = 0; i < n; i++) {
                sizes[i] = in.readInt();
                if (sizes[i] < 1 || sizes[i] > MAX_LAYER) throw new ModelFormatException("bad layer size: " + sizes[i]);
            }
            if (!Arrays.equals(sizes, target.layerSizes())) {
                throw new ModelFormatException("shape " + Arrays.toString(sizes)
                        + " does not match " + Arrays.toString(target.layerSizes()));
            }

            double[][] ws = new double[n - 1][];
            double[][] bs = new double[n - 1][];
            for (int l = 0; l < n - 1; l++) {
                ws[l] = readDoubles(in, sizes[l] * sizes[l + 1]);
                bs[l] = readDoubles(in, sizes[l + 1]);
            }
            if (in.available() > 0) throw new ModelFormatException("trailing bytes: " + in.available());

            for (int l = 0; l < n - 1; l++) target.setLayer(l, ws[l], bs[l]);
        } catch (EOFException e) {
            throw new ModelFormatException("truncated model", e);
        } catch (ModelFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new ModelFormatException("unreadable model", e);
        }
    }

    private static double[] readDoubles(DataInputStream in, int count) throws IOException {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            double v = in.readDouble();
            if (!Double.isFinite(v)) throw new ModelFormatException("non-finite parameter");
            out[i] = v;
        }
        return out;
    }
}
