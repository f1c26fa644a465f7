package io.shieldedchain.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Little-endian integer and CompactSize helpers shared by the transaction and block codecs.
 * Writers append to a {@link ByteArrayOutputStream}; readers consume a {@link ByteBuffer}.
 */
public final class WireCodec {
    private WireCodec() {}

    public static ByteBuffer reader(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    public static void writeInt32(ByteArrayOutputStream out, int v) {
        out.write(v);
        out.write(v >>> 8);
        out.write(v >>> 16);
        out.write(v >>> 24);
    }

    public static void writeUint32(ByteArrayOutputStream out, long v) {
        if (v < 0 || v > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("uint32 out of range: " + v);
        }
        writeInt32(out, (int) v);
    }

    public static void writeInt64(ByteArrayOutputStream out, long v) {
        for (int i = 0; i < 8; i++) {
            out.write((int) (v >>> (8 * i)));
        }
    }

    public static void writeCompactSize(ByteArrayOutputStream out, long size) {
        if (size < 0) {
            throw new IllegalArgumentException("negative size");
        }
        if (size < 253) {
            out.write((int) size);
        } else if (size <= 0xFFFF) {
            out.write(253);
            out.write((int) size);
            out.write((int) (size >>> 8));
        } else if (size <= 0xFFFF_FFFFL) {
            out.write(254);
            writeUint32(out, size);
        } else {
            out.write(255);
            writeInt64(out, size);
        }
    }

    public static void writeBytes(ByteArrayOutputStream out, byte[] v) {
        out.write(v, 0, v.length);
    }

    public static void writeVarBytes(ByteArrayOutputStream out, byte[] v) {
        writeCompactSize(out, v.length);
        writeBytes(out, v);
    }

    public static void writeHash(ByteArrayOutputStream out, Hash h) {
        writeBytes(out, h.bytes());
    }

    public static long readUint32(ByteBuffer buf) {
        return buf.getInt() & 0xFFFF_FFFFL;
    }

    public static long readCompactSize(ByteBuffer buf) {
        int first = buf.get() & 0xff;
        long size;
        if (first < 253) {
            size = first;
        } else if (first == 253) {
            size = buf.getShort() & 0xFFFF;
            if (size < 253) throw new IllegalArgumentException("non-canonical CompactSize");
        } else if (first == 254) {
            size = readUint32(buf);
            if (size <= 0xFFFF) throw new IllegalArgumentException("non-canonical CompactSize");
        } else {
            size = buf.getLong();
            if (size <= 0xFFFF_FFFFL) throw new IllegalArgumentException("non-canonical CompactSize");
        }
        if (size > ProtocolLimits.MAX_BLOCK_SERIALIZED_SIZE) {
            throw new IllegalArgumentException("CompactSize too large: " + size);
        }
        return size;
    }

    public static byte[] readFixed(ByteBuffer buf, int len) {
        if (len < 0 || len > buf.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + buf.remaining() + ")");
        }
        byte[] out = new byte[len];
        buf.get(out);
        return out;
    }

    public static byte[] readVarBytes(ByteBuffer buf) {
        return readFixed(buf, (int) readCompactSize(buf));
    }

    public static Hash readHash(ByteBuffer buf) {
        return new Hash(readFixed(buf, Hash.LENGTH));
    }
}
