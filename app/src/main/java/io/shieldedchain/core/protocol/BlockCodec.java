package io.shieldedchain.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static io.shieldedchain.core.protocol.WireCodec.*;

/** Block wire format: header || CompactSize(tx count) || tx[i]. */
public final class BlockCodec {
    private BlockCodec(){}

    public static byte[] toBytes(Block block) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeBytes(out, block.header().serialize());
        writeCompactSize(out, block.transactions().size());
        for (Transaction tx : block.transactions()) {
            writeBytes(out, tx.serialize());
        }
        return out.toByteArray();
    }

    public static Block fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = reader(bytes);
            BlockHeader header = BlockHeader.read(buf);

            long count = readCompactSize(buf);
            if (count > ProtocolLimits.MAX_TXS_PER_BLOCK) {
                throw new IllegalArgumentException("bad tx count: " + count);
            }
            List<Transaction> txs = new ArrayList<>((int) Math.min(count, 1024));
            for (long i = 0; i < count; i++) {
                txs.add(TransactionCodec.read(buf));
            }
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("Trailing bytes: " + buf.remaining());
            }
            return new Block(header, txs);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block bytes", ex);
        }
    }
}
