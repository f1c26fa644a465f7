package io.shieldedchain.core.node;

import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.BlockHeader;
import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.OutPoint;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.protocol.TxIn;
import io.shieldedchain.core.protocol.TxOut;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Deterministic genesis block per network. Genesis is trusted, so it carries no solution. */
public final class GenesisBuilder {
    private GenesisBuilder() {}

    static final String MESSAGE = "shielded-chain genesis";

    public static Block build(ConsensusParams params) {
        byte[] msg = (MESSAGE + " " + params.network()).getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream scriptSig = new ByteArrayOutputStream();
        scriptSig.write(msg.length);
        scriptSig.write(msg, 0, msg.length);

        Transaction coinbase = Transaction.builder()
                .input(new TxIn(OutPoint.NULL, new Script(scriptSig.toByteArray())))
                .output(new TxOut(params.subsidy(0), Script.EMPTY))
                .build();
        List<Transaction> txs = List.of(coinbase);

        Block unrooted = new Block(new BlockHeader(
                BlockHeader.CURRENT_VERSION,
                Hash.ZERO,
                Hash.ZERO,
                params.genesisTime(),
                params.powLimitBits(),
                Hash.ZERO,
                null), txs);
        return unrooted.withHeader(unrooted.header().withMerkleRoot(unrooted.computeMerkleRoot()));
    }
}
