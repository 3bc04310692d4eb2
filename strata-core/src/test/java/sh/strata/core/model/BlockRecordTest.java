// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.strata.core.types.Hash;
import sh.strata.core.types.HexData;

class BlockRecordTest {

    private static final Hash HASH = new Hash("0x" + "12".repeat(32));
    private static final Hash PARENT = new Hash("0x" + "ab".repeat(32));

    @Test
    void genesisBlockIsRepresentable() {
        Hash zero = new Hash("0x" + "00".repeat(32));
        BlockRecord genesis = new BlockRecord(0, zero, zero, 1704067200, List.of(), null, null, 0, 0, true);

        assertEquals(0, genesis.number());
        assertTrue(genesis.transactions().isEmpty());
        assertTrue(genesis.finalized());
    }

    @Test
    void transactionsAreDefensivelyCopied() {
        List<Hash> txs = new ArrayList<>(List.of(HASH));
        BlockRecord record = new BlockRecord(1, HASH, PARENT, 0, txs, null, null, 1, null, false);

        txs.add(PARENT);

        assertEquals(1, record.transactions().size());
        assertThrows(UnsupportedOperationException.class, () -> record.transactions().add(PARENT));
    }

    @Test
    void nullTransactionsBecomeEmpty() {
        BlockRecord record = new BlockRecord(1, HASH, PARENT, 0, null, null, null, 0, null, false);
        assertEquals(List.of(), record.transactions());
    }

    @Test
    void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class,
                () -> new BlockRecord(-1, HASH, PARENT, 0, List.of(), null, null, 0, null, false));
        assertThrows(IllegalArgumentException.class,
                () -> new BlockRecord(1, HASH, PARENT, 0, List.of(), null, null, -1, null, false));
        assertThrows(IllegalArgumentException.class,
                () -> new BlockRecord(1, HASH, PARENT, 0, List.of(), null, null, 0, -1, false));
    }

    @Test
    void extrinsicSignerRequiresSignedFlag() {
        HexData signer = new HexData("0xd43593c715fdd31c61141abd04a99fd6822c8558854ccde39a5684e7a56da27d");

        ExtrinsicRecord signed = new ExtrinsicRecord(1, HASH, true, signer, "Balances", "transfer", true);
        assertEquals(signer, signed.signer());

        assertThrows(IllegalArgumentException.class,
                () -> new ExtrinsicRecord(1, HASH, false, signer, "Balances", "transfer", true));
    }

    @Test
    void detailedRecordCopiesLists() {
        BlockRecord basic = new BlockRecord(1, HASH, PARENT, 0, List.of(), null, null, 0, 0, false);
        List<EventRecord> events = new ArrayList<>();
        events.add(new EventRecord(0, 0, "System", "ExtrinsicSuccess"));

        DetailedBlockRecord detailed = new DetailedBlockRecord(basic, List.of(), events);
        events.clear();

        assertEquals(1, detailed.events().size());
    }
}
