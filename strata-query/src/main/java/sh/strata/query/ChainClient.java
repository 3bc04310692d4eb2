// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.util.List;
import java.util.Optional;

import sh.strata.core.types.Hash;

/**
 * The chain access the resolver needs: the current head, a block by hash, and the
 * extrinsics and events inside a block.
 *
 * <p>
 * Implementations typically wrap a node RPC connection. Any failure may surface as an
 * unchecked exception; the resolver wraps it in a
 * {@link sh.strata.core.error.ChainConnectionException} with the original as cause.
 *
 * <p>
 * <strong>Thread Safety:</strong> {@link #events(ExtrinsicHandle)} may be called from
 * several threads at once when the resolver is configured with an executor.
 */
public interface ChainClient {

    /**
     * Fetches the most recent block the client knows of.
     *
     * @return the head block
     */
    BlockHandle head();

    /**
     * Fetches a block by hash.
     *
     * @param hash the block hash
     * @return the block, or empty if the client does not know it
     */
    Optional<BlockHandle> blockAt(Hash hash);

    /**
     * Lists the extrinsics of a block in on-chain order.
     *
     * @param block the block
     * @return its extrinsics
     */
    List<ExtrinsicHandle> extrinsics(BlockHandle block);

    /**
     * Lists the events emitted by one extrinsic.
     *
     * @param extrinsic the extrinsic
     * @return its events in emission order
     */
    List<EventHandle> events(ExtrinsicHandle extrinsic);
}
