// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import org.jspecify.annotations.Nullable;

import sh.strata.core.types.Hash;

/**
 * A block header as seen through a {@link ChainClient}.
 */
public interface BlockHandle {

    long number();

    Hash hash();

    Hash parentHash();

    /** Header state root, or {@code null} when the client does not expose it. */
    default @Nullable Hash stateRoot() {
        return null;
    }

    /** Header extrinsics root, or {@code null} when the client does not expose it. */
    default @Nullable Hash extrinsicsRoot() {
        return null;
    }
}
