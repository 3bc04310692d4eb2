// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.strata.core.types.Hash;
import sh.strata.core.types.HexData;

/**
 * One extrinsic of a detailed block.
 *
 * @param index   position in the block
 * @param hash    content hash of the encoded extrinsic
 * @param signed  whether the extrinsic carries a signature
 * @param signer  the signer's account bytes; present if and only if {@code signed}
 * @param pallet  the pallet (module) name
 * @param call    the call name within the pallet
 * @param success whether a {@code System.ExtrinsicSuccess} event was emitted for it
 */
public record ExtrinsicRecord(
        int index,
        Hash hash,
        boolean signed,
        @Nullable HexData signer,
        String pallet,
        String call,
        boolean success) {

    public ExtrinsicRecord {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(pallet, "pallet");
        Objects.requireNonNull(call, "call");
        if (!signed && signer != null) {
            throw new IllegalArgumentException("unsigned extrinsic " + index + " cannot have a signer");
        }
    }
}
