// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import org.jspecify.annotations.Nullable;

/**
 * One extrinsic inside a block, already split into its call metadata by the client.
 */
public interface ExtrinsicHandle {

    /** Position within the block. */
    int index();

    /** The full SCALE-encoded extrinsic, as hashed for its identifier. */
    byte[] bytes();

    boolean isSigned();

    /**
     * Returns the signer's account bytes.
     *
     * @return the signer, or {@code null} for unsigned extrinsics and inherents
     */
    byte @Nullable [] signerBytes();

    String palletName();

    String callName();

    /**
     * Returns the SCALE-encoded call arguments, without the pallet and call indices.
     *
     * @return the encoded arguments, possibly empty
     */
    byte[] callArguments();
}
