// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

/**
 * One runtime event, identified by its pallet and variant.
 */
public interface EventHandle {

    String palletName();

    String variantName();

    /**
     * Returns whether this is the {@code System.ExtrinsicSuccess} event.
     *
     * @return true for the success marker
     */
    default boolean isExtrinsicSuccess() {
        return "System".equals(palletName()) && "ExtrinsicSuccess".equals(variantName());
    }
}
