// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.strata.core.crypto.Hasher;
import sh.strata.core.error.ChainConnectionException;
import sh.strata.core.model.BlockRecord;
import sh.strata.core.model.DetailedBlockRecord;
import sh.strata.core.model.EventRecord;
import sh.strata.core.model.ExtrinsicRecord;
import sh.strata.core.types.Hash;
import sh.strata.core.types.HexData;

/**
 * Turns a {@link BlockHandle} into a {@link BlockRecord} or {@link DetailedBlockRecord}.
 *
 * <p>
 * Extrinsic identifiers are the {@link Hasher} digest of each encoded extrinsic. The
 * block time comes from the {@link TimestampExtractor}; when it yields nothing, the
 * builder uses the {@link Clock} and logs a warning naming the block, since the record
 * then carries query time rather than block time.
 *
 * <p>
 * The summary's event count is advisory: if enumerating the events of any extrinsic
 * fails, the count is left {@code null} rather than reporting a partial sum. A failure to
 * list the extrinsics themselves fails the build.
 *
 * <p>
 * With an {@link Executor} configured, per-extrinsic event enumeration fans out on it;
 * results are always assembled in on-chain order.
 */
public final class BlockRecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(BlockRecordBuilder.class);

    private final ChainClient client;
    private final Hasher hasher;
    private final FinalityHeuristic finality;
    private final TimestampExtractor timestampExtractor;
    private final Clock clock;
    private final @Nullable Executor executor;

    private BlockRecordBuilder(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client");
        this.hasher = builder.hasher;
        this.finality = builder.finality;
        this.timestampExtractor = builder.timestampExtractor;
        this.clock = builder.clock;
        this.executor = builder.executor;
    }

    public static Builder builder(ChainClient client) {
        return new Builder(client);
    }

    /**
     * Builds the summary record of a block.
     *
     * @param block      the block
     * @param headNumber the head observed by the current query, for the finality flag
     * @return the summary
     * @throws ChainConnectionException if the extrinsics cannot be listed
     */
    public BlockRecord build(BlockHandle block, long headNumber) {
        List<ExtrinsicHandle> extrinsics = fetchExtrinsics(block);

        Integer eventCount;
        try {
            eventCount = countEvents(fetchEvents(extrinsics));
        } catch (ChainConnectionException e) {
            log.debug("Omitting event count for block {}: {}", block.number(), e.getMessage());
            eventCount = null;
        }
        return summarize(block, headNumber, extrinsics, eventCount);
    }

    /**
     * Builds the detailed record of a block: every extrinsic and every event.
     *
     * @param block      the block
     * @param headNumber the head observed by the current query, for the finality flag
     * @return the detailed record
     * @throws ChainConnectionException if extrinsics or any extrinsic's events cannot be listed
     */
    public DetailedBlockRecord buildDetailed(BlockHandle block, long headNumber) {
        List<ExtrinsicHandle> extrinsics = fetchExtrinsics(block);
        List<List<EventHandle>> eventsPerExtrinsic = fetchEvents(extrinsics);

        List<ExtrinsicRecord> extrinsicRecords = new ArrayList<>(extrinsics.size());
        List<EventRecord> eventRecords = new ArrayList<>();
        int eventIndex = 0;
        for (int i = 0; i < extrinsics.size(); i++) {
            ExtrinsicHandle extrinsic = extrinsics.get(i);
            List<EventHandle> events = eventsPerExtrinsic.get(i);

            boolean success = false;
            for (EventHandle event : events) {
                success |= event.isExtrinsicSuccess();
                eventRecords.add(new EventRecord(
                        eventIndex++, extrinsic.index(), event.palletName(), event.variantName()));
            }
            extrinsicRecords.add(toExtrinsicRecord(extrinsic, success));
        }

        BlockRecord basic = summarize(block, headNumber, extrinsics, eventRecords.size());
        return new DetailedBlockRecord(basic, extrinsicRecords, eventRecords);
    }

    public FinalityHeuristic finality() {
        return finality;
    }

    private BlockRecord summarize(
            BlockHandle block, long headNumber, List<ExtrinsicHandle> extrinsics, @Nullable Integer eventCount) {
        List<Hash> transactions = new ArrayList<>(extrinsics.size());
        for (ExtrinsicHandle extrinsic : extrinsics) {
            transactions.add(hashOf(extrinsic));
        }
        return new BlockRecord(
                block.number(),
                block.hash(),
                block.parentHash(),
                timestampOf(block, extrinsics),
                transactions,
                block.stateRoot(),
                block.extrinsicsRoot(),
                extrinsics.size(),
                eventCount,
                finality.isFinalized(block.number(), headNumber));
    }

    private ExtrinsicRecord toExtrinsicRecord(ExtrinsicHandle extrinsic, boolean success) {
        boolean signed = extrinsic.isSigned();
        byte[] signerBytes = signed ? extrinsic.signerBytes() : null;
        return new ExtrinsicRecord(
                extrinsic.index(),
                hashOf(extrinsic),
                signed,
                signerBytes == null ? null : HexData.fromBytes(signerBytes),
                extrinsic.palletName(),
                extrinsic.callName(),
                success);
    }

    private Hash hashOf(ExtrinsicHandle extrinsic) {
        return Hash.fromBytes(hasher.hash256(extrinsic.bytes()));
    }

    private long timestampOf(BlockHandle block, List<ExtrinsicHandle> extrinsics) {
        OptionalLong seconds = timestampExtractor.extractSeconds(extrinsics);
        if (seconds.isPresent()) {
            return seconds.getAsLong();
        }
        long now = clock.instant().getEpochSecond();
        log.warn("No decodable Timestamp.set inherent in block {} ({}); using wall-clock time {}",
                block.number(), block.hash(), now);
        return now;
    }

    private List<ExtrinsicHandle> fetchExtrinsics(BlockHandle block) {
        try {
            return List.copyOf(client.extrinsics(block));
        } catch (RuntimeException e) {
            throw new ChainConnectionException(
                    "Failed to fetch extrinsics of block " + block.number(), block.number(), e);
        }
    }

    private List<List<EventHandle>> fetchEvents(List<ExtrinsicHandle> extrinsics) {
        if (executor == null || extrinsics.size() < 2) {
            List<List<EventHandle>> result = new ArrayList<>(extrinsics.size());
            for (ExtrinsicHandle extrinsic : extrinsics) {
                result.add(eventsOf(extrinsic));
            }
            return result;
        }

        List<CompletableFuture<List<EventHandle>>> futures = new ArrayList<>(extrinsics.size());
        for (ExtrinsicHandle extrinsic : extrinsics) {
            futures.add(CompletableFuture.supplyAsync(() -> eventsOf(extrinsic), executor));
        }
        List<List<EventHandle>> result = new ArrayList<>(futures.size());
        for (CompletableFuture<List<EventHandle>> future : futures) {
            try {
                result.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof ChainConnectionException cce) {
                    throw cce;
                }
                throw new ChainConnectionException("Event enumeration failed", e.getCause());
            }
        }
        return result;
    }

    private List<EventHandle> eventsOf(ExtrinsicHandle extrinsic) {
        try {
            return List.copyOf(client.events(extrinsic));
        } catch (RuntimeException e) {
            throw new ChainConnectionException("Failed to fetch events of extrinsic " + extrinsic.index(), e);
        }
    }

    private static int countEvents(List<List<EventHandle>> eventsPerExtrinsic) {
        int total = 0;
        for (List<EventHandle> events : eventsPerExtrinsic) {
            total += events.size();
        }
        return total;
    }

    /**
     * Builder for {@link BlockRecordBuilder}. Defaults: BLAKE2b-256 hashing, depth-100
     * finality, the {@code Timestamp.set} inherent, the UTC system clock, sequential event
     * enumeration.
     */
    public static final class Builder {
        private final ChainClient client;
        private Hasher hasher = Hasher.blake2b256();
        private FinalityHeuristic finality = new DepthFinalityHeuristic(ResolverConfig.DEFAULT_FINALITY_DEPTH);
        private TimestampExtractor timestampExtractor = new InherentTimestampExtractor();
        private Clock clock = Clock.systemUTC();
        private @Nullable Executor executor;

        private Builder(ChainClient client) {
            this.client = Objects.requireNonNull(client, "client");
        }

        public Builder hasher(Hasher hasher) {
            this.hasher = Objects.requireNonNull(hasher, "hasher");
            return this;
        }

        public Builder finality(FinalityHeuristic finality) {
            this.finality = Objects.requireNonNull(finality, "finality");
            return this;
        }

        public Builder timestampExtractor(TimestampExtractor timestampExtractor) {
            this.timestampExtractor = Objects.requireNonNull(timestampExtractor, "timestampExtractor");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the executor for per-extrinsic event enumeration.
         *
         * @param executor the executor, or {@code null} to enumerate sequentially
         * @return this builder
         */
        public Builder executor(@Nullable Executor executor) {
            this.executor = executor;
            return this;
        }

        public BlockRecordBuilder build() {
            return new BlockRecordBuilder(this);
        }
    }
}
