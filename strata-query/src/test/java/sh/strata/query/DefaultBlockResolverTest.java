// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.strata.core.error.BlockNotFoundException;
import sh.strata.core.error.ChainConnectionException;
import sh.strata.core.error.InvalidBlockHashException;
import sh.strata.core.error.QueryCancelledException;
import sh.strata.core.error.TraversalDepthExceededException;
import sh.strata.core.model.BlockRecord;
import sh.strata.core.model.DetailedBlockRecord;
import sh.strata.core.model.EventRecord;
import sh.strata.core.model.ExtrinsicRecord;
import sh.strata.core.types.Hash;
import sh.strata.query.cache.BlockCache;
import sh.strata.query.cache.CacheConfig;

/**
 * Unit tests for {@link DefaultBlockResolver} against an in-memory chain with head 1000.
 */
class DefaultBlockResolverTest {

    private static final long HEAD = 1000;

    private TestChain client;
    private BlockResolver resolver;

    @BeforeEach
    void setUp() {
        client = spy(new TestChain(HEAD));
        resolver = BlockResolver.builder(client).build();
    }

    // ==================== getBlockByNumber() ====================

    @Nested
    @DisplayName("getBlockByNumber")
    class ByNumber {

        @Test
        void headIsBuiltWithoutTraversal() {
            BlockRecord record = resolver.getBlockByNumber(HEAD);

            assertEquals(HEAD, record.number());
            assertEquals(TestChain.hashOf(HEAD), record.hash());
            assertEquals(TestChain.hashOf(HEAD - 1), record.parentHash());
            verify(client, never()).blockAt(any());
        }

        @Test
        void resolvesAncestorWithinBound() {
            BlockRecord record = resolver.getBlockByNumber(950);

            assertEquals(950, record.number());
            assertEquals(TestChain.hashOf(950), record.hash());
            assertEquals(TestChain.timestampSecondsOf(950), record.timestamp());
            verify(client, times(50)).blockAt(any());
        }

        @Test
        void deepestReachableBlockTakesExactlyMaxHops() {
            BlockRecord record = resolver.getBlockByNumber(900);

            assertEquals(900, record.number());
            verify(client, times(100)).blockAt(any());
        }

        @Test
        void oneBeyondBoundIsRejectedWithoutTraversal() {
            TraversalDepthExceededException ex =
                    assertThrows(TraversalDepthExceededException.class, () -> resolver.getBlockByNumber(899));

            assertEquals(101, ex.depth());
            assertEquals(100, ex.maxDepth());
            verify(client, never()).blockAt(any());
        }

        @Test
        void customTraversalBound() {
            BlockResolver shallow = BlockResolver.builder(client)
                    .config(ResolverConfig.builder().maxTraverseDepth(10).build())
                    .build();

            assertEquals(990, shallow.getBlockByNumber(990).number());
            assertThrows(TraversalDepthExceededException.class, () -> shallow.getBlockByNumber(989));
        }

        @Test
        void futureBlockIsNotFound() {
            BlockNotFoundException ex =
                    assertThrows(BlockNotFoundException.class, () -> resolver.getBlockByNumber(HEAD + 1));

            assertEquals(BlockNotFoundException.Reason.FUTURE_BLOCK, ex.reason());
        }

        @Test
        void negativeNumberIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> resolver.getBlockByNumber(-1));
            verifyNoInteractions(client);
        }

        @Test
        void genesisIsReachableOnShortChain() {
            TestChain shortChain = new TestChain(5);
            BlockRecord genesis = BlockResolver.builder(shortChain).build().getBlockByNumber(0);

            assertEquals(0, genesis.number());
        }
    }

    // ==================== Failures ====================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void headFailureIsConnectionError() {
            client.headFails = true;

            ChainConnectionException ex =
                    assertThrows(ChainConnectionException.class, () -> resolver.getBlockByNumber(950));

            assertNull(ex.targetNumber());
            assertInstanceOf(IllegalStateException.class, ex.getCause());
        }

        @Test
        void failedHopNamesTargetBlock() {
            client.unreachable.add(960L);

            ChainConnectionException ex =
                    assertThrows(ChainConnectionException.class, () -> resolver.getBlockByNumber(950));

            assertEquals(960L, ex.targetNumber());
            assertEquals("timeout fetching " + TestChain.hashOf(960), ex.getCause().getMessage());
        }

        @Test
        void emptyHopIsConnectionError() {
            client.missing.add(975L);

            ChainConnectionException ex =
                    assertThrows(ChainConnectionException.class, () -> resolver.getBlockByNumber(950));

            assertEquals(975L, ex.targetNumber());
        }

        @Test
        void inconsistentAncestryIsReportedNotPapered() {
            TestChain forked = new TestChain(HEAD, Map.of(960L, 955L));
            BlockResolver forkedResolver = BlockResolver.builder(forked).build();

            BlockNotFoundException ex =
                    assertThrows(BlockNotFoundException.class, () -> forkedResolver.getBlockByNumber(958));

            assertEquals(BlockNotFoundException.Reason.ANCESTRY_MISMATCH, ex.reason());
        }

        @Test
        void extrinsicFailureFailsSummary() {
            client.extrinsicsFail = true;

            assertThrows(ChainConnectionException.class, () -> resolver.getBlockByNumber(HEAD));
        }
    }

    // ==================== Cancellation ====================

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void cancelledBeforeStartMakesNoCalls() {
            CancellationSignal cancelled = CancellationSignal.of(() -> true);

            assertThrows(QueryCancelledException.class, () -> resolver.getBlockByNumber(950, cancelled));
            verifyNoInteractions(client);
        }

        @Test
        void cancelledMidTraversalStopsBeforeNextHop() {
            AtomicInteger checks = new AtomicInteger();
            // head check, then two hops, then cancelled
            CancellationSignal signal = CancellationSignal.of(() -> checks.incrementAndGet() > 3);

            assertThrows(QueryCancelledException.class, () -> resolver.getBlockByNumber(950, signal));

            verify(client, times(1)).head();
            verify(client, times(2)).blockAt(any());
        }

        @Test
        void expiredDeadlineCancels() {
            Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

            assertThrows(QueryCancelledException.class,
                    () -> resolver.getBlockByNumber(950, CancellationSignal.deadline(Duration.ZERO, clock)));
        }

        @Test
        void cancelledHashLookupMakesNoCalls() {
            String hash = TestChain.hashOf(950).value();

            assertThrows(QueryCancelledException.class,
                    () -> resolver.getBlockByHash(hash, CancellationSignal.of(() -> true)));
            verifyNoInteractions(client);
        }
    }

    // ==================== Finality ====================

    @Test
    void finalityFollowsDepthBehindHead() {
        assertFalse(resolver.getBlockByNumber(900).finalized());
        assertFalse(resolver.getBlockByNumber(950).finalized());
        assertFalse(resolver.getBlockByNumber(HEAD).finalized());

        BlockResolver shallowFinality = BlockResolver.builder(client)
                .config(ResolverConfig.builder().finalityDepth(10).build())
                .build();
        assertTrue(shallowFinality.getBlockByNumber(950).finalized());
    }

    @Test
    void blockByHashBehindBoundIsFinal() {
        BlockRecord record = resolver.getBlockByHash(TestChain.hashOf(850).value());

        assertEquals(850, record.number());
        assertTrue(record.finalized());
        verify(client, times(1)).blockAt(any());
        verify(client, times(1)).head();
    }

    // ==================== getBlockByHash() ====================

    @Nested
    @DisplayName("getBlockByHash")
    class ByHash {

        @Test
        void acceptsInputWithoutPrefixInAnyCase() {
            String bare = TestChain.hashOf(990).value().substring(2).toUpperCase();

            BlockRecord record = resolver.getBlockByHash(bare);

            assertEquals(990, record.number());
            assertEquals(TestChain.hashOf(990), record.hash());
        }

        @Test
        void unknownHashIsNotFound() {
            String unknown = "0x" + "ee".repeat(32);

            BlockNotFoundException ex =
                    assertThrows(BlockNotFoundException.class, () -> resolver.getBlockByHash(unknown));

            assertEquals(BlockNotFoundException.Reason.UNKNOWN_HASH, ex.reason());
        }

        @Test
        void malformedHashIsRejectedBeforeAnyCall() {
            InvalidBlockHashException ex =
                    assertThrows(InvalidBlockHashException.class, () -> resolver.getBlockByHash("0x1234"));

            assertEquals("0x1234", ex.input());
            assertThrows(InvalidBlockHashException.class, () -> resolver.getBlockByHash(null));
            assertThrows(InvalidBlockHashException.class, () -> resolver.getBlockByHash("zz".repeat(32)));
            String padded = " " + TestChain.hashOf(5).value() + "\n";
            InvalidBlockHashException paddedEx =
                    assertThrows(InvalidBlockHashException.class, () -> resolver.getBlockByHash(padded));
            assertEquals(padded, paddedEx.input());
            verifyNoInteractions(client);
        }

        @Test
        void fetchFailureIsConnectionError() {
            client.unreachable.add(400L);

            assertThrows(ChainConnectionException.class,
                    () -> resolver.getBlockByHash(TestChain.hashOf(400).value()));
        }
    }

    // ==================== Caching ====================

    @Nested
    @DisplayName("with cache")
    class WithCache {

        private BlockCache cache;
        private BlockResolver cached;

        @BeforeEach
        void setUp() {
            cache = new BlockCache(CacheConfig.defaults());
            cached = BlockResolver.builder(client).cache(cache).build();
        }

        @Test
        void secondLookupIsServedFromCache() {
            BlockRecord first = cached.getBlockByNumber(950);
            clearInvocations(client);

            BlockRecord second = cached.getBlockByNumber(950);

            assertSame(first, second);
            verifyNoInteractions(client);
        }

        @Test
        void numberLookupPopulatesHashIndex() {
            BlockRecord byNumber = cached.getBlockByNumber(950);
            clearInvocations(client);

            BlockRecord byHash = cached.getBlockByHash(TestChain.hashOf(950).value());

            assertEquals(byNumber, byHash);
            verifyNoInteractions(client);
        }

        @Test
        void failedLookupCachesNothing() {
            assertThrows(TraversalDepthExceededException.class, () -> cached.getBlockByNumber(899));

            assertEquals(0, cache.size());
        }

        @Test
        void detailedLookupCachesSummaryButAlwaysFetches() {
            DetailedBlockRecord detailed = cached.getDetailedBlock(990);

            assertEquals(detailed.basic(), cache.getBlockByNumber(990).orElseThrow());

            clearInvocations(client);
            cached.getDetailedBlock(990);
            verify(client, times(1)).head();
        }
    }

    // ==================== getDetailedBlock() ====================

    @Nested
    @DisplayName("getDetailedBlock")
    class Detailed {

        @Test
        void listsExtrinsicsAndEventsInOrder() {
            client.transfersPerBlock = 2;

            DetailedBlockRecord detailed = resolver.getDetailedBlock(990);

            assertEquals(3, detailed.extrinsics().size());
            assertEquals(5, detailed.events().size());
            assertEquals(5, detailed.basic().eventCount());
            assertEquals(3, detailed.basic().extrinsicCount());

            ExtrinsicRecord inherent = detailed.extrinsics().get(0);
            assertFalse(inherent.signed());
            assertNull(inherent.signer());
            assertEquals("Timestamp", inherent.pallet());
            assertTrue(inherent.success());

            ExtrinsicRecord transfer = detailed.extrinsics().get(2);
            assertTrue(transfer.signed());
            assertNotNull(transfer.signer());
            assertEquals("transfer_keep_alive", transfer.call());
            assertEquals(detailed.basic().transactions().get(2), transfer.hash());

            for (int i = 0; i < detailed.events().size(); i++) {
                assertEquals(i, detailed.events().get(i).index());
            }
            EventRecord last = detailed.events().get(4);
            assertEquals(2, last.extrinsicIndex());
            assertEquals("ExtrinsicSuccess", last.event());
        }

        @Test
        void sameBoundsAsSummaryLookup() {
            assertThrows(TraversalDepthExceededException.class, () -> resolver.getDetailedBlock(899));
            assertThrows(BlockNotFoundException.class, () -> resolver.getDetailedBlock(HEAD + 1));
        }

        @Test
        void eventFailureFailsWholeCall() {
            client.eventsFail = true;

            assertThrows(ChainConnectionException.class, () -> resolver.getDetailedBlock(990));
        }

        @Test
        void failedTransfersAreNotSuccessful() {
            client.transfersFail = true;

            DetailedBlockRecord detailed = resolver.getDetailedBlock(HEAD);

            assertTrue(detailed.extrinsics().get(0).success());
            assertFalse(detailed.extrinsics().get(1).success());
        }
    }
}
