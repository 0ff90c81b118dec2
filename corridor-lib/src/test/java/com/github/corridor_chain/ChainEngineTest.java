// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import com.github.corridor_chain.receipt.ChainIntegrityException;
import com.github.corridor_chain.receipt.Receipt;
import com.github.corridor_chain.receipt.ReceiptDraft;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;

import static com.github.corridor_chain.ChainLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChainEngineTest {
  static final Instant T0 = Instant.parse("2025-03-01T00:00:00Z");
  static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);
    LOGGER.setLevel(level);
    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    LOGGER.addHandler(consoleHandler);
    LOGGER.setUseParentHandlers(false);
  }

  static Receipt appendNext(ChainEngine engine, int i) {
    return engine.appendNext("settlement", T0.plusSeconds(i), List.of("sha256:law"), List.of("sha256:rule"), null);
  }

  @Test
  public void journalsGenesisReceiptsAndCheckpoints() {
    final var journal = new TransparentChainJournal();
    final var corridor = CorridorId.random();
    final var engine = ChainEngine.establish(corridor, ContentDigest.zero(), journal, CLOCK);
    for (int i = 0; i < 5; i++) {
      appendNext(engine, i);
    }
    final var checkpoint = engine.checkpoint();

    assertThat(journal.genesis).containsEntry(corridor, ContentDigest.zero());
    assertThat(journal.receipts.get(corridor)).hasSize(5);
    assertThat(journal.receipts.get(corridor).values()).containsExactlyElementsOf(engine.receipts());
    assertThat(journal.readCheckpoints(corridor)).containsExactly(checkpoint);
    assertThat(journal.syncs.get()).isEqualTo(7);
    assertThat(engine.height()).isEqualTo(5);
    assertThat(engine.checkpoints()).containsExactly(checkpoint);
    assertThat(engine.verifyInclusionProof(engine.buildInclusionProof(3))).isTrue();
  }

  @Test
  public void invalidReceiptIsNotJournaled() {
    final var journal = new TransparentChainJournal();
    final var corridor = CorridorId.random();
    final var engine = ChainEngine.establish(corridor, ContentDigest.zero(), journal, CLOCK);
    appendNext(engine, 0);
    final var wrong = new ReceiptDraft("settlement", corridor, 5, T0, engine.finalStateRoot().toHex(),
        List.of(), List.of(), null).seal();
    assertThatThrownBy(() -> engine.append(wrong)).isInstanceOf(ChainIntegrityException.class);
    assertThat(journal.receiptCount(corridor)).isEqualTo(1);
    assertThat(engine.isCrashed()).isFalse();
  }

  @Test
  public void journalFailureCrashesTheEngineWithoutAdvancingTheChain() {
    final var failing = new TransparentChainJournal() {
      boolean broken = false;

      @Override
      public void sync() {
        if (broken) {
          throw new IllegalStateException("disk full");
        }
        super.sync();
      }
    };
    final var engine = ChainEngine.establish(CorridorId.random(), ContentDigest.zero(), failing, CLOCK);
    appendNext(engine, 0);
    final var root = engine.mmrRoot();
    failing.broken = true;
    assertThatThrownBy(() -> appendNext(engine, 1)).hasMessage("disk full");
    assertThat(engine.isCrashed()).isTrue();
    assertThat(engine.height()).isEqualTo(1);
    assertThat(engine.mmrRoot()).isEqualTo(root);
    failing.broken = false;
    assertThatThrownBy(() -> appendNext(engine, 1)).isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("crashed");
  }

  @Test
  public void concurrentWritersNeverBreakTheSequence() throws Exception {
    final var engine = ChainEngine.establish(CorridorId.random(), ContentDigest.zero(),
        new TransparentChainJournal(), CLOCK);
    final int writers = 8;
    final int perWriter = 25;
    final ExecutorService executor = Executors.newFixedThreadPool(writers + 2);
    final var start = new CountDownLatch(1);
    final var futures = new ArrayList<Future<?>>();
    final var heightsSeen = Collections.synchronizedList(new ArrayList<Long>());
    try {
      for (int w = 0; w < writers; w++) {
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < perWriter; i++) {
            appendNext(engine, i);
          }
          return null;
        }));
      }
      for (int r = 0; r < 2; r++) {
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < 100; i++) {
            final var receipts = engine.receipts();
            for (int s = 0; s < receipts.size(); s++) {
              assertThat(receipts.get(s).sequence()).isEqualTo(s);
            }
            heightsSeen.add(engine.height());
          }
          return null;
        }));
      }
      start.countDown();
      for (var future : futures) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(engine.height()).isEqualTo(writers * perWriter);
    assertThat(heightsSeen).allMatch(h -> h >= 0 && h <= writers * perWriter);
    final var receipts = engine.receipts();
    for (int i = 1; i < receipts.size(); i++) {
      assertThat(receipts.get(i).prevRoot()).isEqualTo(receipts.get(i - 1).nextRoot());
    }
  }

  @Test
  public void registryKeepsOneEnginePerCorridor() {
    final var journal = new TransparentChainJournal();
    final var registry = new CorridorRegistry(journal, CLOCK);
    final var a = CorridorId.random();
    final var b = CorridorId.random();
    final var engineA = registry.establish(a, ContentDigest.zero());
    assertThat(registry.open(a, ContentDigest.zero())).isSameAs(engineA);
    assertThatThrownBy(() -> registry.establish(a, ContentDigest.zero())).isInstanceOf(IllegalStateException.class);
    final var engineB = registry.open(b, ContentDigest.zero());
    appendNext(engineA, 0);
    assertThat(engineB.height()).isZero();
    assertThat(registry.corridors()).containsExactlyInAnyOrder(a, b);
    assertThat(registry.engine(b)).containsSame(engineB);
    assertThatThrownBy(() -> registry.register(engineB)).isInstanceOf(IllegalStateException.class);
    assertThat(journal.corridors()).containsExactlyInAnyOrder(a, b);
  }
}
