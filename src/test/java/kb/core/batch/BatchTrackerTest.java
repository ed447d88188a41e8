package kb.core.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.Arrays;
import java.util.List;
import kb.core.errors.ValidationException;
import kb.core.index.FileCounts;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteBatch;
import kb.core.store.RemoteFileCounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchTrackerTest {
  private static final String INDEX_ID = "vs_1";
  private static final String BATCH_ID = "vsfb_1";

  @Mock private KnowledgeStorePort store;

  private BatchTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new BatchTracker(store);
  }

  private static RemoteBatch remoteBatch(String status, long completed, long inProgress, long failed) {
    return new RemoteBatch(
        BATCH_ID,
        INDEX_ID,
        status,
        new RemoteFileCounts(completed, inProgress, failed, 0, completed + inProgress + failed),
        0L);
  }

  @Test
  void enqueue_sendsDistinctNonBlankIds() {
    doReturn(remoteBatch("in_progress", 0, 2, 0))
        .when(store)
        .createBatch(INDEX_ID, List.of("file-1", "file-2"));

    Batch batch = tracker.enqueue(INDEX_ID, Arrays.asList("file-1", " ", null, "file-2", "file-1"));

    assertEquals(BATCH_ID, batch.id());
    assertEquals(BatchStatus.IN_PROGRESS, batch.status());
    assertFalse(batch.isComplete());
    assertEquals(BatchOutcome.PENDING, batch.outcome());
  }

  @Test
  void enqueue_rejectsEmptyFileList() {
    assertThrows(ValidationException.class, () -> tracker.enqueue(INDEX_ID, List.of()));
    assertThrows(ValidationException.class, () -> tracker.enqueue(INDEX_ID, null));
    verify(store, never()).createBatch(anyString(), anyList());
  }

  @Test
  void poll_doesOneFetchPerCall_andStopsFetchingOnceTerminal() {
    doReturn(remoteBatch("in_progress", 0, 1, 0), remoteBatch("completed", 1, 0, 0))
        .when(store)
        .retrieveBatch(INDEX_ID, BATCH_ID);

    Batch first = tracker.poll(INDEX_ID, BATCH_ID);
    Batch second = tracker.poll(INDEX_ID, BATCH_ID);
    Batch third = tracker.poll(INDEX_ID, BATCH_ID);

    assertEquals(BatchStatus.IN_PROGRESS, first.status());
    assertTrue(BatchTracker.isComplete(second));
    assertEquals(BatchOutcome.SUCCEEDED, second.outcome());
    assertSame(second, third);
    verify(store, times(2)).retrieveBatch(INDEX_ID, BATCH_ID);
  }

  @Test
  void poll_neverMovesStatusBackwards() {
    doReturn(remoteBatch("in_progress", 0, 1, 0), remoteBatch("queued", 0, 1, 0))
        .when(store)
        .retrieveBatch(INDEX_ID, BATCH_ID);

    tracker.poll(INDEX_ID, BATCH_ID);
    Batch later = tracker.poll(INDEX_ID, BATCH_ID);

    assertEquals(BatchStatus.IN_PROGRESS, later.status());
  }

  @Test
  void poll_neverLowersTerminalFileCountsWhileRunning() {
    doReturn(remoteBatch("in_progress", 2, 1, 0), remoteBatch("in_progress", 1, 2, 0))
        .when(store)
        .retrieveBatch(INDEX_ID, BATCH_ID);

    Batch first = tracker.poll(INDEX_ID, BATCH_ID);
    Batch second = tracker.poll(INDEX_ID, BATCH_ID);

    assertEquals(FileCounts.of(2, 1, 0, 0), first.fileCounts());
    assertEquals(FileCounts.of(2, 1, 0, 0), second.fileCounts());
    assertEquals(3, second.fileCounts().total());
  }

  @Test
  void mergeCounts_takesPerStatusMaximumAndKeepsTotalConsistent() {
    FileCounts merged =
        BatchTracker.mergeCounts(FileCounts.of(1, 2, 1, 0), FileCounts.of(2, 2, 0, 0));

    assertEquals(FileCounts.of(2, 1, 1, 0), merged);
  }

  @Test
  void poll_cachesTerminalBatchesPerIndex() {
    doReturn(remoteBatch("completed", 1, 0, 0)).when(store).retrieveBatch(INDEX_ID, BATCH_ID);
    doReturn(
            new RemoteBatch(
                BATCH_ID, "vs_other", "in_progress", new RemoteFileCounts(0, 1, 0, 0, 1), 0L))
        .when(store)
        .retrieveBatch("vs_other", BATCH_ID);

    tracker.poll(INDEX_ID, BATCH_ID);
    Batch other = tracker.poll("vs_other", BATCH_ID);

    assertEquals("vs_other", other.indexId());
    assertEquals(BatchStatus.IN_PROGRESS, other.status());
  }

  @Test
  void latestFor_followsMostRecentBatchAndIsDroppedWithIndex() {
    doReturn(remoteBatch("in_progress", 0, 1, 0))
        .when(store)
        .createBatch(INDEX_ID, List.of("file-1"));
    doReturn(remoteBatch("failed", 0, 0, 1)).when(store).retrieveBatch(INDEX_ID, BATCH_ID);

    tracker.enqueue(INDEX_ID, List.of("file-1"));
    tracker.poll(INDEX_ID, BATCH_ID);

    assertEquals(BatchStatus.FAILED, tracker.latestFor(INDEX_ID).orElseThrow().status());
    assertTrue(tracker.latestFor("vs_unknown").isEmpty());

    tracker.forgetIndex(INDEX_ID);

    assertTrue(tracker.latestFor(INDEX_ID).isEmpty());
    tracker.poll(INDEX_ID, BATCH_ID);
    verify(store, times(2)).retrieveBatch(INDEX_ID, BATCH_ID);
  }

  @Test
  void outcome_distinguishesPartialFailure() {
    Batch partial =
        new Batch(BATCH_ID, INDEX_ID, BatchStatus.COMPLETED, FileCounts.of(1, 0, 1, 0), null);
    Batch failed =
        new Batch(BATCH_ID, INDEX_ID, BatchStatus.FAILED, FileCounts.of(0, 0, 2, 0), null);

    assertEquals(BatchOutcome.COMPLETED_WITH_ERRORS, partial.outcome());
    assertEquals(BatchOutcome.FAILED, failed.outcome());
    assertTrue(failed.isComplete());
  }

  @Test
  void fromRemote_treatsUnknownStatusAsRunning() {
    assertEquals(BatchStatus.IN_PROGRESS, BatchStatus.fromRemote("something_new"));
    assertEquals(BatchStatus.IN_PROGRESS, BatchStatus.fromRemote(null));
    assertEquals(BatchStatus.CANCELLED, BatchStatus.fromRemote("cancelling"));
    assertEquals(BatchStatus.EXPIRED, BatchStatus.fromRemote("EXPIRED"));
  }
}
