package com.codeheadsystems.hivemind.server.hive;

import com.codeheadsystems.hivemind.server.store.HiveStorage;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owner of one hive's state. Every read and write of the hive's storage goes through
 * {@link #exclusive}, so operations on the same hive never interleave while different hives
 * proceed independently.
 */
public class Hive {

  private final String hiveId;
  private final HiveStorage storage;
  private final ReentrantLock lock = new ReentrantLock(true);

  /**
   * Instantiates a new Hive.
   *
   * @param hiveId  the hive id
   * @param storage the hive's storage
   */
  public Hive(String hiveId, HiveStorage storage) {
    this.hiveId = hiveId;
    this.storage = storage;
  }

  public String hiveId() {
    return hiveId;
  }

  /**
   * Runs an operation with sole access to the hive's storage. Do not block on I/O inside.
   *
   * @param operation the operation
   * @param <T>       result type
   * @return the operation's result
   */
  public <T> T exclusive(Function<HiveStorage, T> operation) {
    lock.lock();
    try {
      return operation.apply(storage);
    } finally {
      lock.unlock();
    }
  }
}
