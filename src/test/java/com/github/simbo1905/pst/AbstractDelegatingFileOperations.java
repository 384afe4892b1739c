package com.github.simbo1905.pst;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// Counts calls into a wrapped [FileOperations] and hands the target call to a subclass.
/// Also records whether close was reached so tests can check handles are released.
abstract class AbstractDelegatingFileOperations implements FileOperations {

  private static final Logger logger =
      Logger.getLogger(AbstractDelegatingFileOperations.class.getName());

  protected final FileOperations delegate;

  @Getter protected int operationCount = 0;

  @Getter protected final int targetOperation;

  @Getter private boolean closed = false;

  AbstractDelegatingFileOperations(FileOperations delegate, int targetOperation) {
    this.delegate = delegate;
    this.targetOperation = targetOperation;
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "Created %s with targetOperation=%d",
                this.getClass().getSimpleName(), targetOperation));
  }

  /// Behaviour at the target call.
  protected abstract void handleTargetOperation() throws IOException;

  protected void checkOperation() throws IOException {
    operationCount++;
    if (operationCount == targetOperation) {
      logger.log(
          Level.FINE, () -> String.format("TRIGGERING BEHAVIOR at operation %d", operationCount));
      handleTargetOperation();
    }
  }

  @Override
  public void sync() throws IOException {
    checkOperation();
    delegate.sync();
  }

  @Override
  public void readFully(byte[] b) throws IOException {
    checkOperation();
    delegate.readFully(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    checkOperation();
    delegate.write(b, off, len);
  }

  @Override
  public void seek(long pos) throws IOException {
    checkOperation();
    delegate.seek(pos);
  }

  @Override
  public long length() throws IOException {
    checkOperation();
    return delegate.length();
  }

  @Override
  public void setLength(long newLength) throws IOException {
    checkOperation();
    delegate.setLength(newLength);
  }

  @Override
  public void close() throws IOException {
    closed = true;
    checkOperation();
    delegate.close();
  }
}
