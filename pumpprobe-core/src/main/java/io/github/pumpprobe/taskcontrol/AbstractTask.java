/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.pumpprobe.taskcontrol;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Task skeleton. Subclasses implement {@link #process()} and set the status to
 * {@link TaskStatus#FINISHED} when done. Exceptions escaping {@link #process()} put the task into
 * {@link TaskStatus#ERROR}.
 */
public abstract class AbstractTask implements Task {

  private static final Logger logger = Logger.getLogger(AbstractTask.class.getName());

  private final @NotNull Instant moduleCallDate;
  private volatile @NotNull TaskStatus status = TaskStatus.WAITING;
  private volatile @Nullable String errorMessage;

  protected AbstractTask(@NotNull Instant moduleCallDate) {
    this.moduleCallDate = moduleCallDate;
  }

  protected abstract void process();

  @Override
  public final void run() {
    if (isCanceled()) {
      return;
    }
    try {
      process();
    } catch (Exception e) {
      error(e.getMessage() == null ? e.toString() : e.getMessage(), e);
    }
  }

  public @NotNull Instant getModuleCallDate() {
    return moduleCallDate;
  }

  @Override
  public @NotNull TaskStatus getStatus() {
    return status;
  }

  public void setStatus(@NotNull TaskStatus newStatus) {
    this.status = newStatus;
  }

  @Override
  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(@Nullable String errorMessage) {
    this.errorMessage = errorMessage;
  }

  /**
   * Logs the cause and moves the task to {@link TaskStatus#ERROR}.
   */
  public void error(@NotNull String message, @Nullable Throwable cause) {
    logger.log(Level.SEVERE, getTaskDescription() + " failed: " + message, cause);
    setErrorMessage(message);
    setStatus(TaskStatus.ERROR);
  }

  public void error(@NotNull String message) {
    error(message, null);
  }

  @Override
  public void cancel() {
    if (!status.isDone()) {
      setStatus(TaskStatus.CANCELED);
    }
  }

  public boolean isCanceled() {
    return status == TaskStatus.CANCELED;
  }

  public boolean isFinished() {
    return status == TaskStatus.FINISHED;
  }
}
