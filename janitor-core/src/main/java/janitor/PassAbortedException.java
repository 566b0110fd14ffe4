package janitor;

/**
 * Thrown when a pass cannot even begin its work because the first required read
 * (authoritative path set, blob listing, partition list, membership window) failed.
 *
 * <p>Per-unit failures never raise this exception; they are recorded in the
 * pass statistics instead.
 */
public final class PassAbortedException extends RuntimeException {
  private final String jobName;

  public PassAbortedException(String jobName, String message, Throwable cause) {
    super(jobName + ": " + message, cause);
    this.jobName = jobName;
  }

  public String jobName() {
    return jobName;
  }
}
