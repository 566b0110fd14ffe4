package janitor.orphan;

/**
 * Brings relative storage paths into one separator form so that paths recorded
 * by the authoritative store and paths listed from the blob store compare equal.
 */
public final class PathNormalizer {

  private PathNormalizer() {}

  /**
   * Converts every {@code '\'} to {@code '/'}.
   *
   * @param path a relative path
   * @return the path with forward slashes only
   */
  public static String normalize(String path) {
    return path.indexOf('\\') < 0 ? path : path.replace('\\', '/');
  }
}
