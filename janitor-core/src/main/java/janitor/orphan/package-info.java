/**
 * Reconciliation of blob-store contents against the authoritative path record.
 *
 * <p>{@link janitor.orphan.OrphanReconciler} deletes files no record refers to,
 * once they are older than a safety threshold that protects in-flight uploads.
 */
package janitor.orphan;
