/**
 * Small helpers shared by the background jobs.
 */
package janitor.util;
