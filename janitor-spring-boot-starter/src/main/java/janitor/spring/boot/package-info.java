/**
 * Spring Boot auto-configuration for janitor.
 *
 * <p>Jobs are enabled per group under the {@code janitor.*} properties; see
 * {@link janitor.spring.boot.JanitorProperties}. The resulting
 * {@link janitor.Janitor} bean follows the application context lifecycle.
 */
package janitor.spring.boot;
