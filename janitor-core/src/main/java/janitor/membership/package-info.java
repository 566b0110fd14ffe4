/**
 * Wholesale-refreshed membership set for hot-path lookups.
 *
 * @see janitor.membership.MembershipCache
 */
package janitor.membership;
