/**
 * Root package of the database secrets plugin library.
 *
 * <p>A plugin issues, rotates and revokes short-lived database accounts on behalf of a
 * credential-management host. Package contents:
 *
 * <ul>
 *   <li>{@link com.example.dbplugin.core.contract} – the six-operation {@code Database} contract,
 *       its request and response records, the wire descriptor and the call context.
 *   <li>{@link com.example.dbplugin.core.errors} – the failure signals of the contract.
 *   <li>{@link com.example.dbplugin.core.template} – statement template splitting and placeholder
 *       substitution.
 *   <li>{@link com.example.dbplugin.core.credentials} – username generation within backend
 *       identifier limits.
 *   <li>{@link com.example.dbplugin.core.jdbc} – the HikariCP connection producer, the
 *       transactional executor and the lifecycle engine shared by SQL backends.
 *   <li>{@link com.example.dbplugin.core.sanitizer} – the decorator that removes secrets from
 *       errors before they cross the plugin boundary.
 * </ul>
 */
package com.example.dbplugin.core;
