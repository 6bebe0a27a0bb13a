/**
 * Tenant key handling and connection authentication.
 *
 * <p>A tenant is identified by an Ed25519 public key. A terminal proves it belongs to the tenant
 * by presenting a signature over the fixed challenge; {@link
 * com.switchboard.security.ConnectionAuthenticator} performs the check before any connection
 * state exists.
 */
package com.switchboard.security;
