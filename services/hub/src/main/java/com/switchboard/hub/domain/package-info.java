/**
 * Routing core: tenants, the message router, liveness monitoring and tenant bootstrap.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on the {@code infrastructure} or {@code api} packages
 *   <li>Sockets are reached only through {@link com.switchboard.hub.domain.TerminalConnection}
 *   <li>Scheduling goes through Spring's {@code TaskScheduler} abstraction; probe continuations run
 *       on a caller-supplied {@code Executor}
 * </ul>
 */
package com.switchboard.hub.domain;
