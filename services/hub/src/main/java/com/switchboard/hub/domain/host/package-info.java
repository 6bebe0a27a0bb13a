/** The per-tenant host terminal and the services it provides. */
package com.switchboard.hub.domain.host;
