/**
 * Logging context, metrics and log redaction shared by Switchboard services.
 */
package com.switchboard.observability;
